package com.marketfeed.stream.batch;

import com.marketfeed.stream.config.StreamReceiverProperties;
import com.marketfeed.stream.observability.StreamTelemetry;
import com.marketfeed.stream.pipeline.PipelineReport;
import com.marketfeed.stream.pipeline.StreamDataPipeline;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Degraded processing for a group that could not go through the data pipeline. The batch is
 * analysed, a handful of priority items are re-run one by one, and a fallback event is emitted.
 * Never throws.
 */
public class BatchFallbackHandler {
  private static final Logger log = LoggerFactory.getLogger(BatchFallbackHandler.class);

  public static final String REASON_CIRCUIT_OPEN = "circuit_breaker_open";
  public static final String REASON_RETRIES_EXHAUSTED = "retries_exhausted";

  static final String MARKET_UNKNOWN = "UNKNOWN";
  private static final List<String> MARKET_SUFFIXES = List.of("HK", "US", "SH", "SZ");

  private final StreamDataPipeline dataPipeline;
  private final StreamReceiverProperties.Fallback settings;
  private final BatchStatistics statistics;
  private final StreamTelemetry telemetry;

  BatchFallbackHandler(
      StreamDataPipeline dataPipeline,
      StreamReceiverProperties.Fallback settings,
      BatchStatistics statistics,
      StreamTelemetry telemetry) {
    this.dataPipeline = Objects.requireNonNull(dataPipeline, "dataPipeline must not be null");
    this.settings = Objects.requireNonNull(settings, "settings must not be null");
    this.statistics = Objects.requireNonNull(statistics, "statistics must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
  }

  FallbackReport handle(
      String provider, String capability, List<RawUpdate> batch, String reason, Throwable error) {
    List<RawUpdate> items = batch == null ? List.of() : batch;
    String errorMessage = sanitizeMessage(error);
    try {
      FallbackAnalysis analysis = analyze(items);
      PartialRecoveryResult recovery = attemptPartialRecovery(items, reason);
      statistics.recordFallback(recovery.attempted() && recovery.successCount() > 0);

      FallbackReport report =
          new FallbackReport(
              provider, capability, reason, items.size(), analysis, recovery, errorMessage);
      log.error(
          "Batch fallback engaged provider={} capability={} reason={} batchSize={} symbols={} markets={} partialRecoveryAttempted={} recovered={} error={}",
          provider,
          capability,
          reason,
          items.size(),
          analysis.uniqueSymbols().size(),
          analysis.markets(),
          recovery.attempted(),
          recovery.successCount(),
          errorMessage);
      telemetry.onFallback(report);
      return report;
    } catch (RuntimeException ex) {
      log.error(
          "Batch fallback processing failed provider={} capability={} reason={} batchSize={}",
          provider,
          capability,
          reason,
          items.size(),
          ex);
      statistics.recordFallback(false);
      return new FallbackReport(
          provider,
          capability,
          reason,
          items.size(),
          new FallbackAnalysis(items.size(), Set.of(), Set.of(), Set.of(), Set.of()),
          PartialRecoveryResult.skipped("fallback_failed"),
          errorMessage);
    }
  }

  FallbackAnalysis analyze(List<RawUpdate> batch) {
    Set<String> symbols = new LinkedHashSet<>();
    Set<String> providers = new LinkedHashSet<>();
    Set<String> markets = new LinkedHashSet<>();
    Set<String> capabilities = new LinkedHashSet<>();
    for (RawUpdate item : batch) {
      providers.add(item.provider());
      capabilities.add(item.capability());
      for (String symbol : item.symbols()) {
        symbols.add(symbol);
        markets.add(marketOf(symbol));
      }
    }
    return new FallbackAnalysis(batch.size(), symbols, providers, markets, capabilities);
  }

  private PartialRecoveryResult attemptPartialRecovery(List<RawUpdate> batch, String reason) {
    if (REASON_CIRCUIT_OPEN.equals(reason)) {
      return PartialRecoveryResult.skipped("circuit_open");
    }
    if (batch.isEmpty()) {
      return PartialRecoveryResult.skipped("empty_batch");
    }
    if (batch.size() > settings.getPartialRecoveryMaxBatch()) {
      return PartialRecoveryResult.skipped("batch_too_large");
    }

    List<RawUpdate> candidates = selectPriorityItems(batch);
    int successCount = 0;
    List<String> recoveredSymbols = new ArrayList<>();
    for (RawUpdate item : candidates) {
      try {
        PipelineReport report =
            dataPipeline.process(
                item.provider(), item.capability(), List.of(item.payload()), item.symbols());
        successCount++;
        recoveredSymbols.addAll(report.symbols());
      } catch (RuntimeException ex) {
        log.debug(
            "Partial recovery item failed provider={} capability={} symbols={} error={}",
            item.provider(),
            item.capability(),
            item.symbols(),
            sanitizeMessage(ex));
      }
    }
    return new PartialRecoveryResult(
        true, candidates.size(), successCount, recoveredSymbols, null);
  }

  private List<RawUpdate> selectPriorityItems(List<RawUpdate> batch) {
    int limit = Math.max(0, settings.getPartialRecoveryLimit());
    Set<String> prioritySymbols = upperCased(settings.getPrioritySymbols());
    Set<String> priorityMarkets = upperCased(settings.getPriorityMarkets());

    List<RawUpdate> selected = new ArrayList<>();
    for (RawUpdate item : batch) {
      if (selected.size() >= limit) {
        break;
      }
      if (isPriority(item, prioritySymbols, priorityMarkets)) {
        selected.add(item);
      }
    }
    if (selected.isEmpty()) {
      return batch.subList(0, Math.min(limit, batch.size()));
    }
    return selected;
  }

  private static boolean isPriority(
      RawUpdate item, Set<String> prioritySymbols, Set<String> priorityMarkets) {
    for (String symbol : item.symbols()) {
      if (prioritySymbols.contains(symbol.toUpperCase(Locale.ROOT))
          || priorityMarkets.contains(marketOf(symbol))) {
        return true;
      }
    }
    return false;
  }

  static String marketOf(String symbol) {
    if (symbol == null) {
      return MARKET_UNKNOWN;
    }
    String normalized = symbol.toUpperCase(Locale.ROOT);
    for (String suffix : MARKET_SUFFIXES) {
      if (normalized.endsWith("." + suffix)) {
        return suffix;
      }
    }
    return MARKET_UNKNOWN;
  }

  private static Set<String> upperCased(List<String> values) {
    Set<String> result = new LinkedHashSet<>();
    if (values != null) {
      for (String value : values) {
        if (value != null && !value.isBlank()) {
          result.add(value.trim().toUpperCase(Locale.ROOT));
        }
      }
    }
    return result;
  }

  private static String sanitizeMessage(Throwable error) {
    if (error == null) {
      return null;
    }
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return error.getClass().getSimpleName();
    }
    return message.length() > 300 ? message.substring(0, 300) : message;
  }
}
