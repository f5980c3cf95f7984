package com.marketfeed.stream.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.marketfeed.stream.capability.CapabilityMapper;
import com.marketfeed.stream.capability.RuleType;
import com.marketfeed.stream.concurrent.NamedDaemonThreadFactory;
import com.marketfeed.stream.config.StreamReceiverProperties;
import com.marketfeed.stream.observability.StreamTelemetry;
import com.marketfeed.stream.port.ClientRegistry;
import com.marketfeed.stream.port.DataTransformer;
import com.marketfeed.stream.port.MappingDirection;
import com.marketfeed.stream.port.QuoteCache;
import com.marketfeed.stream.port.SymbolMappingResult;
import com.marketfeed.stream.port.SymbolStandardizer;
import com.marketfeed.stream.port.TransformRequest;
import com.marketfeed.stream.port.TransformResult;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one (provider, capability) group through transform, symbol standardization, cache write and
 * broadcast. Every collaborator call races its own timeout on the stage executor; a late result is
 * discarded. Cache keys and broadcast targets are taken from the same symbol-to-records map.
 */
public class StreamDataPipeline implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(StreamDataPipeline.class);

  public static final String CACHE_KEY_PREFIX = "quote:";
  public static final String CACHE_MODE = "auto";
  public static final String API_TYPE = "stream";

  private final DataTransformer dataTransformer;
  private final SymbolStandardizer symbolStandardizer;
  private final QuoteCache quoteCache;
  private final ClientRegistry clientRegistry;
  private final CapabilityMapper capabilityMapper;
  private final StreamReceiverProperties.Pipeline settings;
  private final StreamTelemetry telemetry;
  private final Clock clock;
  private final ExecutorService stageExecutor;

  public StreamDataPipeline(
      DataTransformer dataTransformer,
      SymbolStandardizer symbolStandardizer,
      QuoteCache quoteCache,
      ClientRegistry clientRegistry,
      CapabilityMapper capabilityMapper,
      StreamReceiverProperties properties,
      StreamTelemetry telemetry) {
    this(
        dataTransformer,
        symbolStandardizer,
        quoteCache,
        clientRegistry,
        capabilityMapper,
        properties,
        telemetry,
        Clock.systemUTC(),
        Executors.newFixedThreadPool(
            Math.max(1, properties.getPipeline().getStageThreads()),
            new NamedDaemonThreadFactory("stream-pipeline-stage")));
  }

  StreamDataPipeline(
      DataTransformer dataTransformer,
      SymbolStandardizer symbolStandardizer,
      QuoteCache quoteCache,
      ClientRegistry clientRegistry,
      CapabilityMapper capabilityMapper,
      StreamReceiverProperties properties,
      StreamTelemetry telemetry,
      Clock clock,
      ExecutorService stageExecutor) {
    this.dataTransformer =
        Objects.requireNonNull(dataTransformer, "dataTransformer must not be null");
    this.symbolStandardizer =
        Objects.requireNonNull(symbolStandardizer, "symbolStandardizer must not be null");
    this.quoteCache = Objects.requireNonNull(quoteCache, "quoteCache must not be null");
    this.clientRegistry = Objects.requireNonNull(clientRegistry, "clientRegistry must not be null");
    this.capabilityMapper =
        Objects.requireNonNull(capabilityMapper, "capabilityMapper must not be null");
    this.settings = Objects.requireNonNull(properties, "properties must not be null").getPipeline();
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.stageExecutor = Objects.requireNonNull(stageExecutor, "stageExecutor must not be null");
  }

  /**
   * Processes the raw payloads of one group. An empty transform result drops the group without
   * error. Any other stage failure is raised as {@link PipelineStageException}.
   */
  public PipelineReport process(
      String provider, String capability, List<JsonNode> rawPayloads, Collection<String> rawSymbols) {
    long startedNanos = System.nanoTime();
    int quotesCount = rawPayloads == null ? 0 : rawPayloads.size();
    RuleType ruleType = capabilityMapper.mapToRuleType(capability);

    long transformStarted = System.nanoTime();
    TransformResult transformed =
        runStage(
            PipelineStage.TRANSFORM,
            settings.getTransformTimeoutMs(),
            () ->
                dataTransformer.transform(
                    new TransformRequest(provider, API_TYPE, ruleType.code(), rawPayloads)));
    long transformMs = elapsedMs(transformStarted);

    if (transformed == null || transformed.isEmpty()) {
      log.warn(
          "Transform produced no records, dropping group provider={} capability={} ruleType={} quotes={}",
          provider,
          capability,
          ruleType.code(),
          quotesCount);
      PipelineReport report =
          PipelineReport.dropped(provider, capability, quotesCount, transformMs, elapsedMs(startedNanos));
      telemetry.onPipelineCompleted(report);
      return report;
    }
    List<JsonNode> records = transformed.transformedData();

    long symbolStarted = System.nanoTime();
    Set<String> sourceSymbols = sourceSymbols(rawSymbols, records);
    Map<String, Set<String>> aliasesByCanonical = standardizeSymbols(provider, sourceSymbols);
    long symbolMs = elapsedMs(symbolStarted);

    Map<String, ArrayNode> recordsBySymbol = groupRecords(aliasesByCanonical, records);

    long cacheStarted = System.nanoTime();
    runStage(
        PipelineStage.CACHE_WRITE,
        settings.getCacheTimeoutMs(),
        () -> {
          recordsBySymbol.forEach(
              (symbol, symbolRecords) ->
                  quoteCache.setData(CACHE_KEY_PREFIX + symbol, symbolRecords, CACHE_MODE));
          return null;
        });
    long cacheMs = elapsedMs(cacheStarted);

    long broadcastStarted = System.nanoTime();
    long pushTimestamp = clock.millis();
    runStage(
        PipelineStage.BROADCAST,
        settings.getBroadcastTimeoutMs(),
        () -> {
          recordsBySymbol.forEach(
              (symbol, symbolRecords) ->
                  clientRegistry.broadcastToSymbol(
                      symbol, broadcastPayload(symbol, provider, capability, symbolRecords, pushTimestamp)));
          return null;
        });
    long broadcastMs = elapsedMs(broadcastStarted);

    long totalMs = elapsedMs(startedNanos);
    PipelineReport report =
        new PipelineReport(
            provider,
            capability,
            quotesCount,
            new ArrayList<>(recordsBySymbol.keySet()),
            transformMs,
            symbolMs,
            cacheMs,
            broadcastMs,
            totalMs,
            false,
            PipelineReport.throughput(quotesCount, totalMs));
    telemetry.onPipelineCompleted(report);
    log.debug(
        "Pipeline completed provider={} capability={} quotes={} symbols={} transformMs={} symbolMs={} cacheMs={} broadcastMs={} totalMs={}",
        provider,
        capability,
        quotesCount,
        recordsBySymbol.size(),
        transformMs,
        symbolMs,
        cacheMs,
        broadcastMs,
        totalMs);
    return report;
  }

  @Override
  public void close() {
    stageExecutor.shutdownNow();
  }

  private Map<String, Set<String>> standardizeSymbols(String provider, Set<String> sourceSymbols) {
    Map<String, Set<String>> aliasesByCanonical = new LinkedHashMap<>();
    if (sourceSymbols.isEmpty()) {
      return aliasesByCanonical;
    }
    SymbolMappingResult mapping;
    try {
      mapping =
          runStage(
              PipelineStage.SYMBOL_STANDARDIZATION,
              settings.getSymbolTimeoutMs(),
              () ->
                  symbolStandardizer.transformSymbols(
                      provider, List.copyOf(sourceSymbols), MappingDirection.TO_STANDARD));
    } catch (PipelineStageException ex) {
      log.warn(
          "Symbol standardization failed, using raw symbols provider={} symbols={} error={}",
          provider,
          sourceSymbols.size(),
          ex.getMessage());
      mapping = null;
    }
    for (String symbol : sourceSymbols) {
      String canonical = mapping == null ? symbol : mapping.standardOrOriginal(symbol);
      Set<String> aliases = aliasesByCanonical.computeIfAbsent(canonical, ignored -> new LinkedHashSet<>());
      aliases.add(canonical);
      aliases.add(symbol);
    }
    return aliasesByCanonical;
  }

  private static Map<String, ArrayNode> groupRecords(
      Map<String, Set<String>> aliasesByCanonical, List<JsonNode> records) {
    Map<String, ArrayNode> recordsBySymbol = new LinkedHashMap<>();
    aliasesByCanonical.forEach(
        (canonical, aliases) -> {
          ArrayNode matching = JsonNodeFactory.instance.arrayNode();
          for (JsonNode record : records) {
            String recordSymbol = recordSymbol(record);
            if (recordSymbol != null && aliases.contains(recordSymbol)) {
              matching.add(record);
            }
          }
          if (!matching.isEmpty()) {
            recordsBySymbol.put(canonical, matching);
          }
        });
    return recordsBySymbol;
  }

  private static Set<String> sourceSymbols(Collection<String> rawSymbols, List<JsonNode> records) {
    Set<String> symbols = new LinkedHashSet<>();
    if (rawSymbols != null) {
      for (String symbol : rawSymbols) {
        if (symbol != null && !symbol.isBlank()) {
          symbols.add(symbol);
        }
      }
    }
    if (symbols.isEmpty()) {
      for (JsonNode record : records) {
        String recordSymbol = recordSymbol(record);
        if (recordSymbol != null) {
          symbols.add(recordSymbol);
        }
      }
    }
    return symbols;
  }

  private static String recordSymbol(JsonNode record) {
    if (record == null) {
      return null;
    }
    JsonNode symbol = record.hasNonNull("symbol") ? record.get("symbol") : record.get("s");
    if (symbol == null || !symbol.isTextual() || symbol.asText().isBlank()) {
      return null;
    }
    return symbol.asText();
  }

  private static ObjectNode broadcastPayload(
      String symbol, String provider, String capability, ArrayNode records, long pushTimestamp) {
    ObjectNode payload = JsonNodeFactory.instance.objectNode();
    payload.put("symbol", symbol);
    payload.set("data", records);
    ObjectNode metadata = payload.putObject("_metadata");
    metadata.put("pushTimestamp", pushTimestamp);
    metadata.put("symbol", symbol);
    metadata.put("provider", provider);
    metadata.put("capability", capability);
    return payload;
  }

  private <T> T runStage(PipelineStage stage, long timeoutMs, Supplier<T> call) {
    try {
      return CompletableFuture.supplyAsync(call, stageExecutor)
          .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
          .join();
    } catch (CompletionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof PipelineStageException stageException) {
        throw stageException;
      }
      if (cause instanceof TimeoutException) {
        throw new PipelineStageException(
            stage,
            PipelineErrorCategory.TIMEOUT_ERROR,
            stage.label() + " stage timed out after " + timeoutMs + " ms",
            cause);
      }
      throw stageFailure(stage, cause);
    } catch (RuntimeException ex) {
      throw stageFailure(stage, ex);
    }
  }

  private static PipelineStageException stageFailure(PipelineStage stage, Throwable cause) {
    return new PipelineStageException(
        stage, stage.label() + " stage failed: " + sanitizeMessage(cause), cause);
  }

  private static long elapsedMs(long startedNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
  }

  private static String sanitizeMessage(Throwable error) {
    String message = error == null ? null : error.getMessage();
    if (message == null || message.isBlank()) {
      return error == null ? "unknown error" : error.getClass().getSimpleName();
    }
    return message.length() > 300 ? message.substring(0, 300) : message;
  }
}
