package com.marketfeed.stream.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketfeed.stream.concurrent.NamedDaemonThreadFactory;
import com.marketfeed.stream.config.StreamReceiverProperties;
import com.marketfeed.stream.connection.ConnectionKey;
import com.marketfeed.stream.error.CircuitOpenException;
import com.marketfeed.stream.observability.StreamTelemetry;
import com.marketfeed.stream.pipeline.PipelineErrorCategory;
import com.marketfeed.stream.pipeline.PipelineReport;
import com.marketfeed.stream.pipeline.StreamDataPipeline;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Buffers raw updates into time-boxed batches, groups each drained batch by (provider, capability)
 * and drives the groups concurrently through the data pipeline with retry and circuit breaking.
 * Groups that cannot be processed degrade to {@link BatchFallbackHandler}; nothing is thrown past
 * {@link #processBatch(List)}.
 */
public class StreamBatchPipeline implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(StreamBatchPipeline.class);
  private static final long SHUTDOWN_GRACE_MS = 5_000L;

  private final StreamDataPipeline dataPipeline;
  private final StreamReceiverProperties properties;
  private final StreamTelemetry telemetry;
  private final Clock clock;
  private final Sleeper sleeper;
  private final ScheduledExecutorService bufferScheduler;
  private final ExecutorService batchExecutor;
  private final ExecutorService groupExecutor;

  private final CircuitBreaker circuitBreaker;
  private final BatchStatistics statistics = new BatchStatistics();
  private final BatchFallbackHandler fallbackHandler;
  private final AdaptiveBatchInterval adaptiveInterval;

  private final Object bufferLock = new Object();
  private volatile BatchBuffer<RawUpdate> buffer;
  private volatile boolean closed;

  public StreamBatchPipeline(
      StreamDataPipeline dataPipeline, StreamReceiverProperties properties, StreamTelemetry telemetry) {
    this(
        dataPipeline,
        properties,
        telemetry,
        Clock.systemUTC(),
        duration -> Thread.sleep(duration.toMillis()),
        Executors.newSingleThreadScheduledExecutor(
            new NamedDaemonThreadFactory("stream-batch-buffer")),
        Executors.newFixedThreadPool(
            Math.max(1, properties.getBatch().getWorkerThreads()),
            new NamedDaemonThreadFactory("stream-batch-worker")),
        Executors.newFixedThreadPool(
            Math.max(1, properties.getBatch().getGroupThreads()),
            new NamedDaemonThreadFactory("stream-batch-group")));
  }

  StreamBatchPipeline(
      StreamDataPipeline dataPipeline,
      StreamReceiverProperties properties,
      StreamTelemetry telemetry,
      Clock clock,
      Sleeper sleeper,
      ScheduledExecutorService bufferScheduler,
      ExecutorService batchExecutor,
      ExecutorService groupExecutor) {
    this.dataPipeline = Objects.requireNonNull(dataPipeline, "dataPipeline must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.bufferScheduler = Objects.requireNonNull(bufferScheduler, "bufferScheduler must not be null");
    this.batchExecutor = Objects.requireNonNull(batchExecutor, "batchExecutor must not be null");
    this.groupExecutor = Objects.requireNonNull(groupExecutor, "groupExecutor must not be null");

    StreamReceiverProperties.CircuitBreaker breaker = properties.getCircuitBreaker();
    this.circuitBreaker =
        new CircuitBreaker(
            breaker.getThresholdPercent(),
            Duration.ofMillis(breaker.getResetTimeoutMs()),
            telemetry,
            clock);
    this.fallbackHandler =
        new BatchFallbackHandler(dataPipeline, properties.getFallback(), statistics, telemetry);

    StreamReceiverProperties.Batch batch = properties.getBatch();
    this.adaptiveInterval =
        batch.getDynamic().isEnabled()
            ? new AdaptiveBatchInterval(batch.getDynamic(), batch.getIntervalMs(), clock.millis())
            : null;
    long initialInterval =
        adaptiveInterval == null ? batch.getIntervalMs() : adaptiveInterval.currentIntervalMs();
    this.buffer = newBuffer(initialInterval);
  }

  /** Queues an update for the current window; returns {@code false} once the pipeline is closed. */
  public boolean offer(RawUpdate update) {
    Objects.requireNonNull(update, "update must not be null");
    if (closed) {
      return false;
    }
    if (buffer.offer(update)) {
      return true;
    }
    // The window was rebuilt between the read and the offer.
    return !closed && buffer.offer(update);
  }

  /** Processes one drained batch synchronously. Never throws. */
  public BatchOutcome processBatch(List<RawUpdate> batch) {
    if (batch == null || batch.isEmpty()) {
      return BatchOutcome.empty();
    }
    long startedNanos = System.nanoTime();
    Map<ConnectionKey, List<RawUpdate>> groups =
        batch.stream()
            .collect(
                Collectors.groupingBy(RawUpdate::key, LinkedHashMap::new, Collectors.toList()));

    List<CompletableFuture<GroupOutcome>> pending = new ArrayList<>(groups.size());
    for (Map.Entry<ConnectionKey, List<RawUpdate>> group : groups.entrySet()) {
      pending.add(submitGroup(group.getKey(), group.getValue()));
    }
    List<GroupOutcome> outcomes = new ArrayList<>(pending.size());
    for (CompletableFuture<GroupOutcome> future : pending) {
      outcomes.add(future.join());
    }

    long durationNanos = System.nanoTime() - startedNanos;
    long durationMs = TimeUnit.NANOSECONDS.toMillis(durationNanos);
    statistics.recordBatch(batch.size(), durationMs);
    if (adaptiveInterval != null) {
      adaptiveInterval.recordBatch(clock.millis());
    }
    telemetry.onBatchProcessed(batch.size(), groups.size(), durationNanos);

    BatchOutcome outcome = new BatchOutcome(batch.size(), outcomes, durationMs);
    log.debug(
        "Batch processed size={} groups={} fallbacks={} durationMs={}",
        batch.size(),
        groups.size(),
        outcome.fallbackCount(),
        durationMs);
    return outcome;
  }

  /**
   * Runs one cycle of the adaptive window loop. A changed window replaces the buffer; the items of
   * the previous window are drained into processing first.
   */
  public Optional<IntervalAdjustment> adjustBatchInterval() {
    if (adaptiveInterval == null || closed) {
      return Optional.empty();
    }
    Optional<IntervalAdjustment> adjustment = adaptiveInterval.adjust();
    adjustment.ifPresent(
        applied -> {
          rebuildBuffer(applied.currentIntervalMs());
          telemetry.onBatchIntervalAdjusted(
              applied.previousIntervalMs(),
              applied.currentIntervalMs(),
              applied.averageBatchesPerSecond());
          log.info(
              "Batch interval adjusted previousMs={} currentMs={} averageBatchesPerSecond={}",
              applied.previousIntervalMs(),
              applied.currentIntervalMs(),
              String.format("%.2f", applied.averageBatchesPerSecond()));
        });
    return adjustment;
  }

  public long currentIntervalMs() {
    return buffer.intervalMs();
  }

  public int pendingUpdates() {
    return buffer.pendingCount();
  }

  public BatchStats stats() {
    return statistics.snapshot(currentIntervalMs());
  }

  public CircuitBreakerState circuitBreakerState() {
    return circuitBreaker.snapshot();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    buffer.close();
    bufferScheduler.shutdownNow();
    batchExecutor.shutdown();
    try {
      if (!batchExecutor.awaitTermination(SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS)) {
        log.warn("Batch workers did not finish within graceMs={}", SHUTDOWN_GRACE_MS);
        batchExecutor.shutdownNow();
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      batchExecutor.shutdownNow();
    }
    groupExecutor.shutdownNow();
  }

  private CompletableFuture<GroupOutcome> submitGroup(ConnectionKey key, List<RawUpdate> updates) {
    try {
      return CompletableFuture.supplyAsync(() -> processGroup(key, updates), groupExecutor)
          .exceptionally(
              error -> {
                log.error(
                    "Group processing failed unexpectedly key={} size={}", key, updates.size(), error);
                return GroupOutcome.fallback(
                    key,
                    updates.size(),
                    0,
                    fallbackHandler.handle(
                        key.provider(),
                        key.capability(),
                        updates,
                        BatchFallbackHandler.REASON_RETRIES_EXHAUSTED,
                        error));
              });
    } catch (RejectedExecutionException ex) {
      return CompletableFuture.completedFuture(processGroup(key, updates));
    }
  }

  GroupOutcome processGroup(ConnectionKey key, List<RawUpdate> updates) {
    String provider = key.provider();
    String capability = key.capability();
    try {
      circuitBreaker.acquirePermission();
    } catch (CircuitOpenException open) {
      log.warn(
          "Circuit breaker open, routing group to fallback key={} size={}", key, updates.size());
      return GroupOutcome.fallback(
          key,
          updates.size(),
          0,
          fallbackHandler.handle(
              provider, capability, updates, BatchFallbackHandler.REASON_CIRCUIT_OPEN, open));
    }

    List<JsonNode> payloads = new ArrayList<>(updates.size());
    Set<String> symbols = new LinkedHashSet<>();
    for (RawUpdate update : updates) {
      payloads.add(update.payload());
      symbols.addAll(update.symbols());
    }

    int maxAttempts = Math.max(1, properties.getRetry().getMaxAttempts());
    RuntimeException lastError = null;
    int attempt = 1;
    for (; attempt <= maxAttempts; attempt++) {
      try {
        PipelineReport report = dataPipeline.process(provider, capability, payloads, symbols);
        circuitBreaker.recordSuccess();
        return GroupOutcome.completed(key, updates.size(), attempt, report);
      } catch (RuntimeException ex) {
        lastError = ex;
        circuitBreaker.recordFailure();
        PipelineErrorCategory category = PipelineErrorCategory.classify(ex);
        telemetry.onPipelineFailure(provider, capability, category);
        log.warn(
            "Pipeline attempt failed key={} attempt={} maxAttempts={} errorType={} error={}",
            key,
            attempt,
            maxAttempts,
            category.code(),
            ex.getMessage());
        if (attempt < maxAttempts && !backoff(attempt)) {
          break;
        }
      }
    }

    return GroupOutcome.fallback(
        key,
        updates.size(),
        Math.min(attempt, maxAttempts),
        fallbackHandler.handle(
            provider,
            capability,
            updates,
            BatchFallbackHandler.REASON_RETRIES_EXHAUSTED,
            lastError));
  }

  static long retryDelayMs(long delayBaseMs, int attempt) {
    return delayBaseMs * (1L << Math.min(30, attempt - 1));
  }

  private boolean backoff(int attempt) {
    long delayMs = retryDelayMs(properties.getRetry().getDelayBaseMs(), attempt);
    if (delayMs <= 0) {
      return true;
    }
    try {
      sleeper.sleep(Duration.ofMillis(delayMs));
      return true;
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void rebuildBuffer(long intervalMs) {
    BatchBuffer<RawUpdate> previous;
    synchronized (bufferLock) {
      previous = buffer;
      buffer = newBuffer(intervalMs);
    }
    previous.close();
  }

  private BatchBuffer<RawUpdate> newBuffer(long intervalMs) {
    return new BatchBuffer<>(
        intervalMs, properties.getBatch().getMaxBufferSize(), bufferScheduler, this::dispatch);
  }

  private void dispatch(List<RawUpdate> batch) {
    try {
      batchExecutor.execute(() -> processBatch(batch));
    } catch (RejectedExecutionException ex) {
      log.warn("Batch dropped, workers unavailable size={}", batch.size());
    }
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
