package com.marketfeed.gateway.recovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.marketfeed.gateway.cache.RedisQuoteCache;
import com.marketfeed.gateway.clients.ClientPushTransport;
import com.marketfeed.stream.pipeline.StreamDataPipeline;
import com.marketfeed.stream.port.RecoveryJob;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays the last cached snapshot of each symbol to a reconnected client, then tells the client
 * which symbols could not be recovered.
 */
public class RecoveryJobProcessor {
  private static final Logger log = LoggerFactory.getLogger(RecoveryJobProcessor.class);

  static final String EVENT_RECOVERY_DATA = "recovery_data";
  static final String EVENT_RECOVERY_COMPLETE = "recovery_complete";

  private final RecoveryJobQueue queue;
  private final RedisQuoteCache quoteCache;
  private final ClientPushTransport transport;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final int drainBatchSize;

  public RecoveryJobProcessor(
      RecoveryJobQueue queue,
      RedisQuoteCache quoteCache,
      ClientPushTransport transport,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      int drainBatchSize) {
    this.queue = Objects.requireNonNull(queue, "queue must not be null");
    this.quoteCache = Objects.requireNonNull(quoteCache, "quoteCache must not be null");
    this.transport = Objects.requireNonNull(transport, "transport must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.drainBatchSize = Math.max(1, drainBatchSize);
  }

  /** Processes up to one batch of queued jobs; returns how many were taken off the queue. */
  public int drain() {
    List<RecoveryJobQueue.QueuedRecoveryJob> jobs = queue.poll(drainBatchSize);
    for (RecoveryJobQueue.QueuedRecoveryJob queued : jobs) {
      String outcome;
      try {
        outcome = process(queued) ? "completed" : "client_offline";
      } catch (RuntimeException ex) {
        outcome = "failed";
        log.error(
            "Recovery job failed jobId={} clientId={} error={}",
            queued.jobId(),
            queued.job().clientId(),
            ex.getMessage());
      }
      meterRegistry
          .counter(
              "stream.recovery.job.processed.total",
              "outcome",
              outcome,
              "priority",
              queued.job().priority().code())
          .increment();
    }
    return jobs.size();
  }

  private boolean process(RecoveryJobQueue.QueuedRecoveryJob queued) {
    RecoveryJob job = queued.job();
    List<String> missing = new ArrayList<>();
    int recovered = 0;
    for (String symbol : job.symbols()) {
      Optional<JsonNode> snapshot =
          quoteCache.getData(StreamDataPipeline.CACHE_KEY_PREFIX + symbol);
      if (snapshot.isEmpty()) {
        missing.add(symbol);
        continue;
      }
      ObjectNode event = objectMapper.createObjectNode();
      event.put("jobId", queued.jobId());
      event.put("symbol", symbol);
      event.set("data", snapshot.get());
      if (!transport.send(job.clientId(), EVENT_RECOVERY_DATA, event)) {
        log.warn(
            "Recovery aborted, client has no open channel jobId={} clientId={}",
            queued.jobId(),
            job.clientId());
        return false;
      }
      recovered++;
    }

    ObjectNode complete = objectMapper.createObjectNode();
    complete.put("jobId", queued.jobId());
    complete.put("recovered", recovered);
    complete.put("from", job.lastReceiveTimestamp());
    ArrayNode missingNode = complete.putArray("missingSymbols");
    missing.forEach(missingNode::add);
    boolean delivered = transport.send(job.clientId(), EVENT_RECOVERY_COMPLETE, complete);
    log.info(
        "Recovery job completed jobId={} clientId={} recovered={} missing={} notified={}",
        queued.jobId(),
        job.clientId(),
        recovered,
        missing.size(),
        delivered);
    return delivered;
  }
}
