package com.marketfeed.stream.receiver;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketfeed.stream.batch.RawUpdate;
import com.marketfeed.stream.batch.StreamBatchPipeline;
import com.marketfeed.stream.connection.ConnectionKey;
import com.marketfeed.stream.connection.StreamConnection;
import com.marketfeed.stream.connection.StreamConnectionManager;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.WeakHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens upstream connections through the connection manager and routes their inbound messages
 * into the batch pipeline. Handlers are attached once per connection instance.
 */
public class StreamIngress {
  private static final Logger log = LoggerFactory.getLogger(StreamIngress.class);

  private final StreamConnectionManager connectionManager;
  private final StreamBatchPipeline batchPipeline;
  private final Clock clock;
  private final Set<StreamConnection> boundConnections =
      Collections.synchronizedSet(Collections.newSetFromMap(new WeakHashMap<>()));

  public StreamIngress(StreamConnectionManager connectionManager, StreamBatchPipeline batchPipeline) {
    this(connectionManager, batchPipeline, Clock.systemUTC());
  }

  StreamIngress(
      StreamConnectionManager connectionManager, StreamBatchPipeline batchPipeline, Clock clock) {
    this.connectionManager =
        Objects.requireNonNull(connectionManager, "connectionManager must not be null");
    this.batchPipeline = Objects.requireNonNull(batchPipeline, "batchPipeline must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public StreamConnection open(
      String provider, String capability, List<String> symbols, String clientId) {
    StreamConnection connection =
        connectionManager.getOrCreateConnection(provider, capability, symbols, clientId);
    if (boundConnections.add(connection)) {
      connection.onData(payload -> accept(connection, payload));
      connection.onError(error -> recordError(connection, error));
    }
    return connection;
  }

  void accept(StreamConnection connection, JsonNode payload) {
    ConnectionKey key = connection.key();
    try {
      connectionManager.recordActivity(key);
      RawUpdate update =
          new RawUpdate(
              payload,
              key.provider(),
              key.capability(),
              clock.instant(),
              PayloadSymbols.extract(payload));
      if (!batchPipeline.offer(update)) {
        log.debug("Inbound update discarded, batch pipeline closed key={}", key);
      }
    } catch (RuntimeException ex) {
      recordError(connection, ex);
      log.warn(
          "Inbound update handling failed key={} connectionId={} error={}",
          key,
          connection.id(),
          ex.getMessage());
    }
  }

  // a replaced connection can still report late errors; those must not count against its successor
  private void recordError(StreamConnection connection, Throwable error) {
    boolean current =
        connectionManager
            .findConnection(connection.key())
            .filter(registered -> registered == connection)
            .isPresent();
    if (!current) {
      log.debug(
          "Ignoring error from retired connection key={} connectionId={}",
          connection.key(),
          connection.id());
      return;
    }
    connectionManager.recordError(connection.key(), error);
  }
}
