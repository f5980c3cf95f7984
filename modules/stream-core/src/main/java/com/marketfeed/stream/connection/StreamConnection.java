package com.marketfeed.stream.connection;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/** Handle to one upstream feed. Implementations must be safe for concurrent use. */
public interface StreamConnection {
  String id();

  ConnectionKey key();

  boolean isConnected();

  Instant createdAt();

  /** Time of the last inbound message, or {@code null} when nothing was received yet. */
  Instant lastActiveAt();

  void subscribeSymbols(List<String> symbols);

  void onData(Consumer<JsonNode> handler);

  void onError(Consumer<Throwable> handler);

  void close();
}
