package com.marketfeed.stream.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketfeed.stream.connection.ConnectionKey;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** One inbound upstream message waiting for the next batch drain. */
public record RawUpdate(
    JsonNode payload, String provider, String capability, Instant receivedAt, List<String> symbols) {
  public RawUpdate {
    Objects.requireNonNull(payload, "payload must not be null");
    Objects.requireNonNull(provider, "provider must not be null");
    Objects.requireNonNull(capability, "capability must not be null");
    Objects.requireNonNull(receivedAt, "receivedAt must not be null");
    symbols = symbols == null ? List.of() : List.copyOf(symbols);
  }

  public ConnectionKey key() {
    return ConnectionKey.of(provider, capability);
  }
}
