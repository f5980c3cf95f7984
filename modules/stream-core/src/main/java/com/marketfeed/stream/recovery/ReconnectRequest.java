package com.marketfeed.stream.recovery;

import java.util.List;

public record ReconnectRequest(
    String clientId,
    long lastReceiveTimestamp,
    List<String> symbols,
    String capability,
    String preferredProvider,
    String reason) {
  public ReconnectRequest {
    symbols = symbols == null ? List.of() : List.copyOf(symbols);
  }
}
