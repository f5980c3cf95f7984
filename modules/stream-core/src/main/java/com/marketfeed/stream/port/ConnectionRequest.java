package com.marketfeed.stream.port;

import com.marketfeed.stream.connection.ConnectionKey;
import java.util.List;

public record ConnectionRequest(
    ConnectionKey key, List<String> symbols, String clientId, String requestId) {
  public ConnectionRequest {
    symbols = symbols == null ? List.of() : List.copyOf(symbols);
  }
}
