package com.marketfeed.stream.connection;

import java.util.Map;

public record ConnectionStats(
    int activeConnections,
    int maxConnections,
    Map<String, Integer> connectionsByProvider,
    Map<ConnectionQuality, Integer> connectionsByQuality) {
  public ConnectionStats {
    connectionsByProvider = Map.copyOf(connectionsByProvider);
    connectionsByQuality = Map.copyOf(connectionsByQuality);
  }
}
