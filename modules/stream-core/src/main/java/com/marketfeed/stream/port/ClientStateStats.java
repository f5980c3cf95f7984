package com.marketfeed.stream.port;

import java.util.Map;

public record ClientStateStats(
    int totalClients, int totalSubscriptions, Map<String, Integer> clientsByProvider) {
  public ClientStateStats {
    clientsByProvider = clientsByProvider == null ? Map.of() : Map.copyOf(clientsByProvider);
  }
}
