package com.marketfeed.stream.port;

import java.util.Set;

public record ClientSubscription(
    String clientId, Set<String> symbols, String provider, String capability) {
  public ClientSubscription {
    symbols = symbols == null ? Set.of() : Set.copyOf(symbols);
  }
}
