package com.marketfeed.stream.receiver;

import java.util.List;

public record SubscriptionResult(
    String clientId,
    String provider,
    String capability,
    String connectionId,
    List<String> symbols) {
  public SubscriptionResult {
    symbols = symbols == null ? List.of() : List.copyOf(symbols);
  }
}
