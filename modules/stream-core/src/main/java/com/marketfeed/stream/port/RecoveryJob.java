package com.marketfeed.stream.port;

import java.util.List;

public record RecoveryJob(
    String clientId,
    List<String> symbols,
    long lastReceiveTimestamp,
    String provider,
    String capability,
    RecoveryPriority priority) {
  public RecoveryJob {
    symbols = symbols == null ? List.of() : List.copyOf(symbols);
  }
}
