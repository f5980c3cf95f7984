package com.marketfeed.stream.recovery;

import java.util.List;

public record ReconnectionSweepResult(
    int providersChecked, List<String> disconnectedProviders, int clientsFlagged) {
  public ReconnectionSweepResult {
    disconnectedProviders =
        disconnectedProviders == null ? List.of() : List.copyOf(disconnectedProviders);
  }
}
