package com.marketfeed.stream.batch;

import java.util.List;

public record PartialRecoveryResult(
    boolean attempted,
    int attemptedItems,
    int successCount,
    List<String> recoveredSymbols,
    String skipReason) {
  public PartialRecoveryResult {
    recoveredSymbols = recoveredSymbols == null ? List.of() : List.copyOf(recoveredSymbols);
  }

  public static PartialRecoveryResult skipped(String skipReason) {
    return new PartialRecoveryResult(false, 0, 0, List.of(), skipReason);
  }
}
