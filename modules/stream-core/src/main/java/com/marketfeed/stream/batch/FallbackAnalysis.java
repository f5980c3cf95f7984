package com.marketfeed.stream.batch;

import java.util.Set;

public record FallbackAnalysis(
    int batchSize,
    Set<String> uniqueSymbols,
    Set<String> providers,
    Set<String> markets,
    Set<String> capabilities) {
  public FallbackAnalysis {
    uniqueSymbols = uniqueSymbols == null ? Set.of() : Set.copyOf(uniqueSymbols);
    providers = providers == null ? Set.of() : Set.copyOf(providers);
    markets = markets == null ? Set.of() : Set.copyOf(markets);
    capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
  }
}
