package com.marketfeed.stream.port;

import java.util.List;
import java.util.Map;

public record SymbolMappingResult(Map<String, String> mappingDetails, List<String> failedSymbols) {
  public SymbolMappingResult {
    mappingDetails = mappingDetails == null ? Map.of() : Map.copyOf(mappingDetails);
    failedSymbols = failedSymbols == null ? List.of() : List.copyOf(failedSymbols);
  }

  public String standardOrOriginal(String symbol) {
    return mappingDetails.getOrDefault(symbol, symbol);
  }
}
