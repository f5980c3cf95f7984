package com.marketfeed.stream.port;

import java.util.List;

public interface SymbolStandardizer {
  /**
   * Maps instrument identifiers between provider and canonical form. Symbols that cannot be
   * mapped are left out of {@link SymbolMappingResult#mappingDetails()}.
   */
  SymbolMappingResult transformSymbols(
      String provider, List<String> symbols, MappingDirection direction);
}
