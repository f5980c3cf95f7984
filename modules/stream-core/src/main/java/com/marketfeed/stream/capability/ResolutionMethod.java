package com.marketfeed.stream.capability;

public enum ResolutionMethod {
  EXACT_MATCH,
  PATTERN_MATCH,
  PROTOCOL_FALLBACK,
  DEFAULT
}
