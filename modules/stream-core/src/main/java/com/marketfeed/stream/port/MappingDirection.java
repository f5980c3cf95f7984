package com.marketfeed.stream.port;

public enum MappingDirection {
  TO_STANDARD,
  FROM_STANDARD
}
