package com.marketfeed.stream.connection;

import java.util.Locale;

public enum MemoryPressure {
  NORMAL,
  WARNING,
  CRITICAL;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
