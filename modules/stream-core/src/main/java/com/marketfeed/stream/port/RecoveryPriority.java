package com.marketfeed.stream.port;

import java.util.Locale;

public enum RecoveryPriority {
  HIGH,
  NORMAL;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
