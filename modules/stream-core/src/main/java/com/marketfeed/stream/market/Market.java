package com.marketfeed.stream.market;

import java.util.Locale;
import java.util.regex.Pattern;

public enum Market {
  HK,
  US,
  CN,
  SG,
  UNKNOWN;

  private static final Pattern A_SHARE_CODE = Pattern.compile("\\d{6}");
  private static final Pattern ALPHABETIC_TICKER = Pattern.compile("[A-Z]+");

  /** Infers the listing market from the symbol suffix or shape. */
  public static Market of(String symbol) {
    if (symbol == null || symbol.isBlank()) {
      return UNKNOWN;
    }
    String normalized = symbol.trim().toUpperCase(Locale.ROOT);
    if (normalized.endsWith(".HK") || normalized.endsWith(".HKG")) {
      return HK;
    }
    if (normalized.endsWith(".US")
        || normalized.endsWith(".NASDAQ")
        || normalized.endsWith(".NYSE")) {
      return US;
    }
    if (normalized.endsWith(".SH") || normalized.endsWith(".SZ")) {
      return CN;
    }
    if (normalized.endsWith(".SG")) {
      return SG;
    }
    if (A_SHARE_CODE.matcher(normalized).matches()) {
      return CN;
    }
    if (ALPHABETIC_TICKER.matcher(normalized).matches()) {
      return US;
    }
    return UNKNOWN;
  }
}
