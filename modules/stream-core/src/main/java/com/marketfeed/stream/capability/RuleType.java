package com.marketfeed.stream.capability;

/** Canonical transform rule families understood by the transform engine. */
public enum RuleType {
  QUOTE_FIELDS("quote_fields"),
  OPTION_FIELDS("option_fields"),
  FUTURES_FIELDS("futures_fields"),
  FOREX_FIELDS("forex_fields"),
  CRYPTO_FIELDS("crypto_fields"),
  MARKET_DATA_FIELDS("market_data_fields"),
  TRADING_DATA_FIELDS("trading_data_fields"),
  BASIC_INFO_FIELDS("basic_info_fields"),
  COMPANY_INFO_FIELDS("company_info_fields"),
  MARKET_INFO_FIELDS("market_info_fields"),
  HISTORICAL_DATA_FIELDS("historical_data_fields"),
  NEWS_FIELDS("news_fields"),
  ANNOUNCEMENT_FIELDS("announcement_fields");

  private final String code;

  RuleType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
