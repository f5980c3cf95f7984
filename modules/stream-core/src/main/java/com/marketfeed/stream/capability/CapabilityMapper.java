package com.marketfeed.stream.capability;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a feed capability identifier to the transform rule type. Resolution runs an exact table
 * lookup, then ordered keyword patterns over the lower-cased name, then the protocol prefix, and
 * finally falls back to {@link RuleType#QUOTE_FIELDS}.
 */
public class CapabilityMapper {
  private static final Logger log = LoggerFactory.getLogger(CapabilityMapper.class);

  private static final Map<String, RuleType> KNOWN_CAPABILITIES =
      Map.ofEntries(
          Map.entry("ws-stock-quote", RuleType.QUOTE_FIELDS),
          Map.entry("ws-option-quote", RuleType.OPTION_FIELDS),
          Map.entry("ws-futures-quote", RuleType.FUTURES_FIELDS),
          Map.entry("ws-forex-quote", RuleType.FOREX_FIELDS),
          Map.entry("ws-crypto-quote", RuleType.CRYPTO_FIELDS),
          Map.entry("get-stock-quote", RuleType.QUOTE_FIELDS),
          Map.entry("get-option-quote", RuleType.OPTION_FIELDS),
          Map.entry("get-futures-quote", RuleType.FUTURES_FIELDS),
          Map.entry("get-forex-quote", RuleType.FOREX_FIELDS),
          Map.entry("get-crypto-quote", RuleType.CRYPTO_FIELDS),
          Map.entry("stream-stock-quote", RuleType.QUOTE_FIELDS),
          Map.entry("stream-option-quote", RuleType.OPTION_FIELDS),
          Map.entry("stream-market-data", RuleType.MARKET_DATA_FIELDS),
          Map.entry("stream-trading-data", RuleType.TRADING_DATA_FIELDS),
          Map.entry("get-stock-info", RuleType.BASIC_INFO_FIELDS),
          Map.entry("get-company-info", RuleType.COMPANY_INFO_FIELDS),
          Map.entry("get-market-info", RuleType.MARKET_INFO_FIELDS),
          Map.entry("get-historical-data", RuleType.HISTORICAL_DATA_FIELDS),
          Map.entry("get-historical-quotes", RuleType.HISTORICAL_DATA_FIELDS),
          Map.entry("get-news", RuleType.NEWS_FIELDS),
          Map.entry("get-announcements", RuleType.ANNOUNCEMENT_FIELDS));

  // First match wins.
  private static final List<PatternRule> PATTERN_RULES =
      List.of(
          new PatternRule(Pattern.compile("quote|price"), RuleType.QUOTE_FIELDS),
          new PatternRule(Pattern.compile("option"), RuleType.OPTION_FIELDS),
          new PatternRule(Pattern.compile("futures?"), RuleType.FUTURES_FIELDS),
          new PatternRule(Pattern.compile("forex|currency"), RuleType.FOREX_FIELDS),
          new PatternRule(Pattern.compile("crypto|bitcoin|eth"), RuleType.CRYPTO_FIELDS),
          new PatternRule(Pattern.compile("market"), RuleType.MARKET_DATA_FIELDS),
          new PatternRule(Pattern.compile("trading"), RuleType.TRADING_DATA_FIELDS),
          new PatternRule(Pattern.compile("info|basic"), RuleType.BASIC_INFO_FIELDS),
          new PatternRule(Pattern.compile("company"), RuleType.COMPANY_INFO_FIELDS),
          new PatternRule(Pattern.compile("historical?|history"), RuleType.HISTORICAL_DATA_FIELDS),
          new PatternRule(Pattern.compile("news"), RuleType.NEWS_FIELDS),
          new PatternRule(Pattern.compile("announcement"), RuleType.ANNOUNCEMENT_FIELDS));

  public RuleType mapToRuleType(String capability) {
    return resolve(capability).ruleType();
  }

  public CapabilityResolution resolve(String capability) {
    String candidate = capability == null ? "" : capability.trim();

    RuleType exact = KNOWN_CAPABILITIES.get(candidate);
    if (exact != null) {
      return resolved(candidate, exact, ResolutionMethod.EXACT_MATCH);
    }

    String normalized = candidate.toLowerCase(Locale.ROOT);
    for (PatternRule rule : PATTERN_RULES) {
      if (rule.pattern().matcher(normalized).find()) {
        return resolved(candidate, rule.ruleType(), ResolutionMethod.PATTERN_MATCH);
      }
    }

    if (normalized.startsWith("stream") || normalized.startsWith("ws")) {
      return resolved(candidate, RuleType.QUOTE_FIELDS, ResolutionMethod.PROTOCOL_FALLBACK);
    }
    if (normalized.startsWith("get") || normalized.startsWith("rest")) {
      return resolved(candidate, RuleType.BASIC_INFO_FIELDS, ResolutionMethod.PROTOCOL_FALLBACK);
    }

    log.warn(
        "Capability not recognised capability={} ruleType={} method={}",
        candidate,
        RuleType.QUOTE_FIELDS.code(),
        ResolutionMethod.DEFAULT);
    return new CapabilityResolution(candidate, RuleType.QUOTE_FIELDS, ResolutionMethod.DEFAULT);
  }

  private static CapabilityResolution resolved(
      String capability, RuleType ruleType, ResolutionMethod method) {
    log.debug(
        "Capability resolved capability={} ruleType={} method={}",
        capability,
        ruleType.code(),
        method);
    return new CapabilityResolution(capability, ruleType, method);
  }

  private record PatternRule(Pattern pattern, RuleType ruleType) {}
}
