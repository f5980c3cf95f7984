package com.marketfeed.gateway.symbols;

import com.marketfeed.stream.port.MappingDirection;
import com.marketfeed.stream.port.SymbolMappingResult;
import com.marketfeed.stream.port.SymbolStandardizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps symbols with per-provider override tables first and formatting rules second. Hong Kong
 * codes are zero-padded in canonical form; the provider form keeps or strips the padding depending
 * on configuration.
 */
public class RuleBasedSymbolStandardizer implements SymbolStandardizer {
  private static final Pattern VALID_SYMBOL = Pattern.compile("^[A-Z0-9][A-Z0-9.\\-]*$");
  private static final Pattern HONG_KONG_CODE = Pattern.compile("^(\\d+)\\.HK$");

  private final Map<String, Map<String, String>> toStandard;
  private final Map<String, Map<String, String>> fromStandard;
  private final int hongKongCodeWidth;
  private final boolean stripHongKongLeadingZeros;

  public RuleBasedSymbolStandardizer(
      Map<String, Map<String, String>> overrides,
      int hongKongCodeWidth,
      boolean stripHongKongLeadingZeros) {
    if (hongKongCodeWidth < 1) {
      throw new IllegalArgumentException("hongKongCodeWidth must be positive");
    }
    this.hongKongCodeWidth = hongKongCodeWidth;
    this.stripHongKongLeadingZeros = stripHongKongLeadingZeros;
    this.toStandard = new HashMap<>();
    this.fromStandard = new HashMap<>();
    if (overrides != null) {
      overrides.forEach(
          (provider, table) -> {
            Map<String, String> forward = new HashMap<>();
            Map<String, String> reverse = new HashMap<>();
            table.forEach(
                (providerSymbol, standardSymbol) -> {
                  String from = normalize(providerSymbol);
                  String to = normalize(standardSymbol);
                  forward.put(from, to);
                  reverse.put(to, from);
                });
            toStandard.put(provider, Map.copyOf(forward));
            fromStandard.put(provider, Map.copyOf(reverse));
          });
    }
  }

  @Override
  public SymbolMappingResult transformSymbols(
      String provider, List<String> symbols, MappingDirection direction) {
    Objects.requireNonNull(direction, "direction must not be null");
    Map<String, String> details = new LinkedHashMap<>();
    List<String> failed = new ArrayList<>();
    if (symbols == null) {
      return new SymbolMappingResult(details, failed);
    }
    Map<String, String> table =
        direction == MappingDirection.TO_STANDARD
            ? toStandard.getOrDefault(provider, Map.of())
            : fromStandard.getOrDefault(provider, Map.of());
    for (String symbol : symbols) {
      String normalized = normalize(symbol);
      if (normalized.isEmpty() || !VALID_SYMBOL.matcher(normalized).matches()) {
        failed.add(symbol == null ? "" : symbol);
        continue;
      }
      String mapped = table.get(normalized);
      if (mapped == null) {
        mapped =
            direction == MappingDirection.TO_STANDARD
                ? toStandardForm(normalized)
                : toProviderForm(normalized);
      }
      details.put(symbol, mapped);
    }
    return new SymbolMappingResult(details, failed);
  }

  private String toStandardForm(String symbol) {
    Matcher matcher = HONG_KONG_CODE.matcher(symbol);
    if (!matcher.matches()) {
      return symbol;
    }
    String digits = stripZeros(matcher.group(1));
    if (digits.length() >= hongKongCodeWidth) {
      return digits + ".HK";
    }
    return "0".repeat(hongKongCodeWidth - digits.length()) + digits + ".HK";
  }

  private String toProviderForm(String symbol) {
    Matcher matcher = HONG_KONG_CODE.matcher(symbol);
    if (!stripHongKongLeadingZeros || !matcher.matches()) {
      return symbol;
    }
    return stripZeros(matcher.group(1)) + ".HK";
  }

  private static String stripZeros(String digits) {
    int index = 0;
    while (index < digits.length() - 1 && digits.charAt(index) == '0') {
      index++;
    }
    return digits.substring(index);
  }

  private static String normalize(String symbol) {
    return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
  }
}
