package com.marketfeed.stream.market;

import com.marketfeed.stream.config.StreamReceiverProperties;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Picks a provider for a symbol set from the market most of the symbols belong to. */
public class MarketProviderResolver {
  private static final Logger log = LoggerFactory.getLogger(MarketProviderResolver.class);

  private final StreamReceiverProperties.Providers settings;

  public MarketProviderResolver(StreamReceiverProperties.Providers settings) {
    this.settings = Objects.requireNonNull(settings, "settings must not be null");
  }

  public String resolveProvider(Collection<String> symbols) {
    Market primary = primaryMarket(symbols);
    String provider = providerFor(primary);
    log.debug(
        "Default provider resolved primaryMarket={} provider={} symbols={}",
        primary,
        provider,
        symbols == null ? 0 : symbols.size());
    return provider;
  }

  public Map<Market, Integer> marketDistribution(Collection<String> symbols) {
    Map<Market, Integer> distribution = new EnumMap<>(Market.class);
    if (symbols != null) {
      for (String symbol : symbols) {
        distribution.merge(Market.of(symbol), 1, Integer::sum);
      }
    }
    return distribution;
  }

  /** Ties go to the market declared first in {@link Market}. */
  public Market primaryMarket(Collection<String> symbols) {
    Market primary = Market.UNKNOWN;
    int best = 0;
    for (Map.Entry<Market, Integer> entry : marketDistribution(symbols).entrySet()) {
      if (entry.getKey() != Market.UNKNOWN && entry.getValue() > best) {
        primary = entry.getKey();
        best = entry.getValue();
      }
    }
    return primary;
  }

  private String providerFor(Market market) {
    String fallback = settings.getDefaultProvider();
    if (market == Market.UNKNOWN) {
      return fallback;
    }
    Map<String, String> table = settings.getMarketProviders();
    if (table == null) {
      return fallback;
    }
    String provider = table.get(market.name());
    if (provider == null) {
      provider = table.get(market.name().toLowerCase(Locale.ROOT));
    }
    return provider == null || provider.isBlank() ? fallback : provider;
  }
}
