package com.marketfeed.gateway.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketfeed.gateway.config.StreamGatewayProperties;
import com.marketfeed.stream.concurrent.NamedDaemonThreadFactory;
import com.marketfeed.stream.connection.ConnectionKey;
import com.marketfeed.stream.connection.StreamConnection;
import com.marketfeed.stream.port.ConnectionRequest;
import com.marketfeed.stream.port.MappingDirection;
import com.marketfeed.stream.port.StreamConnector;
import com.marketfeed.stream.port.SymbolMappingResult;
import com.marketfeed.stream.port.SymbolStandardizer;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Opens one WebSocket per provider and capability against the configured provider endpoint. */
public class WebSocketStreamConnector implements StreamConnector {
  private static final Logger log = LoggerFactory.getLogger(WebSocketStreamConnector.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final SymbolStandardizer symbolStandardizer;
  private final Map<String, String> endpoints;
  private final WebSocketStreamConnection.UpstreamSettings settings;
  private final Clock clock;
  private final ScheduledExecutorService scheduler;

  public WebSocketStreamConnector(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      SymbolStandardizer symbolStandardizer,
      StreamGatewayProperties.Upstream upstream,
      Clock clock) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.symbolStandardizer =
        Objects.requireNonNull(symbolStandardizer, "symbolStandardizer must not be null");
    Objects.requireNonNull(upstream, "upstream must not be null");
    this.endpoints = Map.copyOf(upstream.getEndpoints());
    this.settings =
        new WebSocketStreamConnection.UpstreamSettings(
            upstream.getConnectTimeout(),
            upstream.getReconnectBaseBackoff(),
            upstream.getReconnectMaxBackoff());
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("stream-upstream"));
  }

  @Override
  public StreamConnection connect(ConnectionRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    ConnectionKey key = request.key();
    URI endpoint = resolveEndpoint(key);
    WebSocketStreamConnection connection =
        new WebSocketStreamConnection(
            UUID.randomUUID().toString(),
            key,
            endpoint,
            httpClient,
            objectMapper,
            meterRegistry,
            scheduler,
            settings,
            symbols -> toProviderSymbols(key.provider(), symbols),
            clock);
    try {
      connection.open();
    } catch (RuntimeException ex) {
      connection.close();
      throw ex;
    }
    log.info(
        "Upstream connection opened key={} connectionId={} clientId={} requestId={}",
        key,
        connection.id(),
        request.clientId(),
        request.requestId());
    return connection;
  }

  @PreDestroy
  public void shutdown() {
    scheduler.shutdownNow();
  }

  URI resolveEndpoint(ConnectionKey key) {
    String base = endpoints.get(key.provider());
    if (base == null || base.isBlank()) {
      throw new IllegalArgumentException(
          "No upstream endpoint configured for provider " + key.provider());
    }
    String separator = base.contains("?") ? "&" : "?";
    String capability = URLEncoder.encode(key.capability(), StandardCharsets.UTF_8);
    return URI.create(base + separator + "capability=" + capability);
  }

  private List<String> toProviderSymbols(String provider, List<String> symbols) {
    try {
      SymbolMappingResult mapping =
          symbolStandardizer.transformSymbols(provider, symbols, MappingDirection.FROM_STANDARD);
      return symbols.stream().map(mapping::standardOrOriginal).toList();
    } catch (RuntimeException ex) {
      log.warn(
          "Provider symbol mapping failed, sending canonical symbols provider={} error={}",
          provider,
          ex.getMessage());
      return symbols;
    }
  }
}
