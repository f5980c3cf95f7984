package com.marketfeed.gateway.connector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketfeed.gateway.config.StreamGatewayProperties;
import com.marketfeed.gateway.symbols.RuleBasedSymbolStandardizer;
import com.marketfeed.stream.connection.ConnectionKey;
import com.marketfeed.stream.connection.StreamConnection;
import com.marketfeed.stream.port.ConnectionRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebSocketStreamConnectorTest {
  private HttpClient httpClient;
  private WebSocket.Builder builder;
  private WebSocketStreamConnector connector;

  @BeforeEach
  void setUp() {
    httpClient = mock(HttpClient.class);
    builder = mock(WebSocket.Builder.class);
    when(httpClient.newWebSocketBuilder()).thenReturn(builder);
    when(builder.connectTimeout(any(Duration.class))).thenReturn(builder);

    StreamGatewayProperties.Upstream upstream = new StreamGatewayProperties.Upstream();
    upstream.setEndpoints(
        Map.of(
            "longport", "ws://quotes.local/stream",
            "tokenized", "ws://other.local/feed?token=abc"));
    connector =
        new WebSocketStreamConnector(
            httpClient,
            new ObjectMapper(),
            new SimpleMeterRegistry(),
            new RuleBasedSymbolStandardizer(Map.of(), 5, true),
            upstream,
            Clock.systemUTC());
  }

  @AfterEach
  void tearDown() {
    connector.shutdown();
  }

  @Test
  void shouldAppendCapabilityToEndpoint() {
    assertEquals(
        URI.create("ws://quotes.local/stream?capability=ws-stock-quote"),
        connector.resolveEndpoint(ConnectionKey.of("longport", "ws-stock-quote")));
    assertEquals(
        URI.create("ws://other.local/feed?token=abc&capability=ws+option+chain"),
        connector.resolveEndpoint(ConnectionKey.of("tokenized", "ws option chain")));
  }

  @Test
  void shouldRejectProviderWithoutEndpoint() {
    IllegalArgumentException ex =
        assertThrows(
            IllegalArgumentException.class,
            () -> connector.resolveEndpoint(ConnectionKey.of("unknown", "ws-stock-quote")));
    assertEquals("No upstream endpoint configured for provider unknown", ex.getMessage());
  }

  @Test
  void shouldReturnConnectedStreamWhenHandshakeSucceeds() {
    WebSocket webSocket = mock(WebSocket.class);
    when(webSocket.sendText(any(CharSequence.class), anyBoolean()))
        .thenReturn(CompletableFuture.completedFuture(webSocket));
    when(builder.buildAsync(any(URI.class), any(WebSocket.Listener.class)))
        .thenAnswer(
            invocation -> {
              WebSocket.Listener listener = invocation.getArgument(1);
              listener.onOpen(webSocket);
              return CompletableFuture.completedFuture(webSocket);
            });

    StreamConnection connection =
        connector.connect(
            new ConnectionRequest(
                ConnectionKey.of("longport", "ws-stock-quote"),
                List.of("00700.HK"),
                "c1",
                "req-1"));

    assertTrue(connection.isConnected());
    assertEquals(ConnectionKey.of("longport", "ws-stock-quote"), connection.key());
  }

  @Test
  void shouldPropagateHandshakeFailure() {
    when(builder.buildAsync(any(URI.class), any(WebSocket.Listener.class)))
        .thenReturn(CompletableFuture.failedFuture(new ConnectException("refused")));

    CompletionException ex =
        assertThrows(
            CompletionException.class,
            () ->
                connector.connect(
                    new ConnectionRequest(
                        ConnectionKey.of("longport", "ws-stock-quote"), List.of(), "c1", "req-1")));
    assertTrue(ex.getCause() instanceof ConnectException);
  }
}
