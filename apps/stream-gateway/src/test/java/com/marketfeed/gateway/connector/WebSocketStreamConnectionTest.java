package com.marketfeed.gateway.connector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketfeed.stream.connection.ConnectionKey;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class WebSocketStreamConnectionTest {
  private static final Instant NOW = Instant.parse("2026-02-25T12:00:00Z");
  private static final ConnectionKey KEY = ConnectionKey.of("longport", "ws-stock-quote");

  private final ObjectMapper objectMapper = new ObjectMapper();
  private HttpClient httpClient;
  private WebSocket.Builder builder;
  private WebSocket webSocket;
  private ScheduledExecutorService scheduler;
  private SimpleMeterRegistry meterRegistry;
  private WebSocketStreamConnection connection;

  @BeforeEach
  void setUp() {
    httpClient = mock(HttpClient.class);
    builder = mock(WebSocket.Builder.class);
    webSocket = mock(WebSocket.class);
    scheduler = mock(ScheduledExecutorService.class);
    meterRegistry = new SimpleMeterRegistry();
    when(httpClient.newWebSocketBuilder()).thenReturn(builder);
    when(builder.connectTimeout(any(Duration.class))).thenReturn(builder);
    when(webSocket.sendText(any(CharSequence.class), anyBoolean()))
        .thenReturn(CompletableFuture.completedFuture(webSocket));
    when(webSocket.sendClose(anyInt(), anyString()))
        .thenReturn(CompletableFuture.completedFuture(webSocket));
    connection =
        new WebSocketStreamConnection(
            "conn-1",
            KEY,
            URI.create("ws://localhost:9001/stream?capability=ws-stock-quote"),
            httpClient,
            objectMapper,
            meterRegistry,
            scheduler,
            new WebSocketStreamConnection.UpstreamSettings(
                Duration.ofSeconds(5), Duration.ofSeconds(1), Duration.ofSeconds(30)),
            symbols -> symbols.stream().map(symbol -> symbol.replace("00700", "700")).toList(),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void shouldDispatchDataMessagesToHandlers() {
    List<JsonNode> received = new ArrayList<>();
    connection.onData(received::add);

    connection.handleMessage("{\"s\":\"700.HK\",\"p\":320.4}");

    assertEquals(1, received.size());
    assertEquals("700.HK", received.get(0).path("s").asText());
    assertEquals(NOW, connection.lastActiveAt());
    assertEquals(1.0, messages("data"));
  }

  @Test
  void shouldCountHeartbeatsWithoutDispatching() {
    List<JsonNode> received = new ArrayList<>();
    connection.onData(received::add);

    connection.handleMessage("{\"type\":\"heartbeat\"}");
    connection.handleMessage("{\"type\":\"pong\"}");

    assertTrue(received.isEmpty());
    assertEquals(2.0, messages("heartbeat"));
    assertEquals(NOW, connection.lastActiveAt());
  }

  @Test
  void shouldReportUnparseablePayloadAsError() {
    List<Throwable> errors = new ArrayList<>();
    connection.onError(errors::add);

    connection.handleMessage("{broken");

    assertEquals(1, errors.size());
    UpstreamMessageException error =
        assertInstanceOf(UpstreamMessageException.class, errors.get(0));
    assertEquals("PARSE_ERROR", error.code());
    assertEquals(1.0, messages("parse_error"));
  }

  @Test
  void shouldConnectAndSendProviderSymbolsOnOpen() {
    completeHandshake();
    connection.subscribeSymbols(List.of("00700.HK"));

    connection.open();

    assertTrue(connection.isConnected());
    ArgumentCaptor<CharSequence> sent = ArgumentCaptor.forClass(CharSequence.class);
    verify(webSocket).sendText(sent.capture(), eq(true));
    assertEquals(
        "{\"action\":\"subscribe\",\"capability\":\"ws-stock-quote\",\"symbols\":[\"700.HK\"]}",
        sent.getValue().toString());
    verify(webSocket).request(1);
  }

  @Test
  void shouldOnlyRememberSymbolsWhileDisconnected() {
    connection.subscribeSymbols(List.of("AAPL.US", "MSFT.US", "AAPL.US"));

    assertEquals(List.of("AAPL.US", "MSFT.US"), connection.subscribedSymbols());
    assertFalse(connection.isConnected());
    assertNull(connection.lastActiveAt());
    verify(webSocket, never()).sendText(any(CharSequence.class), anyBoolean());
  }

  @Test
  void shouldSendOnlyNewlyAddedSymbolsWhenConnected() {
    completeHandshake();
    connection.open();

    connection.subscribeSymbols(List.of("AAPL.US"));
    connection.subscribeSymbols(List.of("AAPL.US"));

    ArgumentCaptor<CharSequence> sent = ArgumentCaptor.forClass(CharSequence.class);
    verify(webSocket).sendText(sent.capture(), eq(true));
    assertEquals(
        "{\"action\":\"subscribe\",\"capability\":\"ws-stock-quote\",\"symbols\":[\"AAPL.US\"]}",
        sent.getValue().toString());
  }

  @Test
  void shouldScheduleReconnectWithBackoffAfterDrop() {
    completeHandshake();
    connection.open();
    List<Throwable> errors = new ArrayList<>();
    connection.onError(errors::add);

    connection.handleDisconnect(1006, "abnormal", new IllegalStateException("reset"));

    assertFalse(connection.isConnected());
    assertEquals("reset", errors.get(0).getMessage());
    verify(scheduler).schedule(any(Runnable.class), eq(1_000L), eq(TimeUnit.MILLISECONDS));
    assertEquals(
        1.0,
        meterRegistry.counter("stream.upstream.reconnect.total", "provider", "longport").count());
  }

  @Test
  void shouldNotReconnectAfterClose() {
    completeHandshake();
    connection.open();

    connection.close();
    connection.handleDisconnect(1000, "closed", null);

    verify(webSocket).sendClose(WebSocket.NORMAL_CLOSURE, "closed");
    verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    assertFalse(connection.isConnected());
  }

  @Test
  void shouldDoubleBackoffUpToMaximum() {
    assertEquals(Duration.ofSeconds(1), connection.nextBackoff(1));
    assertEquals(Duration.ofSeconds(2), connection.nextBackoff(2));
    assertEquals(Duration.ofSeconds(8), connection.nextBackoff(4));
    assertEquals(Duration.ofSeconds(30), connection.nextBackoff(6));
    assertEquals(Duration.ofSeconds(30), connection.nextBackoff(40));
  }

  private void completeHandshake() {
    when(builder.buildAsync(any(URI.class), any(WebSocket.Listener.class)))
        .thenAnswer(
            invocation -> {
              WebSocket.Listener listener = invocation.getArgument(1);
              listener.onOpen(webSocket);
              return CompletableFuture.completedFuture(webSocket);
            });
  }

  private double messages(String type) {
    assertNotNull(meterRegistry.find("stream.upstream.messages.total").tag("type", type).counter());
    return meterRegistry
        .counter("stream.upstream.messages.total", "provider", "longport", "type", type)
        .count();
  }
}
