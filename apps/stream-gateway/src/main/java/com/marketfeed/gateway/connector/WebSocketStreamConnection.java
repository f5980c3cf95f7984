package com.marketfeed.gateway.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.marketfeed.stream.connection.ConnectionKey;
import com.marketfeed.stream.connection.StreamConnection;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One upstream WebSocket feed. The first connect is synchronous; later drops are retried with
 * exponential backoff until {@link #close()}, re-sending the full symbol set after each reconnect.
 */
public class WebSocketStreamConnection implements StreamConnection {
  private static final Logger log = LoggerFactory.getLogger(WebSocketStreamConnection.class);

  private static final String PARSE_ERROR_CODE = "PARSE_ERROR";

  private final String id;
  private final ConnectionKey key;
  private final URI endpoint;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final ScheduledExecutorService scheduler;
  private final UpstreamSettings settings;
  private final UnaryOperator<List<String>> toProviderSymbols;
  private final Clock clock;
  private final Instant createdAt;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean connected = new AtomicBoolean(false);
  private final AtomicInteger consecutiveFailures = new AtomicInteger();
  private final AtomicReference<WebSocket> webSocketRef = new AtomicReference<>();
  private final AtomicReference<ScheduledFuture<?>> reconnectTaskRef = new AtomicReference<>();
  private final AtomicReference<Instant> lastActiveAt = new AtomicReference<>();
  private final Set<String> symbols = new LinkedHashSet<>();
  private final List<Consumer<JsonNode>> dataHandlers = new CopyOnWriteArrayList<>();
  private final List<Consumer<Throwable>> errorHandlers = new CopyOnWriteArrayList<>();

  WebSocketStreamConnection(
      String id,
      ConnectionKey key,
      URI endpoint,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      ScheduledExecutorService scheduler,
      UpstreamSettings settings,
      UnaryOperator<List<String>> toProviderSymbols,
      Clock clock) {
    this.id = Objects.requireNonNull(id, "id must not be null");
    this.key = Objects.requireNonNull(key, "key must not be null");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    this.settings = Objects.requireNonNull(settings, "settings must not be null");
    this.toProviderSymbols =
        Objects.requireNonNull(toProviderSymbols, "toProviderSymbols must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.createdAt = Instant.now(clock);
  }

  /** Opens the socket and blocks until the handshake completes or fails. */
  void open() {
    httpClient
        .newWebSocketBuilder()
        .connectTimeout(settings.connectTimeout())
        .buildAsync(endpoint, new Listener())
        .join();
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public ConnectionKey key() {
    return key;
  }

  @Override
  public boolean isConnected() {
    return running.get() && connected.get();
  }

  @Override
  public Instant createdAt() {
    return createdAt;
  }

  @Override
  public Instant lastActiveAt() {
    return lastActiveAt.get();
  }

  @Override
  public void subscribeSymbols(List<String> requested) {
    List<String> added;
    synchronized (symbols) {
      added = requested.stream().filter(symbols::add).toList();
    }
    if (added.isEmpty()) {
      return;
    }
    WebSocket webSocket = webSocketRef.get();
    if (webSocket != null && connected.get()) {
      sendSubscribe(webSocket, added);
    }
  }

  public List<String> subscribedSymbols() {
    synchronized (symbols) {
      return List.copyOf(symbols);
    }
  }

  @Override
  public void onData(Consumer<JsonNode> handler) {
    dataHandlers.add(Objects.requireNonNull(handler, "handler must not be null"));
  }

  @Override
  public void onError(Consumer<Throwable> handler) {
    errorHandlers.add(Objects.requireNonNull(handler, "handler must not be null"));
  }

  @Override
  public void close() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    cancelReconnect();
    connected.set(false);
    WebSocket webSocket = webSocketRef.getAndSet(null);
    if (webSocket != null) {
      try {
        webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "closed").join();
      } catch (Exception ex) {
        webSocket.abort();
      }
    }
    log.info("Upstream connection closed key={} connectionId={}", key, id);
  }

  void handleMessage(String payload) {
    lastActiveAt.set(Instant.now(clock));
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (IOException ex) {
      countMessage("parse_error");
      notifyError(new UpstreamMessageException(PARSE_ERROR_CODE, sanitize(ex), ex));
      return;
    }
    String type = root.path("type").asText("");
    if ("heartbeat".equals(type) || "pong".equals(type)) {
      countMessage("heartbeat");
      return;
    }
    countMessage("data");
    for (Consumer<JsonNode> handler : dataHandlers) {
      handler.accept(root);
    }
  }

  void handleDisconnect(int statusCode, String reason, Throwable error) {
    connected.set(false);
    webSocketRef.set(null);
    log.warn(
        "Upstream connection dropped key={} connectionId={} statusCode={} reason={}",
        key,
        id,
        statusCode,
        reason == null ? "" : reason);
    if (error != null) {
      notifyError(unwrap(error));
    }
    if (!running.get()) {
      return;
    }
    Duration delay = nextBackoff(consecutiveFailures.incrementAndGet());
    meterRegistry
        .counter("stream.upstream.reconnect.total", "provider", key.provider())
        .increment();
    scheduleReconnect(delay);
  }

  Duration nextBackoff(int attempt) {
    long base = settings.reconnectBaseBackoff().toMillis();
    long max = settings.reconnectMaxBackoff().toMillis();
    long value = base;
    int steps = Math.max(0, attempt - 1);
    for (int i = 0; i < steps; i++) {
      if (value >= max / 2) {
        value = max;
        break;
      }
      value *= 2;
    }
    return Duration.ofMillis(Math.min(value, max));
  }

  private void scheduleReconnect(Duration delay) {
    cancelReconnect();
    ScheduledFuture<?> future =
        scheduler.schedule(this::reconnect, Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
    reconnectTaskRef.set(future);
  }

  private void reconnect() {
    if (!running.get()) {
      return;
    }
    try {
      log.info("Reconnecting upstream key={} connectionId={} endpoint={}", key, id, endpoint);
      open();
    } catch (RuntimeException ex) {
      handleDisconnect(-1, "reconnect_failed", ex);
    }
  }

  private void cancelReconnect() {
    ScheduledFuture<?> task = reconnectTaskRef.getAndSet(null);
    if (task != null) {
      task.cancel(false);
    }
  }

  private void sendSubscribe(WebSocket webSocket, List<String> standardSymbols) {
    ObjectNode message = objectMapper.createObjectNode();
    message.put("action", "subscribe");
    message.put("capability", key.capability());
    ArrayNode list = message.putArray("symbols");
    toProviderSymbols.apply(standardSymbols).forEach(list::add);
    webSocket.sendText(message.toString(), true);
  }

  private void countMessage(String type) {
    meterRegistry
        .counter("stream.upstream.messages.total", "provider", key.provider(), "type", type)
        .increment();
  }

  private void notifyError(Throwable error) {
    for (Consumer<Throwable> handler : errorHandlers) {
      handler.accept(error);
    }
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException completion && completion.getCause() != null) {
      return completion.getCause();
    }
    return error;
  }

  private static String sanitize(Throwable error) {
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return error.getClass().getSimpleName();
    }
    String compact = message.replaceAll("\\s+", " ").trim();
    return compact.length() <= 300 ? compact : compact.substring(0, 300);
  }

  record UpstreamSettings(
      Duration connectTimeout, Duration reconnectBaseBackoff, Duration reconnectMaxBackoff) {}

  private final class Listener implements WebSocket.Listener {
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final StringBuilder frameBuffer = new StringBuilder();

    @Override
    public void onOpen(WebSocket webSocket) {
      webSocketRef.set(webSocket);
      connected.set(true);
      consecutiveFailures.set(0);
      lastActiveAt.set(Instant.now(clock));
      List<String> current = subscribedSymbols();
      if (!current.isEmpty()) {
        sendSubscribe(webSocket, current);
      }
      log.info(
          "Upstream connected key={} connectionId={} endpoint={} symbols={}",
          key,
          id,
          endpoint,
          current.size());
      webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      frameBuffer.append(data);
      if (last) {
        String payload = frameBuffer.toString();
        frameBuffer.setLength(0);
        try {
          handleMessage(payload);
        } catch (RuntimeException ex) {
          notifyError(ex);
        }
      }
      webSocket.request(1);
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      if (terminated.compareAndSet(false, true)) {
        handleDisconnect(statusCode, reason, null);
      }
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      if (terminated.compareAndSet(false, true)) {
        handleDisconnect(1011, "ws_error", error);
      }
    }
  }
}
