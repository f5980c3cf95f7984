package com.marketfeed.stream.connection;

import com.marketfeed.stream.config.StreamReceiverProperties;
import com.marketfeed.stream.error.CollaboratorUnavailableException;
import com.marketfeed.stream.error.ResourceExhaustedException;
import com.marketfeed.stream.error.StreamException;
import com.marketfeed.stream.observability.StreamTelemetry;
import com.marketfeed.stream.port.ConnectionRequest;
import com.marketfeed.stream.port.RateLimitDecision;
import com.marketfeed.stream.port.RateLimitGateway;
import com.marketfeed.stream.port.RateLimitRule;
import com.marketfeed.stream.port.StreamConnector;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the live upstream connections and their health records. The maps are only mutated by this
 * class; structural changes and slot reservations run under a single lock so the connection cap
 * holds after every call. Upstream handshakes and closes happen outside that lock.
 */
public class StreamConnectionManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(StreamConnectionManager.class);
  private static final String RATE_LIMIT_KEY_PREFIX = "client:";
  private static final long BYTES_PER_MB = 1024L * 1024L;

  private final StreamConnector connector;
  private final RateLimitGateway rateLimitGateway;
  private final StreamReceiverProperties properties;
  private final StreamTelemetry telemetry;
  private final Clock clock;
  private final MemoryProbe memoryProbe;
  private final Runnable gcHint;

  private final Map<ConnectionKey, StreamConnection> connections = new ConcurrentHashMap<>();
  private final Map<ConnectionKey, ConnectionHealth> healthByKey = new ConcurrentHashMap<>();
  private final Map<ConnectionKey, CompletableFuture<StreamConnection>> pending = new HashMap<>();
  private final Object lifecycleLock = new Object();

  public StreamConnectionManager(
      StreamConnector connector,
      RateLimitGateway rateLimitGateway,
      StreamReceiverProperties properties,
      StreamTelemetry telemetry) {
    this(
        connector,
        rateLimitGateway,
        properties,
        telemetry,
        Clock.systemUTC(),
        MemoryProbe.jvmHeap(),
        System::gc);
  }

  StreamConnectionManager(
      StreamConnector connector,
      RateLimitGateway rateLimitGateway,
      StreamReceiverProperties properties,
      StreamTelemetry telemetry,
      Clock clock,
      MemoryProbe memoryProbe,
      Runnable gcHint) {
    this.connector = Objects.requireNonNull(connector, "connector must not be null");
    this.rateLimitGateway =
        Objects.requireNonNull(rateLimitGateway, "rateLimitGateway must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.memoryProbe = Objects.requireNonNull(memoryProbe, "memoryProbe must not be null");
    this.gcHint = Objects.requireNonNull(gcHint, "gcHint must not be null");
    telemetry.bindActiveConnections(connections::size);
  }

  public boolean checkRateLimit(String clientId) {
    return evaluateRateLimit(clientId).allowed();
  }

  /** Consults the rate limiter for {@code client:<id>}; a failing limiter allows the request. */
  public RateLimitDecision evaluateRateLimit(String clientId) {
    StreamReceiverProperties.RateLimit rateLimit = properties.getRateLimit();
    RateLimitRule rule =
        new RateLimitRule(rateLimit.getMaxPerWindow(), Duration.ofMillis(rateLimit.getWindowMs()));
    try {
      RateLimitDecision decision =
          rateLimitGateway.checkRateLimit(RATE_LIMIT_KEY_PREFIX + clientId, rule);
      if (decision.allowed()) {
        telemetry.onRateLimitCheck("allowed");
        return decision;
      }
      telemetry.onRateLimitCheck("rejected");
      log.warn(
          "Connection rate limit exceeded clientId={} limit={} current={} retryAfterSeconds={}",
          clientId,
          decision.limit(),
          decision.current(),
          decision.retryAfterSeconds());
      return decision;
    } catch (RuntimeException ex) {
      telemetry.onRateLimitCheck("fail_open");
      log.warn(
          "Rate limit check failed, allowing request clientId={} error={}",
          clientId,
          sanitizeMessage(ex));
      return RateLimitDecision.allow(rule.maxRequests(), 0L);
    }
  }

  /**
   * Returns the live connection for the provider and capability, opening one when none is usable.
   * The cap is enforced under the lifecycle lock by reserving a slot; the upstream handshake runs
   * outside it, and concurrent callers for the same key wait on that single handshake.
   */
  public StreamConnection getOrCreateConnection(
      String provider, String capability, List<String> symbols, String clientId) {
    ConnectionKey key = ConnectionKey.of(provider, capability);
    List<StreamConnection> retired = new ArrayList<>();
    CompletableFuture<StreamConnection> reservation;
    boolean owner = false;
    try {
      synchronized (lifecycleLock) {
        StreamConnection existing = connections.get(key);
        if (existing != null) {
          ConnectionHealth health = healthByKey.get(key);
          if (existing.isConnected() && (health == null || health.healthy())) {
            recordActivity(key);
            log.debug(
                "Reusing stream connection key={} connectionId={} clientId={}",
                key,
                existing.id(),
                clientId);
            return existing;
          }
          detachLocked(key, "replaced", retired);
        }

        reservation = pending.get(key);
        if (reservation == null) {
          int maxConnections = properties.getConnection().getMaxConnections();
          int current = connections.size() + pending.size();
          if (current >= maxConnections) {
            telemetry.onConnectionRejected(provider, capability, "capacity");
            log.warn(
                "Connection limit reached key={} clientId={} activeConnections={} maxConnections={}",
                key,
                clientId,
                current,
                maxConnections);
            throw new ResourceExhaustedException(
                "Connection limit reached (" + current + "/" + maxConnections + ")",
                maxConnections,
                current);
          }
          reservation = new CompletableFuture<>();
          pending.put(key, reservation);
          owner = true;
        }
      }
    } finally {
      closeRetired(retired);
    }

    if (!owner) {
      log.debug("Waiting for pending stream connection key={} clientId={}", key, clientId);
      return awaitPending(key, reservation);
    }
    return establish(key, reservation, symbols, clientId);
  }

  private StreamConnection establish(
      ConnectionKey key,
      CompletableFuture<StreamConnection> reservation,
      List<String> symbols,
      String clientId) {
    StreamConnection connection;
    try {
      connection = connect(key, symbols, clientId);
    } catch (RuntimeException ex) {
      synchronized (lifecycleLock) {
        pending.remove(key, reservation);
      }
      reservation.completeExceptionally(ex);
      throw ex;
    }

    boolean installed;
    synchronized (lifecycleLock) {
      installed = pending.remove(key, reservation);
      if (installed) {
        connections.put(key, connection);
        healthByKey.put(key, ConnectionHealth.initial(clock.instant()));
      }
    }
    if (!installed) {
      closeRetired(List.of(connection));
      CollaboratorUnavailableException cancelled =
          new CollaboratorUnavailableException(
              "stream-connector", "Stream connection " + key + " cancelled by shutdown");
      reservation.completeExceptionally(cancelled);
      throw cancelled;
    }
    reservation.complete(connection);
    telemetry.onConnectionOpened(key.provider(), key.capability());
    log.info(
        "Stream connection established key={} connectionId={} clientId={} symbols={} activeConnections={}",
        key,
        connection.id(),
        clientId,
        symbols == null ? 0 : symbols.size(),
        connections.size());
    return connection;
  }

  private static StreamConnection awaitPending(
      ConnectionKey key, CompletableFuture<StreamConnection> reservation) {
    try {
      return reservation.join();
    } catch (CompletionException | CancellationException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new CollaboratorUnavailableException(
          "stream-connector",
          "Failed to establish stream connection " + key + ": " + sanitizeMessage(cause),
          cause);
    }
  }

  public boolean removeConnection(ConnectionKey key) {
    List<StreamConnection> retired = new ArrayList<>();
    synchronized (lifecycleLock) {
      detachLocked(key, "removed", retired);
    }
    closeRetired(retired);
    return !retired.isEmpty();
  }

  /** Evicts the least recently active share of connections and hints a garbage collection. */
  public ConnectionCleanupResult forceConnectionCleanup() {
    Instant started = clock.instant();
    List<StreamConnection> retired = new ArrayList<>();
    int remaining;
    synchronized (lifecycleLock) {
      int total = connections.size();
      if (total > 0) {
        double ratio = properties.getMemory().getForcedCleanupRatio();
        int target = Math.max(1, (int) Math.floor(total * ratio));
        List<ConnectionKey> victims =
            connections.keySet().stream()
                .sorted(Comparator.comparing(this::lastActivity))
                .limit(target)
                .toList();
        for (ConnectionKey victim : victims) {
          detachLocked(victim, "memory_pressure", retired);
        }
      }
      remaining = connections.size();
    }
    closeRetired(retired);
    int evicted = retired.size();
    if (evicted > 0) {
      gcHint.run();
    }
    long durationMs = Math.max(0L, Duration.between(started, clock.instant()).toMillis());
    log.warn(
        "Forced connection cleanup evicted={} remaining={} durationMs={}",
        evicted,
        remaining,
        durationMs);
    return new ConnectionCleanupResult(evicted, remaining, durationMs);
  }

  /**
   * Removes disconnected, stale and unhealthy connections, then enforces the cap by evicting the
   * poorest and least recently active connections first. Returns the number of removed entries.
   */
  public int sweepStaleConnections() {
    Instant now = clock.instant();
    Duration staleTimeout = Duration.ofMillis(properties.getConnection().getStaleTimeoutMs());
    int maxConnections = properties.getConnection().getMaxConnections();
    List<StreamConnection> retired = new ArrayList<>();

    synchronized (lifecycleLock) {
      for (Map.Entry<ConnectionKey, StreamConnection> entry : List.copyOf(connections.entrySet())) {
        StreamConnection connection = entry.getValue();
        if (!connection.isConnected()) {
          detachLocked(entry.getKey(), "disconnected", retired);
        } else if (Duration.between(lastActivity(entry.getKey()), now).compareTo(staleTimeout)
            > 0) {
          detachLocked(entry.getKey(), "stale", retired);
        }
      }

      for (Map.Entry<ConnectionKey, StreamConnection> entry : List.copyOf(connections.entrySet())) {
        ConnectionKey key = entry.getKey();
        ConnectionHealth health =
            healthByKey
                .getOrDefault(key, ConnectionHealth.initial(entry.getValue().createdAt()))
                .withActivity(entry.getValue().lastActiveAt())
                .evaluate(now, staleTimeout);
        healthByKey.put(key, health);
        if (!health.healthy()) {
          detachLocked(key, "unhealthy", retired);
        }
      }
      healthByKey.keySet().retainAll(connections.keySet());

      if (connections.size() > maxConnections) {
        List<ConnectionKey> evictionOrder =
            connections.keySet().stream().sorted(evictionComparator()).toList();
        int excess = connections.size() - maxConnections;
        for (int i = 0; i < excess; i++) {
          detachLocked(evictionOrder.get(i), "capacity", retired);
        }
      }
    }
    closeRetired(retired);
    int removed = retired.size();

    if (removed > 0) {
      log.info(
          "Stream connection sweep removed={} activeConnections={} maxConnections={}",
          removed,
          connections.size(),
          maxConnections);
    }
    return removed;
  }

  public MemoryPressure checkMemoryPressure() {
    long heapUsed = memoryProbe.usedHeapBytes();
    StreamReceiverProperties.Memory memory = properties.getMemory();
    long criticalBytes = memory.getCriticalThresholdMb() * BYTES_PER_MB;
    long warningBytes = memory.getWarningThresholdMb() * BYTES_PER_MB;

    if (heapUsed > criticalBytes) {
      telemetry.onMemoryPressure(MemoryPressure.CRITICAL.code(), heapUsed);
      log.warn(
          "Heap above critical threshold heapUsedMb={} criticalMb={} activeConnections={}",
          heapUsed / BYTES_PER_MB,
          memory.getCriticalThresholdMb(),
          connections.size());
      forceConnectionCleanup();
      return MemoryPressure.CRITICAL;
    }
    if (heapUsed > warningBytes) {
      telemetry.onMemoryPressure(MemoryPressure.WARNING.code(), heapUsed);
      log.warn(
          "Heap above warning threshold heapUsedMb={} warningMb={} activeConnections={}",
          heapUsed / BYTES_PER_MB,
          memory.getWarningThresholdMb(),
          connections.size());
      return MemoryPressure.WARNING;
    }
    return MemoryPressure.NORMAL;
  }

  public void recordActivity(ConnectionKey key) {
    Instant now = clock.instant();
    healthByKey.computeIfPresent(key, (ignored, health) -> health.withActivity(now));
  }

  public void recordError(ConnectionKey key, Throwable error) {
    ConnectionHealth updated =
        healthByKey.computeIfPresent(key, (ignored, health) -> health.withError());
    if (updated != null) {
      log.debug(
          "Stream connection error key={} consecutiveErrors={} errorCount={} error={}",
          key,
          updated.consecutiveErrors(),
          updated.errorCount(),
          sanitizeMessage(error));
    }
  }

  public Optional<StreamConnection> findConnection(ConnectionKey key) {
    return Optional.ofNullable(connections.get(key));
  }

  public Optional<ConnectionHealth> health(ConnectionKey key) {
    return Optional.ofNullable(healthByKey.get(key));
  }

  public boolean hasLiveConnection(String provider) {
    return connections.entrySet().stream()
        .anyMatch(
            entry ->
                entry.getKey().provider().equals(provider) && entry.getValue().isConnected());
  }

  public int activeConnectionCount() {
    return connections.size();
  }

  public ConnectionStats connectionStats() {
    Map<String, Integer> byProvider = new TreeMap<>();
    Map<ConnectionQuality, Integer> byQuality = new EnumMap<>(ConnectionQuality.class);
    for (ConnectionKey key : connections.keySet()) {
      byProvider.merge(key.provider(), 1, Integer::sum);
      ConnectionHealth health = healthByKey.get(key);
      ConnectionQuality quality = health == null ? ConnectionQuality.EXCELLENT : health.quality();
      byQuality.merge(quality, 1, Integer::sum);
    }
    return new ConnectionStats(
        connections.size(),
        properties.getConnection().getMaxConnections(),
        byProvider,
        byQuality);
  }

  @Override
  public void close() {
    List<StreamConnection> retired = new ArrayList<>();
    synchronized (lifecycleLock) {
      for (ConnectionKey key : new ArrayList<>(connections.keySet())) {
        detachLocked(key, "shutdown", retired);
      }
      // in-flight handshakes see their reservation gone and close what they opened
      pending.clear();
    }
    closeRetired(retired);
  }

  private StreamConnection connect(ConnectionKey key, List<String> symbols, String clientId) {
    String requestId = "conn_" + UUID.randomUUID();
    try {
      StreamConnection connection =
          connector.connect(new ConnectionRequest(key, symbols, clientId, requestId));
      if (connection == null) {
        throw new CollaboratorUnavailableException(
            "stream-connector", "Stream connector returned no connection for " + key);
      }
      return connection;
    } catch (StreamException ex) {
      telemetry.onConnectionRejected(key.provider(), key.capability(), "connector_error");
      throw ex;
    } catch (RuntimeException ex) {
      telemetry.onConnectionRejected(key.provider(), key.capability(), "connector_error");
      throw new CollaboratorUnavailableException(
          "stream-connector",
          "Failed to establish stream connection " + key + ": " + sanitizeMessage(ex),
          ex);
    }
  }

  /** Unregisters the connection for {@code key}; the caller closes it once the lock is released. */
  private void detachLocked(ConnectionKey key, String reason, List<StreamConnection> retired) {
    StreamConnection connection = connections.remove(key);
    healthByKey.remove(key);
    if (connection == null) {
      return;
    }
    retired.add(connection);
    telemetry.onConnectionClosed(key.provider(), key.capability(), reason);
    log.info(
        "Stream connection removed key={} connectionId={} reason={}", key, connection.id(), reason);
  }

  private void closeRetired(List<StreamConnection> retired) {
    for (StreamConnection connection : retired) {
      try {
        connection.close();
      } catch (RuntimeException ex) {
        log.warn(
            "Stream connection close failed key={} connectionId={} error={}",
            connection.key(),
            connection.id(),
            sanitizeMessage(ex));
      }
    }
  }

  private Comparator<ConnectionKey> evictionComparator() {
    return Comparator.<ConnectionKey>comparingInt(
            key -> {
              ConnectionHealth health = healthByKey.get(key);
              return health == null ? ConnectionQuality.POOR.priority() : health.quality().priority();
            })
        .thenComparing(this::lastActivity);
  }

  private Instant lastActivity(ConnectionKey key) {
    StreamConnection connection = connections.get(key);
    ConnectionHealth health = healthByKey.get(key);
    Instant activity = Instant.EPOCH;
    if (connection != null) {
      activity = connection.lastActiveAt() != null ? connection.lastActiveAt() : connection.createdAt();
    }
    if (health != null && health.lastActivity() != null && health.lastActivity().isAfter(activity)) {
      activity = health.lastActivity();
    }
    return activity == null ? Instant.EPOCH : activity;
  }

  static String sanitizeMessage(Throwable error) {
    String message = error == null ? null : error.getMessage();
    if (message == null || message.isBlank()) {
      return error == null ? "unknown error" : error.getClass().getSimpleName();
    }
    return message.length() > 300 ? message.substring(0, 300) : message;
  }
}
