package com.marketfeed.stream.recovery;

import com.marketfeed.stream.config.StreamReceiverProperties;
import com.marketfeed.stream.connection.StreamConnection;
import com.marketfeed.stream.connection.StreamConnectionManager;
import com.marketfeed.stream.error.ValidationFailedException;
import com.marketfeed.stream.market.MarketProviderResolver;
import com.marketfeed.stream.observability.StreamTelemetry;
import com.marketfeed.stream.port.ClientRegistry;
import com.marketfeed.stream.port.ClientStateStats;
import com.marketfeed.stream.port.MappingDirection;
import com.marketfeed.stream.port.RecoveryJob;
import com.marketfeed.stream.port.RecoveryPriority;
import com.marketfeed.stream.port.RecoveryWorker;
import com.marketfeed.stream.port.SymbolMappingResult;
import com.marketfeed.stream.port.SymbolStandardizer;
import com.marketfeed.stream.receiver.StreamIngress;
import com.marketfeed.stream.receiver.SubscriptionRollback;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client reconnect protocol. A reconnect restores the subscription, re-opens the upstream
 * connection and, when the gap is inside the recovery window, hands a backfill job to the recovery
 * worker. Anything past request validation that goes wrong is answered with a resubscribe
 * instruction instead of an exception.
 */
public class StreamRecoveryCoordinator {
  private static final Logger log = LoggerFactory.getLogger(StreamRecoveryCoordinator.class);

  static final String REJECTED_MAPPING = "symbol mapping failed";
  static final String REASON_NETWORK_ERROR = "network_error";
  static final String RESUBSCRIBE_REASON_JOB_REJECTED = "recovery_job_rejected";
  static final String RECONNECT_REASON_PROVIDER_LOST = "provider_connection_lost";

  private final SymbolStandardizer symbolStandardizer;
  private final ClientRegistry clientRegistry;
  private final StreamConnectionManager connectionManager;
  private final StreamIngress ingress;
  private final RecoveryWorker recoveryWorker;
  private final MarketProviderResolver providerResolver;
  private final StreamReceiverProperties.Recovery settings;
  private final StreamTelemetry telemetry;
  private final Clock clock;

  public StreamRecoveryCoordinator(
      SymbolStandardizer symbolStandardizer,
      ClientRegistry clientRegistry,
      StreamConnectionManager connectionManager,
      StreamIngress ingress,
      RecoveryWorker recoveryWorker,
      MarketProviderResolver providerResolver,
      StreamReceiverProperties properties,
      StreamTelemetry telemetry) {
    this(
        symbolStandardizer,
        clientRegistry,
        connectionManager,
        ingress,
        recoveryWorker,
        providerResolver,
        properties,
        telemetry,
        Clock.systemUTC());
  }

  StreamRecoveryCoordinator(
      SymbolStandardizer symbolStandardizer,
      ClientRegistry clientRegistry,
      StreamConnectionManager connectionManager,
      StreamIngress ingress,
      RecoveryWorker recoveryWorker,
      MarketProviderResolver providerResolver,
      StreamReceiverProperties properties,
      StreamTelemetry telemetry,
      Clock clock) {
    this.symbolStandardizer =
        Objects.requireNonNull(symbolStandardizer, "symbolStandardizer must not be null");
    this.clientRegistry = Objects.requireNonNull(clientRegistry, "clientRegistry must not be null");
    this.connectionManager =
        Objects.requireNonNull(connectionManager, "connectionManager must not be null");
    this.ingress = Objects.requireNonNull(ingress, "ingress must not be null");
    this.recoveryWorker = Objects.requireNonNull(recoveryWorker, "recoveryWorker must not be null");
    this.providerResolver =
        Objects.requireNonNull(providerResolver, "providerResolver must not be null");
    this.settings = Objects.requireNonNull(properties, "properties must not be null").getRecovery();
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public ReconnectResponse handleReconnect(ReconnectRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    long now = clock.millis();
    validate(request, now);

    String clientId = request.clientId();
    String provider =
        hasText(request.preferredProvider())
            ? request.preferredProvider()
            : providerResolver.resolveProvider(request.symbols());
    log.info(
        "Client reconnect requested clientId={} provider={} reason={} symbols={} sinceLastReceiveMs={}",
        clientId,
        provider,
        request.reason(),
        request.symbols().size(),
        now - request.lastReceiveTimestamp());

    SymbolDecision decision = decideSymbols(provider, request.symbols());
    if (decision.mapperFailed() || decision.confirmed().isEmpty()) {
      telemetry.onReconnect("resubscribe");
      log.warn(
          "Client reconnect has no confirmed symbols clientId={} provider={} rejected={} mapperFailed={}",
          clientId,
          provider,
          decision.rejected().size(),
          decision.mapperFailed());
      return failure(clientId, provider, "", decision.rejected(), now);
    }

    StreamConnection connection;
    SubscriptionRollback rollback = SubscriptionRollback.capture(clientRegistry, clientId);
    try {
      clientRegistry.addClientSubscription(
          clientId, decision.confirmed(), request.capability(), provider);
      connection = ingress.open(provider, request.capability(), decision.confirmed(), clientId);
      connection.subscribeSymbols(decision.confirmed());
    } catch (RuntimeException ex) {
      rollback.rollBack(decision.confirmed());
      telemetry.onReconnect("resubscribe");
      log.error(
          "Client reconnect failed clientId={} provider={} capability={} errorCode={} error={}",
          clientId,
          provider,
          request.capability(),
          ex.getClass().getSimpleName(),
          ex.getMessage());
      return failure(clientId, provider, "", decision.rejected(), now);
    }

    long gapMs = now - request.lastReceiveTimestamp();
    boolean willRecover = gapMs <= settings.getWindowMs();
    if (!willRecover) {
      telemetry.onReconnect("live");
      log.info(
          "Client reconnected without backfill clientId={} connectionId={} gapMs={} windowMs={}",
          clientId,
          connection.id(),
          gapMs,
          settings.getWindowMs());
      return new ReconnectResponse(
          true,
          clientId,
          decision.confirmed(),
          decision.rejected(),
          ReconnectResponse.RecoveryStrategy.none(),
          connectionInfo(provider, connection.id(), now),
          new ReconnectResponse.Instructions(
              ReconnectAction.NONE, "Reconnected, live data resumes immediately"));
    }

    RecoveryPriority priority =
        REASON_NETWORK_ERROR.equals(request.reason()) ? RecoveryPriority.HIGH : RecoveryPriority.NORMAL;
    RecoveryJob job =
        new RecoveryJob(
            clientId,
            decision.confirmed(),
            request.lastReceiveTimestamp(),
            provider,
            request.capability(),
            priority);
    String jobId;
    try {
      jobId = recoveryWorker.submitRecoveryJob(job);
    } catch (RuntimeException ex) {
      log.error(
          "Recovery job rejected, asking client to resubscribe clientId={} symbols={} error={}",
          clientId,
          decision.confirmed().size(),
          ex.getMessage());
      clientRegistry.requestResubscribe(clientId, RESUBSCRIBE_REASON_JOB_REJECTED);
      telemetry.onReconnect("job_rejected");
      return failure(clientId, provider, connection.id(), decision.rejected(), now);
    }
    telemetry.onRecoveryJobSubmitted(priority);
    telemetry.onReconnect("recovering");
    log.info(
        "Recovery job submitted clientId={} jobId={} priority={} symbols={}",
        clientId,
        jobId,
        priority.code(),
        decision.confirmed().size());

    return new ReconnectResponse(
        true,
        clientId,
        decision.confirmed(),
        decision.rejected(),
        new ReconnectResponse.RecoveryStrategy(
            true, new ReconnectResponse.TimeRange(request.lastReceiveTimestamp(), now), jobId),
        connectionInfo(provider, connection.id(), now),
        new ReconnectResponse.Instructions(
            ReconnectAction.WAIT_FOR_RECOVERY, "Recovering missed data, please wait"));
  }

  /**
   * Flags the clients of every provider that currently has no live upstream connection. Actual
   * notification is left to the client registry.
   */
  public ReconnectionSweepResult detectReconnection() {
    ClientStateStats stats = clientRegistry.getClientStateStats();
    List<String> disconnected = new ArrayList<>();
    int flagged = 0;
    for (Map.Entry<String, Integer> entry : stats.clientsByProvider().entrySet()) {
      String provider = entry.getKey();
      if (entry.getValue() == null || entry.getValue() <= 0) {
        continue;
      }
      if (!connectionManager.hasLiveConnection(provider)) {
        int marked =
            clientRegistry.markClientsForReconnection(provider, RECONNECT_REASON_PROVIDER_LOST);
        disconnected.add(provider);
        flagged += marked;
        log.warn(
            "Provider has no live connection, flagging clients provider={} clients={}",
            provider,
            marked);
      }
    }
    log.debug(
        "Reconnection sweep finished totalClients={} providers={} disconnected={}",
        stats.totalClients(),
        stats.clientsByProvider().size(),
        disconnected.size());
    return new ReconnectionSweepResult(stats.clientsByProvider().size(), disconnected, flagged);
  }

  private void validate(ReconnectRequest request, long now) {
    if (!hasText(request.clientId())) {
      throw new ValidationFailedException("clientId is required");
    }
    if (request.lastReceiveTimestamp() <= 0 || request.lastReceiveTimestamp() > now) {
      throw new ValidationFailedException(
          "Invalid lastReceiveTimestamp: " + request.lastReceiveTimestamp());
    }
    if (request.symbols().isEmpty()) {
      throw new ValidationFailedException("symbols must not be empty");
    }
    if (!hasText(request.capability())) {
      throw new ValidationFailedException("capability is required");
    }
  }

  private SymbolDecision decideSymbols(String provider, List<String> requested) {
    SymbolMappingResult mapping;
    try {
      mapping =
          symbolStandardizer.transformSymbols(provider, requested, MappingDirection.TO_STANDARD);
    } catch (RuntimeException ex) {
      log.warn(
          "Symbol standardization failed during reconnect provider={} symbols={} error={}",
          provider,
          requested.size(),
          ex.getMessage());
      mapping = null;
    }

    Set<String> confirmed = new LinkedHashSet<>();
    List<ReconnectResponse.RejectedSymbol> rejected = new ArrayList<>();
    for (String symbol : requested) {
      String standard = mapping == null ? null : mapping.mappingDetails().get(symbol);
      if (hasText(standard)) {
        confirmed.add(standard);
      } else {
        rejected.add(new ReconnectResponse.RejectedSymbol(symbol, REJECTED_MAPPING));
      }
    }
    return new SymbolDecision(List.copyOf(confirmed), rejected, mapping == null);
  }

  private ReconnectResponse failure(
      String clientId,
      String provider,
      String connectionId,
      List<ReconnectResponse.RejectedSymbol> rejected,
      long now) {
    return new ReconnectResponse(
        false,
        clientId,
        List.of(),
        rejected,
        ReconnectResponse.RecoveryStrategy.none(),
        connectionInfo(provider, connectionId, now),
        new ReconnectResponse.Instructions(
            ReconnectAction.RESUBSCRIBE, "Reconnect failed, please subscribe again"));
  }

  private ReconnectResponse.ConnectionInfo connectionInfo(
      String provider, String connectionId, long now) {
    return new ReconnectResponse.ConnectionInfo(
        provider, connectionId, now, settings.getHeartbeatIntervalMs());
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  private record SymbolDecision(
      List<String> confirmed, List<ReconnectResponse.RejectedSymbol> rejected, boolean mapperFailed) {}
}
