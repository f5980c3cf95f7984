package com.marketfeed.stream.receiver;

import com.marketfeed.stream.batch.StreamBatchPipeline;
import com.marketfeed.stream.connection.StreamConnection;
import com.marketfeed.stream.connection.StreamConnectionManager;
import com.marketfeed.stream.error.RateLimitedException;
import com.marketfeed.stream.error.ValidationFailedException;
import com.marketfeed.stream.market.MarketProviderResolver;
import com.marketfeed.stream.port.ClientRegistry;
import com.marketfeed.stream.port.ClientSubscription;
import com.marketfeed.stream.port.MappingDirection;
import com.marketfeed.stream.port.RateLimitDecision;
import com.marketfeed.stream.port.SymbolMappingResult;
import com.marketfeed.stream.port.SymbolStandardizer;
import com.marketfeed.stream.recovery.ReconnectRequest;
import com.marketfeed.stream.recovery.ReconnectResponse;
import com.marketfeed.stream.recovery.StreamRecoveryCoordinator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Inbound API of the stream core: subscribe, unsubscribe, reconnect and stats. */
public class StreamReceiverService {
  private static final Logger log = LoggerFactory.getLogger(StreamReceiverService.class);

  private final StreamConnectionManager connectionManager;
  private final StreamBatchPipeline batchPipeline;
  private final StreamIngress ingress;
  private final StreamRecoveryCoordinator recoveryCoordinator;
  private final SymbolStandardizer symbolStandardizer;
  private final ClientRegistry clientRegistry;
  private final MarketProviderResolver providerResolver;

  public StreamReceiverService(
      StreamConnectionManager connectionManager,
      StreamBatchPipeline batchPipeline,
      StreamIngress ingress,
      StreamRecoveryCoordinator recoveryCoordinator,
      SymbolStandardizer symbolStandardizer,
      ClientRegistry clientRegistry,
      MarketProviderResolver providerResolver) {
    this.connectionManager =
        Objects.requireNonNull(connectionManager, "connectionManager must not be null");
    this.batchPipeline = Objects.requireNonNull(batchPipeline, "batchPipeline must not be null");
    this.ingress = Objects.requireNonNull(ingress, "ingress must not be null");
    this.recoveryCoordinator =
        Objects.requireNonNull(recoveryCoordinator, "recoveryCoordinator must not be null");
    this.symbolStandardizer =
        Objects.requireNonNull(symbolStandardizer, "symbolStandardizer must not be null");
    this.clientRegistry = Objects.requireNonNull(clientRegistry, "clientRegistry must not be null");
    this.providerResolver =
        Objects.requireNonNull(providerResolver, "providerResolver must not be null");
  }

  public SubscriptionResult subscribe(SubscribeCommand command) {
    Objects.requireNonNull(command, "command must not be null");
    if (!hasText(command.clientId())) {
      throw new ValidationFailedException("clientId is required");
    }
    if (command.symbols().isEmpty()) {
      throw new ValidationFailedException("symbols must not be empty");
    }
    if (!hasText(command.capability())) {
      throw new ValidationFailedException("capability is required");
    }

    String clientId = command.clientId();
    String provider =
        hasText(command.preferredProvider())
            ? command.preferredProvider()
            : providerResolver.resolveProvider(command.symbols());

    RateLimitDecision rateLimit = connectionManager.evaluateRateLimit(clientId);
    if (!rateLimit.allowed()) {
      log.warn(
          "Subscription rejected by rate limit clientId={} clientIp={} retryAfterSeconds={}",
          clientId,
          command.clientIp(),
          rateLimit.retryAfterSeconds());
      throw new RateLimitedException(clientId, rateLimit.retryAfterSeconds());
    }

    List<String> symbols = standardize(provider, command.symbols());
    SubscriptionRollback rollback = SubscriptionRollback.capture(clientRegistry, clientId);
    clientRegistry.addClientSubscription(clientId, symbols, command.capability(), provider);
    StreamConnection connection;
    try {
      connection = ingress.open(provider, command.capability(), symbols, clientId);
      connection.subscribeSymbols(symbols);
    } catch (RuntimeException ex) {
      rollback.rollBack(symbols);
      throw ex;
    }

    log.info(
        "Client subscribed clientId={} provider={} capability={} connectionId={} symbols={}",
        clientId,
        provider,
        command.capability(),
        connection.id(),
        symbols.size());
    return new SubscriptionResult(
        clientId, provider, command.capability(), connection.id(), symbols);
  }

  public void unsubscribe(UnsubscribeCommand command) {
    if (command == null || !hasText(command.clientId())) {
      log.warn("Unsubscribe ignored, clientId missing");
      return;
    }
    String clientId = command.clientId();
    Optional<ClientSubscription> subscription = clientRegistry.getClientSubscription(clientId);
    if (subscription.isEmpty()) {
      log.debug("Unsubscribe ignored, no subscription clientId={}", clientId);
      return;
    }
    List<String> symbols =
        command.symbols().isEmpty()
            ? List.of()
            : standardize(subscription.get().provider(), command.symbols());
    clientRegistry.removeClientSubscription(clientId, symbols);
    log.info(
        "Client unsubscribed clientId={} provider={} symbols={}",
        clientId,
        subscription.get().provider(),
        symbols.isEmpty() ? "all" : symbols.size());
  }

  public ReconnectResponse reconnect(ReconnectRequest request) {
    return recoveryCoordinator.handleReconnect(request);
  }

  public StreamReceiverStats stats() {
    return new StreamReceiverStats(
        batchPipeline.stats(),
        batchPipeline.circuitBreakerState(),
        connectionManager.connectionStats(),
        clientRegistry.getClientStateStats());
  }

  private List<String> standardize(String provider, List<String> symbols) {
    SymbolMappingResult mapping;
    try {
      mapping = symbolStandardizer.transformSymbols(provider, symbols, MappingDirection.TO_STANDARD);
    } catch (RuntimeException ex) {
      log.warn(
          "Symbol standardization failed, keeping raw symbols provider={} symbols={} error={}",
          provider,
          symbols.size(),
          ex.getMessage());
      return List.copyOf(new LinkedHashSet<>(symbols));
    }
    if (mapping == null) {
      return List.copyOf(new LinkedHashSet<>(symbols));
    }
    Set<String> standardized = new LinkedHashSet<>();
    for (String symbol : symbols) {
      standardized.add(mapping.standardOrOriginal(symbol));
    }
    return List.copyOf(standardized);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
