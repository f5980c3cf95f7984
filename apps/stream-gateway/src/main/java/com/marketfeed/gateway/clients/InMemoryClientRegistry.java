package com.marketfeed.gateway.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.marketfeed.stream.port.ClientRegistry;
import com.marketfeed.stream.port.ClientStateStats;
import com.marketfeed.stream.port.ClientSubscription;
import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscription registry kept in process memory, indexed by client and by symbol. Pushes go through
 * a {@link ClientPushTransport}. All state is guarded by the instance monitor.
 */
public class InMemoryClientRegistry implements ClientRegistry {
  private static final Logger log = LoggerFactory.getLogger(InMemoryClientRegistry.class);

  static final String EVENT_QUOTE = "quote";
  static final String EVENT_RECONNECT_REQUIRED = "reconnect_required";
  static final String EVENT_RESUBSCRIBE_REQUIRED = "resubscribe_required";

  private final ClientPushTransport transport;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Map<String, Entry> subscriptions = new HashMap<>();
  private final Map<String, Set<String>> symbolToClients = new HashMap<>();

  public InMemoryClientRegistry(
      ClientPushTransport transport, ObjectMapper objectMapper, Clock clock) {
    this.transport = Objects.requireNonNull(transport, "transport must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public synchronized void addClientSubscription(
      String clientId, List<String> symbols, String capability, String provider) {
    Objects.requireNonNull(clientId, "clientId must not be null");
    Entry entry = subscriptions.get(clientId);
    if (entry == null) {
      entry = new Entry(provider, capability);
      subscriptions.put(clientId, entry);
    } else {
      entry.provider = provider;
      entry.capability = capability;
    }
    int added = 0;
    for (String symbol : symbols) {
      if (entry.symbols.add(symbol)) {
        symbolToClients.computeIfAbsent(symbol, ignored -> new LinkedHashSet<>()).add(clientId);
        added++;
      }
    }
    log.debug(
        "Client subscription added clientId={} provider={} capability={} added={} total={}",
        clientId,
        provider,
        capability,
        added,
        entry.symbols.size());
  }

  @Override
  public synchronized void removeClientSubscription(String clientId, List<String> symbols) {
    Entry entry = subscriptions.get(clientId);
    if (entry == null) {
      log.debug("Client subscription removal ignored, unknown clientId={}", clientId);
      return;
    }
    List<String> targets =
        symbols == null || symbols.isEmpty() ? List.copyOf(entry.symbols) : symbols;
    for (String symbol : targets) {
      if (entry.symbols.remove(symbol)) {
        unindex(symbol, clientId);
      }
    }
    if (entry.symbols.isEmpty()) {
      subscriptions.remove(clientId);
    }
    log.debug(
        "Client subscription removed clientId={} removed={} remaining={}",
        clientId,
        targets.size(),
        entry.symbols.size());
  }

  @Override
  public synchronized Optional<ClientSubscription> getClientSubscription(String clientId) {
    Entry entry = subscriptions.get(clientId);
    if (entry == null) {
      return Optional.empty();
    }
    return Optional.of(
        new ClientSubscription(clientId, entry.symbols, entry.provider, entry.capability));
  }

  @Override
  public synchronized ClientStateStats getClientStateStats() {
    int totalSubscriptions = 0;
    Map<String, Integer> byProvider = new HashMap<>();
    for (Entry entry : subscriptions.values()) {
      totalSubscriptions += entry.symbols.size();
      byProvider.merge(entry.provider == null ? "unknown" : entry.provider, 1, Integer::sum);
    }
    return new ClientStateStats(subscriptions.size(), totalSubscriptions, byProvider);
  }

  @Override
  public void broadcastToSymbol(String symbol, JsonNode payload) {
    List<String> clients;
    synchronized (this) {
      Set<String> subscribed = symbolToClients.get(symbol);
      clients = subscribed == null ? List.of() : List.copyOf(subscribed);
    }
    int delivered = 0;
    for (String clientId : clients) {
      if (transport.send(clientId, EVENT_QUOTE, payload)) {
        delivered++;
      }
    }
    log.debug(
        "Broadcast finished symbol={} subscribers={} delivered={}",
        symbol,
        clients.size(),
        delivered);
  }

  @Override
  public int markClientsForReconnection(String provider, String reason) {
    List<String> clients;
    synchronized (this) {
      clients =
          subscriptions.entrySet().stream()
              .filter(entry -> Objects.equals(entry.getValue().provider, provider))
              .map(Map.Entry::getKey)
              .toList();
    }
    for (String clientId : clients) {
      transport.send(clientId, EVENT_RECONNECT_REQUIRED, notice(clientId, reason, provider));
    }
    return clients.size();
  }

  @Override
  public void requestResubscribe(String clientId, String reason) {
    String provider;
    synchronized (this) {
      Entry entry = subscriptions.get(clientId);
      provider = entry == null ? null : entry.provider;
    }
    if (!transport.send(clientId, EVENT_RESUBSCRIBE_REQUIRED, notice(clientId, reason, provider))) {
      log.debug("Resubscribe notice not delivered, no open channel clientId={}", clientId);
    }
  }

  private ObjectNode notice(String clientId, String reason, String provider) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("clientId", clientId);
    node.put("reason", reason);
    if (provider != null) {
      node.put("provider", provider);
    }
    node.put("timestamp", clock.millis());
    return node;
  }

  private void unindex(String symbol, String clientId) {
    Set<String> clients = symbolToClients.get(symbol);
    if (clients == null) {
      return;
    }
    clients.remove(clientId);
    if (clients.isEmpty()) {
      symbolToClients.remove(symbol);
    }
  }

  private static final class Entry {
    private final Set<String> symbols = new LinkedHashSet<>();
    private String provider;
    private String capability;

    private Entry(String provider, String capability) {
      this.provider = provider;
      this.capability = capability;
    }
  }
}
