package com.marketfeed.stream.testing;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketfeed.stream.port.ClientRegistry;
import com.marketfeed.stream.port.ClientStateStats;
import com.marketfeed.stream.port.ClientSubscription;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingClientRegistry implements ClientRegistry {
  private final Map<String, ClientSubscription> subscriptions = new ConcurrentHashMap<>();
  private final List<Broadcast> broadcasts = new CopyOnWriteArrayList<>();
  private final List<String> reconnectFlags = new CopyOnWriteArrayList<>();
  private final List<String> resubscribeRequests = new CopyOnWriteArrayList<>();
  private volatile RuntimeException broadcastFailure;

  public void failBroadcastsWith(RuntimeException failure) {
    this.broadcastFailure = failure;
  }

  public List<Broadcast> broadcasts() {
    return List.copyOf(broadcasts);
  }

  public List<String> reconnectFlags() {
    return List.copyOf(reconnectFlags);
  }

  public List<String> resubscribeRequests() {
    return List.copyOf(resubscribeRequests);
  }

  @Override
  public void addClientSubscription(
      String clientId, List<String> symbols, String capability, String provider) {
    subscriptions.compute(
        clientId,
        (id, existing) -> {
          Set<String> merged = new LinkedHashSet<>();
          if (existing != null) {
            merged.addAll(existing.symbols());
          }
          merged.addAll(symbols);
          return new ClientSubscription(id, merged, provider, capability);
        });
  }

  @Override
  public void removeClientSubscription(String clientId, List<String> symbols) {
    if (symbols == null || symbols.isEmpty()) {
      subscriptions.remove(clientId);
      return;
    }
    subscriptions.computeIfPresent(
        clientId,
        (id, existing) -> {
          Set<String> remaining = new LinkedHashSet<>(existing.symbols());
          remaining.removeAll(symbols);
          return remaining.isEmpty()
              ? null
              : new ClientSubscription(id, remaining, existing.provider(), existing.capability());
        });
  }

  @Override
  public Optional<ClientSubscription> getClientSubscription(String clientId) {
    return Optional.ofNullable(subscriptions.get(clientId));
  }

  @Override
  public ClientStateStats getClientStateStats() {
    Map<String, Integer> byProvider = new LinkedHashMap<>();
    int totalSubscriptions = 0;
    for (ClientSubscription subscription : subscriptions.values()) {
      byProvider.merge(subscription.provider(), 1, Integer::sum);
      totalSubscriptions += subscription.symbols().size();
    }
    return new ClientStateStats(subscriptions.size(), totalSubscriptions, byProvider);
  }

  @Override
  public void broadcastToSymbol(String symbol, JsonNode payload) {
    if (broadcastFailure != null) {
      throw broadcastFailure;
    }
    broadcasts.add(new Broadcast(symbol, payload));
  }

  @Override
  public int markClientsForReconnection(String provider, String reason) {
    int marked = 0;
    for (ClientSubscription subscription : subscriptions.values()) {
      if (subscription.provider().equals(provider)) {
        reconnectFlags.add(subscription.clientId());
        marked++;
      }
    }
    return marked;
  }

  @Override
  public void requestResubscribe(String clientId, String reason) {
    resubscribeRequests.add(clientId);
  }

  public record Broadcast(String symbol, JsonNode payload) {}
}
