package com.marketfeed.stream.receiver;

import com.marketfeed.stream.port.ClientRegistry;
import com.marketfeed.stream.port.ClientSubscription;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Undo record for one {@code addClientSubscription} call. Captures the client's subscription
 * before the add so a failed open can put it back the way it was.
 */
public final class SubscriptionRollback {
  private final ClientRegistry clientRegistry;
  private final String clientId;
  private final Optional<ClientSubscription> previous;

  private SubscriptionRollback(
      ClientRegistry clientRegistry, String clientId, Optional<ClientSubscription> previous) {
    this.clientRegistry = clientRegistry;
    this.clientId = clientId;
    this.previous = previous;
  }

  public static SubscriptionRollback capture(ClientRegistry clientRegistry, String clientId) {
    Objects.requireNonNull(clientRegistry, "clientRegistry must not be null");
    return new SubscriptionRollback(
        clientRegistry, clientId, clientRegistry.getClientSubscription(clientId));
  }

  /** Removes the symbols the add introduced and restores the earlier provider and capability. */
  public void rollBack(List<String> addedSymbols) {
    List<String> introduced = new ArrayList<>();
    for (String symbol : addedSymbols) {
      if (previous.isEmpty() || !previous.get().symbols().contains(symbol)) {
        introduced.add(symbol);
      }
    }
    if (!introduced.isEmpty()) {
      clientRegistry.removeClientSubscription(clientId, introduced);
    }
    if (previous.isEmpty()) {
      return;
    }
    ClientSubscription earlier = previous.get();
    clientRegistry.addClientSubscription(
        clientId, List.copyOf(earlier.symbols()), earlier.capability(), earlier.provider());
  }
}
