package com.marketfeed.stream.port;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;

/** Per-client subscription registry and push transport. */
public interface ClientRegistry {
  void addClientSubscription(
      String clientId, List<String> symbols, String capability, String provider);

  /** Removes the given symbols, or the whole subscription when {@code symbols} is empty. */
  void removeClientSubscription(String clientId, List<String> symbols);

  Optional<ClientSubscription> getClientSubscription(String clientId);

  ClientStateStats getClientStateStats();

  void broadcastToSymbol(String symbol, JsonNode payload);

  /** Flags every client subscribed through {@code provider}; returns how many were flagged. */
  int markClientsForReconnection(String provider, String reason);

  void requestResubscribe(String clientId, String reason);
}
