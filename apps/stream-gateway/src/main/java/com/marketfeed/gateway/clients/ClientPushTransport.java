package com.marketfeed.gateway.clients;

import com.fasterxml.jackson.databind.JsonNode;

/** Delivers one named event to one connected client. */
public interface ClientPushTransport {
  /** Returns {@code false} when the client has no open channel. */
  boolean send(String clientId, String eventName, JsonNode payload);
}
