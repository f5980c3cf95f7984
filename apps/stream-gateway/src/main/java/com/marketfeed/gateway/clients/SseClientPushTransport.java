package com.marketfeed.gateway.clients;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Server-sent events channel per client. Opening a new channel replaces the previous one. */
public class SseClientPushTransport implements ClientPushTransport {
  private static final Logger log = LoggerFactory.getLogger(SseClientPushTransport.class);

  private final Duration emitterTimeout;
  private final Map<String, SseEmitter> emitters = new ConcurrentHashMap<>();

  public SseClientPushTransport(Duration emitterTimeout) {
    this.emitterTimeout = Objects.requireNonNull(emitterTimeout, "emitterTimeout must not be null");
  }

  public SseEmitter open(String clientId) {
    Objects.requireNonNull(clientId, "clientId must not be null");
    SseEmitter emitter = new SseEmitter(emitterTimeout.toMillis());
    emitter.onCompletion(() -> emitters.remove(clientId, emitter));
    emitter.onTimeout(
        () -> {
          emitters.remove(clientId, emitter);
          emitter.complete();
        });
    emitter.onError(error -> emitters.remove(clientId, emitter));
    SseEmitter previous = emitters.put(clientId, emitter);
    if (previous != null) {
      previous.complete();
    }
    log.info("Client push channel opened clientId={} replaced={}", clientId, previous != null);
    return emitter;
  }

  public int openChannels() {
    return emitters.size();
  }

  @Override
  public boolean send(String clientId, String eventName, JsonNode payload) {
    SseEmitter emitter = emitters.get(clientId);
    if (emitter == null) {
      return false;
    }
    try {
      emitter.send(SseEmitter.event().name(eventName).data(payload, MediaType.APPLICATION_JSON));
      return true;
    } catch (IOException | IllegalStateException ex) {
      emitters.remove(clientId, emitter);
      log.warn(
          "Client push failed, closing channel clientId={} event={} error={}",
          clientId,
          eventName,
          ex.getMessage());
      emitter.completeWithError(ex);
      return false;
    }
  }
}
