package com.marketfeed.gateway.api;

import com.marketfeed.gateway.clients.SseClientPushTransport;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Push channel for quotes, recovery data and reconnect notices. */
@RestController
@RequestMapping("/v1/stream/clients")
public class ClientEventsController {
  private final SseClientPushTransport pushTransport;

  public ClientEventsController(SseClientPushTransport pushTransport) {
    this.pushTransport = pushTransport;
  }

  @GetMapping(path = "/{clientId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter events(@PathVariable String clientId) {
    return pushTransport.open(clientId);
  }
}
