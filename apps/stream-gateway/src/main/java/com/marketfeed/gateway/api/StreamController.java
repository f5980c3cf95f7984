package com.marketfeed.gateway.api;

import com.marketfeed.stream.receiver.StreamReceiverService;
import com.marketfeed.stream.receiver.StreamReceiverStats;
import com.marketfeed.stream.receiver.SubscribeCommand;
import com.marketfeed.stream.receiver.UnsubscribeCommand;
import com.marketfeed.stream.recovery.ReconnectResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/stream")
public class StreamController {
  private final StreamReceiverService streamReceiverService;

  public StreamController(StreamReceiverService streamReceiverService) {
    this.streamReceiverService = streamReceiverService;
  }

  @PostMapping("/subscriptions")
  public ResponseEntity<SubscriptionResponse> subscribe(
      @Valid @RequestBody SubscribeRequest request, HttpServletRequest servletRequest) {
    SubscribeCommand command =
        new SubscribeCommand(
            request.clientId(),
            servletRequest.getRemoteAddr(),
            request.symbols(),
            request.capability(),
            request.preferredProvider());
    return ResponseEntity.ok(SubscriptionResponse.from(streamReceiverService.subscribe(command)));
  }

  @DeleteMapping("/subscriptions")
  public ResponseEntity<Void> unsubscribe(
      @Valid @RequestBody(required = false) UnsubscribeRequest request) {
    if (request != null) {
      streamReceiverService.unsubscribe(
          new UnsubscribeCommand(request.clientId(), request.symbols()));
    }
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/reconnect")
  public ResponseEntity<ReconnectResponse> reconnect(
      @Valid @RequestBody ReconnectStreamRequest request) {
    return ResponseEntity.ok(streamReceiverService.reconnect(request.toCommand()));
  }

  @GetMapping("/stats")
  public ResponseEntity<StreamReceiverStats> stats() {
    return ResponseEntity.ok(streamReceiverService.stats());
  }
}
