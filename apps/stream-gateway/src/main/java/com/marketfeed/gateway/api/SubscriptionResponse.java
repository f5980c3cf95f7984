package com.marketfeed.gateway.api;

import com.marketfeed.stream.receiver.SubscriptionResult;
import java.util.List;

public record SubscriptionResponse(
    String clientId,
    String provider,
    String capability,
    String connectionId,
    List<String> symbols) {
  public static SubscriptionResponse from(SubscriptionResult result) {
    return new SubscriptionResponse(
        result.clientId(),
        result.provider(),
        result.capability(),
        result.connectionId(),
        result.symbols());
  }
}
