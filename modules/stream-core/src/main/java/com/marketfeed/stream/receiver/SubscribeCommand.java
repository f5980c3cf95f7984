package com.marketfeed.stream.receiver;

import java.util.List;

public record SubscribeCommand(
    String clientId,
    String clientIp,
    List<String> symbols,
    String capability,
    String preferredProvider) {
  public SubscribeCommand {
    symbols = symbols == null ? List.of() : List.copyOf(symbols);
  }
}
