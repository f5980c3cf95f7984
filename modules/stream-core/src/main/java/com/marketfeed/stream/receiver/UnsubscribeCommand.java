package com.marketfeed.stream.receiver;

import java.util.List;

/** An empty symbol list removes the whole subscription. */
public record UnsubscribeCommand(String clientId, List<String> symbols) {
  public UnsubscribeCommand {
    symbols = symbols == null ? List.of() : List.copyOf(symbols);
  }
}
