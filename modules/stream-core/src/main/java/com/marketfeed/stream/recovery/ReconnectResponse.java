package com.marketfeed.stream.recovery;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReconnectResponse(
    boolean success,
    String clientId,
    List<String> confirmedSymbols,
    List<RejectedSymbol> rejectedSymbols,
    RecoveryStrategy recoveryStrategy,
    ConnectionInfo connectionInfo,
    Instructions instructions) {
  public ReconnectResponse {
    confirmedSymbols = confirmedSymbols == null ? List.of() : List.copyOf(confirmedSymbols);
    rejectedSymbols =
        rejectedSymbols == null || rejectedSymbols.isEmpty() ? null : List.copyOf(rejectedSymbols);
  }

  public record RejectedSymbol(String symbol, String reason) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record RecoveryStrategy(boolean willRecover, TimeRange timeRange, String recoveryJobId) {
    static RecoveryStrategy none() {
      return new RecoveryStrategy(false, null, null);
    }
  }

  public record TimeRange(long from, long to) {}

  public record ConnectionInfo(
      String provider, String connectionId, long serverTimestamp, long heartbeatInterval) {}

  public record Instructions(ReconnectAction action, String message) {}
}
