package com.marketfeed.gateway.api;

import com.marketfeed.stream.recovery.ReconnectRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;

public record ReconnectStreamRequest(
    @NotBlank @Size(max = 128) String clientId,
    long lastReceiveTimestamp,
    @NotEmpty @Size(max = 500) List<@NotBlank String> symbols,
    @NotBlank @Size(max = 64) String capability,
    @Size(max = 64) String preferredProvider,
    @Size(max = 64) String reason) {
  public ReconnectRequest toCommand() {
    return new ReconnectRequest(
        clientId, lastReceiveTimestamp, symbols, capability, preferredProvider, reason);
  }
}
