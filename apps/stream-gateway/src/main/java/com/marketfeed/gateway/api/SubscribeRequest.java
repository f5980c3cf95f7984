package com.marketfeed.gateway.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;

public record SubscribeRequest(
    @NotBlank @Size(max = 128) String clientId,
    @NotEmpty @Size(max = 500) List<@NotBlank String> symbols,
    @NotBlank @Size(max = 64) String capability,
    @Size(max = 64) String preferredProvider) {}
