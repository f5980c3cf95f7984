package com.marketfeed.gateway.api;

import jakarta.validation.constraints.Size;
import java.util.List;

/** A missing {@code symbols} list removes the whole subscription. */
public record UnsubscribeRequest(
    @Size(max = 128) String clientId, @Size(max = 500) List<String> symbols) {}
