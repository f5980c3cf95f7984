package com.marketfeed.stream.connection;

import java.util.Objects;

/** Identity of an upstream feed: one live connection exists per provider and capability. */
public record ConnectionKey(String provider, String capability) {
  public ConnectionKey {
    Objects.requireNonNull(provider, "provider must not be null");
    Objects.requireNonNull(capability, "capability must not be null");
  }

  public static ConnectionKey of(String provider, String capability) {
    return new ConnectionKey(provider, capability);
  }

  public String value() {
    return provider + ":" + capability;
  }

  @Override
  public String toString() {
    return value();
  }
}
