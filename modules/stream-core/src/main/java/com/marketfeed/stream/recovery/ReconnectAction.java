package com.marketfeed.stream.recovery;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReconnectAction {
  WAIT_FOR_RECOVERY("wait_for_recovery"),
  NONE("none"),
  RESUBSCRIBE("resubscribe");

  private final String code;

  ReconnectAction(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }
}
