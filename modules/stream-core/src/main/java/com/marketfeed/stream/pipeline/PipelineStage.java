package com.marketfeed.stream.pipeline;

public enum PipelineStage {
  TRANSFORM("transform", "transform"),
  SYMBOL_STANDARDIZATION("symbol_standardization", "symbol standardization"),
  CACHE_WRITE("cache_write", "cache write"),
  BROADCAST("broadcast", "broadcast");

  private final String code;
  private final String label;

  PipelineStage(String code, String label) {
    this.code = code;
    this.label = label;
  }

  public String code() {
    return code;
  }

  public String label() {
    return label;
  }
}
