package com.marketfeed.stream.pipeline;

import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/** Bounded set of failure labels used for pipeline metrics. */
public enum PipelineErrorCategory {
  TRANSFORM_ERROR,
  CACHE_ERROR,
  BROADCAST_ERROR,
  TIMEOUT_ERROR,
  NETWORK_ERROR,
  UNKNOWN_ERROR;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static PipelineErrorCategory classify(Throwable error) {
    Throwable current = unwrap(error);
    if (current instanceof PipelineStageException stageException) {
      return stageException.category();
    }
    if (current instanceof TimeoutException) {
      return TIMEOUT_ERROR;
    }
    return classifyMessage(current == null ? null : current.getMessage());
  }

  /** Substring match in a fixed order; the first hit wins. */
  public static PipelineErrorCategory classifyMessage(String message) {
    if (message == null || message.isBlank()) {
      return UNKNOWN_ERROR;
    }
    String normalized = message.toLowerCase(Locale.ROOT);
    if (normalized.contains("transform")) {
      return TRANSFORM_ERROR;
    }
    if (normalized.contains("cache")) {
      return CACHE_ERROR;
    }
    if (normalized.contains("broadcast")) {
      return BROADCAST_ERROR;
    }
    if (normalized.contains("timeout") || normalized.contains("timed out")) {
      return TIMEOUT_ERROR;
    }
    if (normalized.contains("network")) {
      return NETWORK_ERROR;
    }
    return UNKNOWN_ERROR;
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
