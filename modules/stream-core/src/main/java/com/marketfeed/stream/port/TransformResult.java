package com.marketfeed.stream.port;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

public record TransformResult(List<JsonNode> transformedData) {
  public TransformResult {
    transformedData = transformedData == null ? List.of() : List.copyOf(transformedData);
  }

  public static TransformResult empty() {
    return new TransformResult(List.of());
  }

  public boolean isEmpty() {
    return transformedData.isEmpty();
  }
}
