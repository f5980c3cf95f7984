package com.marketfeed.stream.port;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

public record TransformRequest(
    String provider, String apiType, String ruleType, List<JsonNode> rawData) {
  public TransformRequest {
    rawData = rawData == null ? List.of() : List.copyOf(rawData);
  }
}
