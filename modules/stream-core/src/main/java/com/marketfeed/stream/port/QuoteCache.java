package com.marketfeed.stream.port;

import com.fasterxml.jackson.databind.JsonNode;

public interface QuoteCache {
  void setData(String key, JsonNode value, String mode);
}
