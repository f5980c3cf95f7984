package com.marketfeed.gateway.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.marketfeed.stream.port.DataTransformer;
import com.marketfeed.stream.port.TransformRequest;
import com.marketfeed.stream.port.TransformResult;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renames provider field names to canonical quote fields. Array payloads and {@code data} or
 * {@code quotes} envelopes are flattened; records without a symbol are dropped.
 */
public class FieldAliasDataTransformer implements DataTransformer {
  public static final Map<String, String> DEFAULT_ALIASES =
      Map.of(
          "s", "symbol",
          "p", "lastPrice",
          "last_done", "lastPrice",
          "v", "volume",
          "t", "timestamp",
          "o", "open",
          "h", "high",
          "l", "low");

  private final ObjectMapper objectMapper;
  private final Map<String, String> aliases;

  public FieldAliasDataTransformer(ObjectMapper objectMapper, Map<String, String> extraAliases) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    Map<String, String> merged = new LinkedHashMap<>(DEFAULT_ALIASES);
    if (extraAliases != null) {
      merged.putAll(extraAliases);
    }
    this.aliases = Map.copyOf(merged);
  }

  @Override
  public TransformResult transform(TransformRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    List<JsonNode> records = new ArrayList<>();
    for (JsonNode raw : request.rawData()) {
      collect(raw, request, records);
    }
    return new TransformResult(records);
  }

  private void collect(JsonNode node, TransformRequest request, List<JsonNode> out) {
    if (node == null || node.isNull()) {
      return;
    }
    if (node.isArray()) {
      node.forEach(item -> collect(item, request, out));
      return;
    }
    if (!node.isObject()) {
      return;
    }
    JsonNode envelope = node.has("quotes") ? node.get("quotes") : node.get("data");
    if (envelope != null && envelope.isArray()) {
      collect(envelope, request, out);
      return;
    }
    ObjectNode record = map((ObjectNode) node);
    String symbol = record.path("symbol").asText("");
    if (symbol.isBlank()) {
      return;
    }
    record.put("provider", request.provider());
    record.put("ruleType", request.ruleType());
    out.add(record);
  }

  private ObjectNode map(ObjectNode source) {
    ObjectNode target = objectMapper.createObjectNode();
    Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      String name = aliases.getOrDefault(field.getKey(), field.getKey());
      if (!target.has(name)) {
        target.set(name, field.getValue().deepCopy());
      }
    }
    return target;
  }
}
