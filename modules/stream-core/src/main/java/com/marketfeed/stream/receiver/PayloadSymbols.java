package com.marketfeed.stream.receiver;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Pulls instrument symbols out of an upstream payload of unknown shape. */
final class PayloadSymbols {
  private PayloadSymbols() {}

  static List<String> extract(JsonNode payload) {
    Set<String> symbols = new LinkedHashSet<>();
    collect(payload, symbols);
    return List.copyOf(symbols);
  }

  private static void collect(JsonNode node, Set<String> symbols) {
    if (node == null || node.isNull()) {
      return;
    }
    if (node.isArray()) {
      for (JsonNode item : node) {
        addText(item.get("symbol"), symbols);
        addText(item.get("s"), symbols);
      }
      return;
    }
    if (!node.isObject()) {
      return;
    }
    addText(node.get("symbol"), symbols);
    addText(node.get("s"), symbols);
    JsonNode list = node.get("symbols");
    if (list != null && list.isArray()) {
      for (JsonNode item : list) {
        addText(item, symbols);
      }
    }
    JsonNode quote = node.get("quote");
    if (quote != null && quote.isObject()) {
      addText(quote.get("symbol"), symbols);
    }
    JsonNode data = node.get("data");
    if (data != null && data.isArray()) {
      collect(data, symbols);
    }
  }

  private static void addText(JsonNode value, Set<String> symbols) {
    if (value != null && value.isTextual() && !value.asText().isBlank()) {
      symbols.add(value.asText().trim());
    }
  }
}
