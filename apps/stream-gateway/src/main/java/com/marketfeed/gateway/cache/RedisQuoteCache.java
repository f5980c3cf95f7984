package com.marketfeed.gateway.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketfeed.stream.port.QuoteCache;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Latest-quote store. Values are JSON strings whose TTL depends on the write mode. */
public class RedisQuoteCache implements QuoteCache {
  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final String keyPrefix;
  private final Duration defaultTtl;
  private final Map<String, Duration> modeTtl;

  public RedisQuoteCache(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      String keyPrefix,
      Duration defaultTtl,
      Map<String, Duration> modeTtl) {
    this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix must not be null");
    this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl must not be null");
    this.modeTtl = modeTtl == null ? Map.of() : Map.copyOf(modeTtl);
  }

  @Override
  public void setData(String key, JsonNode value, String mode) {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(value, "value must not be null");
    String json;
    try {
      json = objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize cache value for key " + key, ex);
    }
    redisTemplate.opsForValue().set(redisKey(key), json, ttlFor(mode));
  }

  public Optional<JsonNode> getData(String key) {
    String json = redisTemplate.opsForValue().get(redisKey(key));
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readTree(json));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to parse cached value for key " + key, ex);
    }
  }

  Duration ttlFor(String mode) {
    if (mode == null) {
      return defaultTtl;
    }
    return modeTtl.getOrDefault(mode, defaultTtl);
  }

  private String redisKey(String key) {
    return keyPrefix + ":" + key;
  }
}
