package com.marketfeed.gateway.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "stream.gateway")
public class StreamGatewayProperties {
  private Redis redis = new Redis();
  private Symbols symbols = new Symbols();
  private Transform transform = new Transform();
  private Upstream upstream = new Upstream();
  private RecoveryQueue recoveryQueue = new RecoveryQueue();
  private Push push = new Push();

  public Redis getRedis() {
    return redis;
  }

  public void setRedis(Redis redis) {
    this.redis = redis;
  }

  public Symbols getSymbols() {
    return symbols;
  }

  public void setSymbols(Symbols symbols) {
    this.symbols = symbols;
  }

  public Transform getTransform() {
    return transform;
  }

  public void setTransform(Transform transform) {
    this.transform = transform;
  }

  public Upstream getUpstream() {
    return upstream;
  }

  public void setUpstream(Upstream upstream) {
    this.upstream = upstream;
  }

  public RecoveryQueue getRecoveryQueue() {
    return recoveryQueue;
  }

  public void setRecoveryQueue(RecoveryQueue recoveryQueue) {
    this.recoveryQueue = recoveryQueue;
  }

  public Push getPush() {
    return push;
  }

  public void setPush(Push push) {
    this.push = push;
  }

  public static class Redis {
    private String rateLimitKeyPrefix = "stream:ratelimit";
    private String cacheKeyPrefix = "stream:cache";
    private Duration defaultTtl = Duration.ofSeconds(5);
    private Map<String, Duration> modeTtl = new LinkedHashMap<>();

    public String getRateLimitKeyPrefix() {
      return rateLimitKeyPrefix;
    }

    public void setRateLimitKeyPrefix(String rateLimitKeyPrefix) {
      this.rateLimitKeyPrefix = rateLimitKeyPrefix;
    }

    public String getCacheKeyPrefix() {
      return cacheKeyPrefix;
    }

    public void setCacheKeyPrefix(String cacheKeyPrefix) {
      this.cacheKeyPrefix = cacheKeyPrefix;
    }

    public Duration getDefaultTtl() {
      return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
      this.defaultTtl = defaultTtl;
    }

    public Map<String, Duration> getModeTtl() {
      return modeTtl;
    }

    public void setModeTtl(Map<String, Duration> modeTtl) {
      this.modeTtl = modeTtl;
    }
  }

  public static class Symbols {
    private boolean stripHongKongLeadingZeros = false;
    private int hongKongCodeWidth = 5;
    private Map<String, Map<String, String>> overrides = new LinkedHashMap<>();

    public boolean isStripHongKongLeadingZeros() {
      return stripHongKongLeadingZeros;
    }

    public void setStripHongKongLeadingZeros(boolean stripHongKongLeadingZeros) {
      this.stripHongKongLeadingZeros = stripHongKongLeadingZeros;
    }

    public int getHongKongCodeWidth() {
      return hongKongCodeWidth;
    }

    public void setHongKongCodeWidth(int hongKongCodeWidth) {
      this.hongKongCodeWidth = hongKongCodeWidth;
    }

    public Map<String, Map<String, String>> getOverrides() {
      return overrides;
    }

    public void setOverrides(Map<String, Map<String, String>> overrides) {
      this.overrides = overrides;
    }
  }

  public static class Transform {
    private Map<String, String> fieldAliases = new LinkedHashMap<>();

    public Map<String, String> getFieldAliases() {
      return fieldAliases;
    }

    public void setFieldAliases(Map<String, String> fieldAliases) {
      this.fieldAliases = fieldAliases;
    }
  }

  public static class Upstream {
    private Map<String, String> endpoints = new LinkedHashMap<>();
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration reconnectBaseBackoff = Duration.ofSeconds(1);
    private Duration reconnectMaxBackoff = Duration.ofSeconds(30);

    public Map<String, String> getEndpoints() {
      return endpoints;
    }

    public void setEndpoints(Map<String, String> endpoints) {
      this.endpoints = endpoints;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Duration getReconnectBaseBackoff() {
      return reconnectBaseBackoff;
    }

    public void setReconnectBaseBackoff(Duration reconnectBaseBackoff) {
      this.reconnectBaseBackoff = reconnectBaseBackoff;
    }

    public Duration getReconnectMaxBackoff() {
      return reconnectMaxBackoff;
    }

    public void setReconnectMaxBackoff(Duration reconnectMaxBackoff) {
      this.reconnectMaxBackoff = reconnectMaxBackoff;
    }
  }

  public static class RecoveryQueue {
    private int capacity = 1000;
    private int drainBatchSize = 50;
    private long fixedDelayMs = 1000L;

    public int getCapacity() {
      return capacity;
    }

    public void setCapacity(int capacity) {
      this.capacity = capacity;
    }

    public int getDrainBatchSize() {
      return drainBatchSize;
    }

    public void setDrainBatchSize(int drainBatchSize) {
      this.drainBatchSize = drainBatchSize;
    }

    public long getFixedDelayMs() {
      return fixedDelayMs;
    }

    public void setFixedDelayMs(long fixedDelayMs) {
      this.fixedDelayMs = fixedDelayMs;
    }
  }

  public static class Push {
    private Duration emitterTimeout = Duration.ofMinutes(30);

    public Duration getEmitterTimeout() {
      return emitterTimeout;
    }

    public void setEmitterTimeout(Duration emitterTimeout) {
      this.emitterTimeout = emitterTimeout;
    }
  }
}
