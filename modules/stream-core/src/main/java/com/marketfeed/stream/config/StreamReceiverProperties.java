package com.marketfeed.stream.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "stream.receiver")
public class StreamReceiverProperties {
  private Connection connection = new Connection();
  private Retry retry = new Retry();
  private CircuitBreaker circuitBreaker = new CircuitBreaker();
  private Batch batch = new Batch();
  private Pipeline pipeline = new Pipeline();
  private Memory memory = new Memory();
  private RateLimit rateLimit = new RateLimit();
  private Recovery recovery = new Recovery();
  private Fallback fallback = new Fallback();
  private Providers providers = new Providers();

  public Connection getConnection() {
    return connection;
  }

  public void setConnection(Connection connection) {
    this.connection = connection;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public CircuitBreaker getCircuitBreaker() {
    return circuitBreaker;
  }

  public void setCircuitBreaker(CircuitBreaker circuitBreaker) {
    this.circuitBreaker = circuitBreaker;
  }

  public Batch getBatch() {
    return batch;
  }

  public void setBatch(Batch batch) {
    this.batch = batch;
  }

  public Pipeline getPipeline() {
    return pipeline;
  }

  public void setPipeline(Pipeline pipeline) {
    this.pipeline = pipeline;
  }

  public Memory getMemory() {
    return memory;
  }

  public void setMemory(Memory memory) {
    this.memory = memory;
  }

  public RateLimit getRateLimit() {
    return rateLimit;
  }

  public void setRateLimit(RateLimit rateLimit) {
    this.rateLimit = rateLimit;
  }

  public Recovery getRecovery() {
    return recovery;
  }

  public void setRecovery(Recovery recovery) {
    this.recovery = recovery;
  }

  public Fallback getFallback() {
    return fallback;
  }

  public void setFallback(Fallback fallback) {
    this.fallback = fallback;
  }

  public Providers getProviders() {
    return providers;
  }

  public void setProviders(Providers providers) {
    this.providers = providers;
  }

  public static class Connection {
    private int maxConnections = 1000;
    private long staleTimeoutMs = 600_000L;
    private long cleanupIntervalMs = 300_000L;

    public int getMaxConnections() {
      return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
      this.maxConnections = maxConnections;
    }

    public long getStaleTimeoutMs() {
      return staleTimeoutMs;
    }

    public void setStaleTimeoutMs(long staleTimeoutMs) {
      this.staleTimeoutMs = staleTimeoutMs;
    }

    public long getCleanupIntervalMs() {
      return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
      this.cleanupIntervalMs = cleanupIntervalMs;
    }
  }

  public static class Retry {
    private int maxAttempts = 3;
    private long delayBaseMs = 100L;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getDelayBaseMs() {
      return delayBaseMs;
    }

    public void setDelayBaseMs(long delayBaseMs) {
      this.delayBaseMs = delayBaseMs;
    }
  }

  /** Failure percentage over at least ten attempts that opens the breaker. */
  public static class CircuitBreaker {
    private double thresholdPercent = 50.0d;
    private long resetTimeoutMs = 30_000L;

    public double getThresholdPercent() {
      return thresholdPercent;
    }

    public void setThresholdPercent(double thresholdPercent) {
      this.thresholdPercent = thresholdPercent;
    }

    public long getResetTimeoutMs() {
      return resetTimeoutMs;
    }

    public void setResetTimeoutMs(long resetTimeoutMs) {
      this.resetTimeoutMs = resetTimeoutMs;
    }
  }

  public static class Batch {
    private long intervalMs = 50L;
    private int maxBufferSize = 200;
    private int workerThreads = 2;
    private int groupThreads = 8;
    private DynamicBatching dynamic = new DynamicBatching();

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }

    public int getMaxBufferSize() {
      return maxBufferSize;
    }

    public void setMaxBufferSize(int maxBufferSize) {
      this.maxBufferSize = maxBufferSize;
    }

    public int getWorkerThreads() {
      return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
      this.workerThreads = workerThreads;
    }

    public int getGroupThreads() {
      return groupThreads;
    }

    public void setGroupThreads(int groupThreads) {
      this.groupThreads = groupThreads;
    }

    public DynamicBatching getDynamic() {
      return dynamic;
    }

    public void setDynamic(DynamicBatching dynamic) {
      this.dynamic = dynamic;
    }
  }

  /** Load thresholds are expressed in drained batches per second. */
  public static class DynamicBatching {
    private boolean enabled = true;
    private long minIntervalMs = 10L;
    private long maxIntervalMs = 200L;
    private long highLoadIntervalMs = 10L;
    private long lowLoadIntervalMs = 100L;
    private int sampleWindow = 10;
    private double highLoadThreshold = 100.0d;
    private double lowLoadThreshold = 10.0d;
    private long adjustmentStepMs = 5L;
    private long adjustmentFrequencyMs = 5_000L;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public long getMinIntervalMs() {
      return minIntervalMs;
    }

    public void setMinIntervalMs(long minIntervalMs) {
      this.minIntervalMs = minIntervalMs;
    }

    public long getMaxIntervalMs() {
      return maxIntervalMs;
    }

    public void setMaxIntervalMs(long maxIntervalMs) {
      this.maxIntervalMs = maxIntervalMs;
    }

    public long getHighLoadIntervalMs() {
      return highLoadIntervalMs;
    }

    public void setHighLoadIntervalMs(long highLoadIntervalMs) {
      this.highLoadIntervalMs = highLoadIntervalMs;
    }

    public long getLowLoadIntervalMs() {
      return lowLoadIntervalMs;
    }

    public void setLowLoadIntervalMs(long lowLoadIntervalMs) {
      this.lowLoadIntervalMs = lowLoadIntervalMs;
    }

    public int getSampleWindow() {
      return sampleWindow;
    }

    public void setSampleWindow(int sampleWindow) {
      this.sampleWindow = sampleWindow;
    }

    public double getHighLoadThreshold() {
      return highLoadThreshold;
    }

    public void setHighLoadThreshold(double highLoadThreshold) {
      this.highLoadThreshold = highLoadThreshold;
    }

    public double getLowLoadThreshold() {
      return lowLoadThreshold;
    }

    public void setLowLoadThreshold(double lowLoadThreshold) {
      this.lowLoadThreshold = lowLoadThreshold;
    }

    public long getAdjustmentStepMs() {
      return adjustmentStepMs;
    }

    public void setAdjustmentStepMs(long adjustmentStepMs) {
      this.adjustmentStepMs = adjustmentStepMs;
    }

    public long getAdjustmentFrequencyMs() {
      return adjustmentFrequencyMs;
    }

    public void setAdjustmentFrequencyMs(long adjustmentFrequencyMs) {
      this.adjustmentFrequencyMs = adjustmentFrequencyMs;
    }
  }

  public static class Pipeline {
    private long transformTimeoutMs = 5_000L;
    private long symbolTimeoutMs = 5_000L;
    private long cacheTimeoutMs = 3_000L;
    private long broadcastTimeoutMs = 2_000L;
    private int stageThreads = 16;

    public long getTransformTimeoutMs() {
      return transformTimeoutMs;
    }

    public void setTransformTimeoutMs(long transformTimeoutMs) {
      this.transformTimeoutMs = transformTimeoutMs;
    }

    public long getSymbolTimeoutMs() {
      return symbolTimeoutMs;
    }

    public void setSymbolTimeoutMs(long symbolTimeoutMs) {
      this.symbolTimeoutMs = symbolTimeoutMs;
    }

    public long getCacheTimeoutMs() {
      return cacheTimeoutMs;
    }

    public void setCacheTimeoutMs(long cacheTimeoutMs) {
      this.cacheTimeoutMs = cacheTimeoutMs;
    }

    public long getBroadcastTimeoutMs() {
      return broadcastTimeoutMs;
    }

    public void setBroadcastTimeoutMs(long broadcastTimeoutMs) {
      this.broadcastTimeoutMs = broadcastTimeoutMs;
    }

    public int getStageThreads() {
      return stageThreads;
    }

    public void setStageThreads(int stageThreads) {
      this.stageThreads = stageThreads;
    }
  }

  public static class Memory {
    private long checkIntervalMs = 30_000L;
    private long warningThresholdMb = 400L;
    private long criticalThresholdMb = 800L;
    private double forcedCleanupRatio = 0.1d;

    public long getCheckIntervalMs() {
      return checkIntervalMs;
    }

    public void setCheckIntervalMs(long checkIntervalMs) {
      this.checkIntervalMs = checkIntervalMs;
    }

    public long getWarningThresholdMb() {
      return warningThresholdMb;
    }

    public void setWarningThresholdMb(long warningThresholdMb) {
      this.warningThresholdMb = warningThresholdMb;
    }

    public long getCriticalThresholdMb() {
      return criticalThresholdMb;
    }

    public void setCriticalThresholdMb(long criticalThresholdMb) {
      this.criticalThresholdMb = criticalThresholdMb;
    }

    public double getForcedCleanupRatio() {
      return forcedCleanupRatio;
    }

    public void setForcedCleanupRatio(double forcedCleanupRatio) {
      this.forcedCleanupRatio = forcedCleanupRatio;
    }
  }

  public static class RateLimit {
    private int maxPerWindow = 10;
    private long windowMs = 60_000L;

    public int getMaxPerWindow() {
      return maxPerWindow;
    }

    public void setMaxPerWindow(int maxPerWindow) {
      this.maxPerWindow = maxPerWindow;
    }

    public long getWindowMs() {
      return windowMs;
    }

    public void setWindowMs(long windowMs) {
      this.windowMs = windowMs;
    }
  }

  public static class Recovery {
    private long windowMs = 300_000L;
    private long heartbeatIntervalMs = 30_000L;
    private long detectionIntervalMs = 30_000L;

    public long getWindowMs() {
      return windowMs;
    }

    public void setWindowMs(long windowMs) {
      this.windowMs = windowMs;
    }

    public long getHeartbeatIntervalMs() {
      return heartbeatIntervalMs;
    }

    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
      this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    public long getDetectionIntervalMs() {
      return detectionIntervalMs;
    }

    public void setDetectionIntervalMs(long detectionIntervalMs) {
      this.detectionIntervalMs = detectionIntervalMs;
    }
  }

  public static class Fallback {
    private List<String> prioritySymbols = new ArrayList<>();
    private List<String> priorityMarkets = new ArrayList<>(List.of("HK", "US"));
    private int partialRecoveryLimit = 5;
    private int partialRecoveryMaxBatch = 100;

    public List<String> getPrioritySymbols() {
      return prioritySymbols;
    }

    public void setPrioritySymbols(List<String> prioritySymbols) {
      this.prioritySymbols = prioritySymbols;
    }

    public List<String> getPriorityMarkets() {
      return priorityMarkets;
    }

    public void setPriorityMarkets(List<String> priorityMarkets) {
      this.priorityMarkets = priorityMarkets;
    }

    public int getPartialRecoveryLimit() {
      return partialRecoveryLimit;
    }

    public void setPartialRecoveryLimit(int partialRecoveryLimit) {
      this.partialRecoveryLimit = partialRecoveryLimit;
    }

    public int getPartialRecoveryMaxBatch() {
      return partialRecoveryMaxBatch;
    }

    public void setPartialRecoveryMaxBatch(int partialRecoveryMaxBatch) {
      this.partialRecoveryMaxBatch = partialRecoveryMaxBatch;
    }
  }

  public static class Providers {
    private String defaultProvider = "longport";
    private Map<String, String> marketProviders = defaultMarketProviders();

    public String getDefaultProvider() {
      return defaultProvider;
    }

    public void setDefaultProvider(String defaultProvider) {
      this.defaultProvider = defaultProvider;
    }

    public Map<String, String> getMarketProviders() {
      return marketProviders;
    }

    public void setMarketProviders(Map<String, String> marketProviders) {
      this.marketProviders = marketProviders;
    }
  }

  private static Map<String, String> defaultMarketProviders() {
    Map<String, String> providers = new LinkedHashMap<>();
    providers.put("HK", "longport");
    providers.put("US", "longport");
    providers.put("CN", "longport");
    providers.put("SG", "longport");
    return providers;
  }
}
