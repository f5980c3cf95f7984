package com.marketfeed.stream.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.marketfeed.stream.config.StreamReceiverProperties;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AdaptiveBatchIntervalTest {
  private static final long START_MS = 1_772_020_800_000L;

  private final StreamReceiverProperties.DynamicBatching settings =
      new StreamReceiverProperties.DynamicBatching();

  @Test
  void shouldNotAdjustWithoutSamples() {
    AdaptiveBatchInterval interval = new AdaptiveBatchInterval(settings, 50L, START_MS);

    assertTrue(interval.adjust().isEmpty());
    assertEquals(50L, interval.currentIntervalMs());
  }

  @Test
  void shouldShrinkWindowOnceUnderHighLoad() {
    AdaptiveBatchInterval interval = new AdaptiveBatchInterval(settings, 50L, START_MS);
    recordLoad(interval, 150, START_MS);

    Optional<IntervalAdjustment> first = interval.adjust();
    recordLoad(interval, 150, START_MS + 1_000L);
    Optional<IntervalAdjustment> second = interval.adjust();

    assertEquals(10L, first.orElseThrow().currentIntervalMs());
    assertEquals(50L, first.orElseThrow().previousIntervalMs());
    assertTrue(second.isEmpty());
    assertTrue(interval.highLoadMode());
  }

  @Test
  void shouldGrowWindowUnderLowLoad() {
    AdaptiveBatchInterval interval = new AdaptiveBatchInterval(settings, 50L, START_MS);
    recordLoad(interval, 2, START_MS);

    IntervalAdjustment adjustment = interval.adjust().orElseThrow();

    assertEquals(100L, adjustment.currentIntervalMs());
    assertTrue(interval.lowLoadMode());
  }

  @Test
  void shouldStepTowardMidpointBetweenThresholds() {
    AdaptiveBatchInterval interval = new AdaptiveBatchInterval(settings, 50L, START_MS);
    recordLoad(interval, 80, START_MS);

    IntervalAdjustment faster = interval.adjust().orElseThrow();
    assertEquals(45L, faster.currentIntervalMs());

    AdaptiveBatchInterval quiet = new AdaptiveBatchInterval(settings, 50L, START_MS);
    recordLoad(quiet, 20, START_MS);
    assertEquals(55L, quiet.adjust().orElseThrow().currentIntervalMs());
  }

  @Test
  void shouldTrimSamplesBeyondTwiceTheWindow() {
    settings.setSampleWindow(2);
    AdaptiveBatchInterval interval = new AdaptiveBatchInterval(settings, 50L, START_MS);
    long now = START_MS;
    for (int second = 0; second < 6; second++) {
      now = recordLoad(interval, 20, now);
    }

    interval.adjust();

    assertEquals(2, interval.sampleCount());
  }

  /**
   * Records {@code batchesPerSecond} drains spread over one second, then one more drain that closes
   * the sample. Returns the time of the closing drain.
   */
  private static long recordLoad(AdaptiveBatchInterval interval, int batchesPerSecond, long fromMs) {
    long stepMs = 1_000L / batchesPerSecond;
    for (int i = 0; i < batchesPerSecond; i++) {
      interval.recordBatch(fromMs + i * stepMs);
    }
    long closingMs = fromMs + 1_000L;
    interval.recordBatch(closingMs);
    return closingMs;
  }
}
