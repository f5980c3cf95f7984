package com.marketfeed.stream.batch;

import com.marketfeed.stream.config.StreamReceiverProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Load feedback loop for the batch window. Drains are sampled as batches per second once at least
 * one second has elapsed since the previous sample. High and low load modes are entered once, so a
 * sustained load does not move the window on every cycle.
 */
final class AdaptiveBatchInterval {
  private static final long SAMPLE_PERIOD_MS = 1000L;

  private final StreamReceiverProperties.DynamicBatching settings;
  private final List<Double> samples = new ArrayList<>();

  private long currentIntervalMs;
  private long batchesSinceSample;
  private long lastSampleAtMs;
  private boolean highLoadMode;
  private boolean lowLoadMode;

  AdaptiveBatchInterval(
      StreamReceiverProperties.DynamicBatching settings, long initialIntervalMs, long nowMs) {
    this.settings = settings;
    this.currentIntervalMs =
        clamp(initialIntervalMs, settings.getMinIntervalMs(), settings.getMaxIntervalMs());
    this.lastSampleAtMs = nowMs;
  }

  synchronized void recordBatch(long nowMs) {
    long elapsed = nowMs - lastSampleAtMs;
    if (elapsed >= SAMPLE_PERIOD_MS) {
      samples.add(batchesSinceSample * 1000.0 / elapsed);
      batchesSinceSample = 0;
      lastSampleAtMs = nowMs;
    }
    batchesSinceSample++;
  }

  synchronized Optional<IntervalAdjustment> adjust() {
    if (samples.isEmpty()) {
      return Optional.empty();
    }
    double averageLoad = averageOfRecentSamples();
    long previous = currentIntervalMs;
    long next = previous;
    long min = settings.getMinIntervalMs();
    long max = settings.getMaxIntervalMs();

    if (averageLoad >= settings.getHighLoadThreshold()) {
      if (!highLoadMode) {
        highLoadMode = true;
        lowLoadMode = false;
        next = Math.max(settings.getHighLoadIntervalMs(), min);
      }
    } else if (averageLoad <= settings.getLowLoadThreshold()) {
      if (!lowLoadMode) {
        lowLoadMode = true;
        highLoadMode = false;
        next = Math.min(settings.getLowLoadIntervalMs(), max);
      }
    } else {
      highLoadMode = false;
      lowLoadMode = false;
      double target = (settings.getHighLoadThreshold() + settings.getLowLoadThreshold()) / 2.0;
      if (averageLoad > target) {
        next = Math.max(min, previous - settings.getAdjustmentStepMs());
      } else if (averageLoad < target) {
        next = Math.min(max, previous + settings.getAdjustmentStepMs());
      }
    }

    trimSamples();
    if (next == previous) {
      return Optional.empty();
    }
    currentIntervalMs = next;
    return Optional.of(new IntervalAdjustment(previous, next, averageLoad));
  }

  synchronized long currentIntervalMs() {
    return currentIntervalMs;
  }

  synchronized boolean highLoadMode() {
    return highLoadMode;
  }

  synchronized boolean lowLoadMode() {
    return lowLoadMode;
  }

  synchronized int sampleCount() {
    return samples.size();
  }

  private double averageOfRecentSamples() {
    int window = Math.max(1, settings.getSampleWindow());
    List<Double> recent = samples.subList(Math.max(0, samples.size() - window), samples.size());
    double sum = 0.0;
    for (Double sample : recent) {
      sum += sample;
    }
    return sum / recent.size();
  }

  private void trimSamples() {
    int window = Math.max(1, settings.getSampleWindow());
    if (samples.size() > window * 2) {
      samples.subList(0, samples.size() - window).clear();
    }
  }

  private static long clamp(long value, long min, long max) {
    return Math.max(min, Math.min(max, value));
  }
}
