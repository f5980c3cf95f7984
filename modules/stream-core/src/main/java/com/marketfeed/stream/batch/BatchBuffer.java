package com.marketfeed.stream.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Time-boxed buffer. The first item of a window schedules a drain after {@code intervalMs}; reaching
 * {@code maxSize} drains immediately. Drained lists are handed to the sink outside the lock.
 */
final class BatchBuffer<T> implements AutoCloseable {
  private final long intervalMs;
  private final int maxSize;
  private final ScheduledExecutorService scheduler;
  private final Consumer<List<T>> sink;
  private final Object lock = new Object();

  private List<T> pending = new ArrayList<>();
  private ScheduledFuture<?> scheduledDrain;
  private boolean closed;

  BatchBuffer(
      long intervalMs, int maxSize, ScheduledExecutorService scheduler, Consumer<List<T>> sink) {
    this.intervalMs = intervalMs;
    this.maxSize = Math.max(1, maxSize);
    this.scheduler = scheduler;
    this.sink = sink;
  }

  /** Returns {@code false} once the buffer is closed. */
  boolean offer(T item) {
    List<T> ready = null;
    synchronized (lock) {
      if (closed) {
        return false;
      }
      pending.add(item);
      if (pending.size() >= maxSize) {
        ready = takeLocked();
      } else if (scheduledDrain == null) {
        scheduledDrain = scheduleDrainLocked();
      }
    }
    if (ready != null) {
      sink.accept(ready);
    }
    return true;
  }

  void flush() {
    List<T> ready;
    synchronized (lock) {
      ready = takeLocked();
    }
    if (!ready.isEmpty()) {
      sink.accept(ready);
    }
  }

  long intervalMs() {
    return intervalMs;
  }

  int pendingCount() {
    synchronized (lock) {
      return pending.size();
    }
  }

  @Override
  public void close() {
    synchronized (lock) {
      closed = true;
    }
    flush();
  }

  private ScheduledFuture<?> scheduleDrainLocked() {
    try {
      return scheduler.schedule(this::flush, intervalMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      // Scheduler already stopped; the next offer or close drains the items.
      return null;
    }
  }

  private List<T> takeLocked() {
    if (scheduledDrain != null) {
      scheduledDrain.cancel(false);
      scheduledDrain = null;
    }
    List<T> ready = pending;
    pending = new ArrayList<>();
    return ready;
  }
}
