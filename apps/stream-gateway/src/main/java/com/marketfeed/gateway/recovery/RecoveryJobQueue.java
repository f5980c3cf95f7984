package com.marketfeed.gateway.recovery;

import com.marketfeed.stream.port.RecoveryJob;
import com.marketfeed.stream.port.RecoveryPriority;
import com.marketfeed.stream.port.RecoveryWorker;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded in-memory recovery queue. High priority jobs are always handed out before normal ones;
 * submissions beyond capacity are rejected.
 */
public class RecoveryJobQueue implements RecoveryWorker {
  private final int capacity;
  private final Clock clock;
  private final AtomicLong sequence = new AtomicLong();
  private final Deque<QueuedRecoveryJob> high = new ArrayDeque<>();
  private final Deque<QueuedRecoveryJob> normal = new ArrayDeque<>();

  public RecoveryJobQueue(int capacity, Clock clock) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public synchronized String submitRecoveryJob(RecoveryJob job) {
    Objects.requireNonNull(job, "job must not be null");
    if (size() >= capacity) {
      throw new RecoveryQueueFullException(capacity);
    }
    String jobId = "recovery-" + sequence.incrementAndGet();
    QueuedRecoveryJob queued = new QueuedRecoveryJob(jobId, job, Instant.now(clock));
    if (job.priority() == RecoveryPriority.HIGH) {
      high.addLast(queued);
    } else {
      normal.addLast(queued);
    }
    return jobId;
  }

  public synchronized List<QueuedRecoveryJob> poll(int maxJobs) {
    List<QueuedRecoveryJob> jobs = new ArrayList<>();
    while (jobs.size() < maxJobs && (!high.isEmpty() || !normal.isEmpty())) {
      jobs.add(high.isEmpty() ? normal.pollFirst() : high.pollFirst());
    }
    return jobs;
  }

  public synchronized int size() {
    return high.size() + normal.size();
  }

  public int capacity() {
    return capacity;
  }

  public record QueuedRecoveryJob(String jobId, RecoveryJob job, Instant enqueuedAt) {}

  public static class RecoveryQueueFullException extends IllegalStateException {
    public RecoveryQueueFullException(int capacity) {
      super("Recovery queue is full, capacity=" + capacity);
    }
  }
}
