package com.marketfeed.gateway.recovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.marketfeed.stream.port.RecoveryJob;
import com.marketfeed.stream.port.RecoveryPriority;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecoveryJobQueueTest {
  private static final Instant NOW = Instant.parse("2026-02-25T12:00:00Z");

  private final RecoveryJobQueue queue = new RecoveryJobQueue(3, Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void shouldHandOutHighPriorityJobsFirst() {
    String normal = queue.submitRecoveryJob(job("c1", RecoveryPriority.NORMAL));
    String high = queue.submitRecoveryJob(job("c2", RecoveryPriority.HIGH));

    List<RecoveryJobQueue.QueuedRecoveryJob> polled = queue.poll(10);

    assertEquals(
        List.of(high, normal),
        polled.stream().map(RecoveryJobQueue.QueuedRecoveryJob::jobId).toList());
    assertEquals(NOW, polled.get(0).enqueuedAt());
    assertEquals(0, queue.size());
  }

  @Test
  void shouldAssignSequentialJobIds() {
    assertEquals("recovery-1", queue.submitRecoveryJob(job("c1", RecoveryPriority.NORMAL)));
    assertEquals("recovery-2", queue.submitRecoveryJob(job("c1", RecoveryPriority.NORMAL)));
  }

  @Test
  void shouldLimitPollToRequestedCount() {
    queue.submitRecoveryJob(job("c1", RecoveryPriority.NORMAL));
    queue.submitRecoveryJob(job("c2", RecoveryPriority.NORMAL));

    assertEquals(1, queue.poll(1).size());
    assertEquals(1, queue.size());
  }

  @Test
  void shouldRejectSubmissionsBeyondCapacity() {
    queue.submitRecoveryJob(job("c1", RecoveryPriority.NORMAL));
    queue.submitRecoveryJob(job("c2", RecoveryPriority.NORMAL));
    queue.submitRecoveryJob(job("c3", RecoveryPriority.HIGH));

    assertThrows(
        RecoveryJobQueue.RecoveryQueueFullException.class,
        () -> queue.submitRecoveryJob(job("c4", RecoveryPriority.HIGH)));
    assertEquals(3, queue.capacity());
  }

  @Test
  void shouldRejectNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new RecoveryJobQueue(0, Clock.systemUTC()));
  }

  private static RecoveryJob job(String clientId, RecoveryPriority priority) {
    return new RecoveryJob(
        clientId, List.of("AAPL.US"), 1_000L, "longport", "ws-stock-quote", priority);
  }
}
