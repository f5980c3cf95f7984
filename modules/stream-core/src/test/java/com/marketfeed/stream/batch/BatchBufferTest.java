package com.marketfeed.stream.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BatchBufferTest {
  private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
  private final List<List<String>> drained = new CopyOnWriteArrayList<>();

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  void shouldDrainImmediatelyWhenFull() {
    BatchBuffer<String> buffer = new BatchBuffer<>(60_000L, 3, scheduler, drained::add);

    buffer.offer("a");
    buffer.offer("b");
    assertTrue(drained.isEmpty());
    buffer.offer("c");

    assertEquals(List.of(List.of("a", "b", "c")), drained);
    assertEquals(0, buffer.pendingCount());
  }

  @Test
  void shouldDrainAfterInterval() throws InterruptedException {
    CountDownLatch drainedOnce = new CountDownLatch(1);
    BatchBuffer<String> buffer =
        new BatchBuffer<>(
            20L,
            100,
            scheduler,
            batch -> {
              drained.add(batch);
              drainedOnce.countDown();
            });

    buffer.offer("a");
    buffer.offer("b");

    assertTrue(drainedOnce.await(2, TimeUnit.SECONDS));
    assertEquals(List.of(List.of("a", "b")), drained);
  }

  @Test
  void shouldFlushPendingItemsOnCloseAndRefuseNewOnes() {
    BatchBuffer<String> buffer = new BatchBuffer<>(60_000L, 100, scheduler, drained::add);
    buffer.offer("a");

    buffer.close();

    assertEquals(List.of(List.of("a")), drained);
    assertFalse(buffer.offer("b"));
    assertEquals(0, buffer.pendingCount());
  }

  @Test
  void shouldNotCallSinkForEmptyFlush() {
    BatchBuffer<String> buffer = new BatchBuffer<>(60_000L, 100, scheduler, drained::add);

    buffer.flush();

    assertTrue(drained.isEmpty());
  }
}
