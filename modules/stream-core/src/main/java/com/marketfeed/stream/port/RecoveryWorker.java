package com.marketfeed.stream.port;

public interface RecoveryWorker {
  /** Queues a backfill job and returns its id. */
  String submitRecoveryJob(RecoveryJob job);
}
