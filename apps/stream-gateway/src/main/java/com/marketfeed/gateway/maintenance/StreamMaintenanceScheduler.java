package com.marketfeed.gateway.maintenance;

import com.marketfeed.gateway.recovery.RecoveryJobProcessor;
import com.marketfeed.stream.batch.StreamBatchPipeline;
import com.marketfeed.stream.connection.StreamConnectionManager;
import com.marketfeed.stream.recovery.StreamRecoveryCoordinator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "stream.gateway.maintenance",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class StreamMaintenanceScheduler {
  private final StreamConnectionManager connectionManager;
  private final StreamBatchPipeline batchPipeline;
  private final StreamRecoveryCoordinator recoveryCoordinator;
  private final RecoveryJobProcessor recoveryJobProcessor;

  public StreamMaintenanceScheduler(
      StreamConnectionManager connectionManager,
      StreamBatchPipeline batchPipeline,
      StreamRecoveryCoordinator recoveryCoordinator,
      RecoveryJobProcessor recoveryJobProcessor) {
    this.connectionManager = connectionManager;
    this.batchPipeline = batchPipeline;
    this.recoveryCoordinator = recoveryCoordinator;
    this.recoveryJobProcessor = recoveryJobProcessor;
  }

  @Scheduled(fixedDelayString = "${stream.receiver.connection.cleanup-interval-ms:300000}")
  public void sweepConnections() {
    connectionManager.sweepStaleConnections();
  }

  @Scheduled(fixedDelayString = "${stream.receiver.memory.check-interval-ms:30000}")
  public void checkMemory() {
    connectionManager.checkMemoryPressure();
  }

  @Scheduled(
      fixedDelayString = "${stream.receiver.batch.dynamic.adjustment-frequency-ms:5000}",
      initialDelayString = "${stream.receiver.batch.dynamic.adjustment-frequency-ms:5000}")
  public void adjustBatchInterval() {
    batchPipeline.adjustBatchInterval();
  }

  @Scheduled(fixedDelayString = "${stream.receiver.recovery.detection-interval-ms:30000}")
  public void detectReconnection() {
    recoveryCoordinator.detectReconnection();
  }

  @Scheduled(fixedDelayString = "${stream.gateway.recovery-queue.fixed-delay-ms:1000}")
  public void drainRecoveryJobs() {
    recoveryJobProcessor.drain();
  }
}
