package com.marketfeed.gateway.maintenance;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.marketfeed.gateway.recovery.RecoveryJobProcessor;
import com.marketfeed.stream.batch.StreamBatchPipeline;
import com.marketfeed.stream.connection.StreamConnectionManager;
import com.marketfeed.stream.recovery.StreamRecoveryCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StreamMaintenanceSchedulerTest {
  private StreamConnectionManager connectionManager;
  private StreamBatchPipeline batchPipeline;
  private StreamRecoveryCoordinator recoveryCoordinator;
  private RecoveryJobProcessor recoveryJobProcessor;
  private StreamMaintenanceScheduler scheduler;

  @BeforeEach
  void setUp() {
    connectionManager = mock(StreamConnectionManager.class);
    batchPipeline = mock(StreamBatchPipeline.class);
    recoveryCoordinator = mock(StreamRecoveryCoordinator.class);
    recoveryJobProcessor = mock(RecoveryJobProcessor.class);
    scheduler =
        new StreamMaintenanceScheduler(
            connectionManager, batchPipeline, recoveryCoordinator, recoveryJobProcessor);
  }

  @Test
  void shouldDelegateConnectionMaintenance() {
    scheduler.sweepConnections();
    scheduler.checkMemory();

    verify(connectionManager).sweepStaleConnections();
    verify(connectionManager).checkMemoryPressure();
    verifyNoInteractions(batchPipeline, recoveryCoordinator, recoveryJobProcessor);
  }

  @Test
  void shouldDelegateBatchAndRecoveryTicks() {
    scheduler.adjustBatchInterval();
    scheduler.detectReconnection();
    scheduler.drainRecoveryJobs();

    verify(batchPipeline).adjustBatchInterval();
    verify(recoveryCoordinator).detectReconnection();
    verify(recoveryJobProcessor).drain();
  }
}
