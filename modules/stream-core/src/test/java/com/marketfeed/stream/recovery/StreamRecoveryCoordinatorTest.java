package com.marketfeed.stream.recovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.marketfeed.stream.batch.StreamBatchPipeline;
import com.marketfeed.stream.capability.CapabilityMapper;
import com.marketfeed.stream.config.StreamReceiverProperties;
import com.marketfeed.stream.connection.StreamConnectionManager;
import com.marketfeed.stream.error.ValidationFailedException;
import com.marketfeed.stream.market.MarketProviderResolver;
import com.marketfeed.stream.observability.MicrometerStreamTelemetry;
import com.marketfeed.stream.observability.StreamTelemetry;
import com.marketfeed.stream.pipeline.StreamDataPipeline;
import com.marketfeed.stream.port.ClientSubscription;
import com.marketfeed.stream.port.RecoveryJob;
import com.marketfeed.stream.port.RecoveryPriority;
import com.marketfeed.stream.receiver.StreamIngress;
import com.marketfeed.stream.testing.FakeStreamConnector;
import com.marketfeed.stream.testing.MapSymbolStandardizer;
import com.marketfeed.stream.testing.MutableClock;
import com.marketfeed.stream.testing.RecordingClientRegistry;
import com.marketfeed.stream.testing.RecordingQuoteCache;
import com.marketfeed.stream.testing.StubDataTransformer;
import com.marketfeed.stream.testing.StubRateLimitGateway;
import com.marketfeed.stream.testing.StubRecoveryWorker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StreamRecoveryCoordinatorTest {
  private static final String CAPABILITY = "ws-stock-quote";

  private MutableClock clock;
  private SimpleMeterRegistry registry;
  private FakeStreamConnector connector;
  private RecordingClientRegistry clientRegistry;
  private MapSymbolStandardizer standardizer;
  private StubRecoveryWorker recoveryWorker;
  private StreamConnectionManager connectionManager;
  private StreamDataPipeline dataPipeline;
  private StreamBatchPipeline batchPipeline;
  private StreamRecoveryCoordinator coordinator;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-02-25T12:00:00Z");
    registry = new SimpleMeterRegistry();
    StreamTelemetry telemetry = new MicrometerStreamTelemetry(registry);
    StreamReceiverProperties properties = new StreamReceiverProperties();
    properties.getProviders().setDefaultProvider("P");
    properties.getProviders().setMarketProviders(Map.of("HK", "P", "US", "P"));

    connector = new FakeStreamConnector(clock);
    clientRegistry = new RecordingClientRegistry();
    standardizer =
        new MapSymbolStandardizer(Map.of("700.HK", "00700.HK", "AAPL.US", "AAPL.US"));
    recoveryWorker = new StubRecoveryWorker();
    connectionManager =
        new StreamConnectionManager(
            connector, StubRateLimitGateway.allowAll(), properties, telemetry);
    dataPipeline =
        new StreamDataPipeline(
            StubDataTransformer.passThrough(),
            standardizer,
            new RecordingQuoteCache(),
            clientRegistry,
            new CapabilityMapper(),
            properties,
            telemetry);
    batchPipeline = new StreamBatchPipeline(dataPipeline, properties, telemetry);
    coordinator =
        new StreamRecoveryCoordinator(
            standardizer,
            clientRegistry,
            connectionManager,
            new StreamIngress(connectionManager, batchPipeline),
            recoveryWorker,
            new MarketProviderResolver(properties.getProviders()),
            properties,
            telemetry,
            clock);
  }

  @AfterEach
  void tearDown() {
    batchPipeline.close();
    dataPipeline.close();
    connectionManager.close();
  }

  @Test
  void shouldScheduleRecoveryWhenGapIsInsideWindow() {
    long lastReceive = clock.millis() - Duration.ofSeconds(60).toMillis();

    ReconnectResponse response =
        coordinator.handleReconnect(request(lastReceive, List.of("700.HK", "AAPL.US"), "timeout"));

    assertTrue(response.success());
    assertEquals(List.of("00700.HK", "AAPL.US"), response.confirmedSymbols());
    assertNull(response.rejectedSymbols());
    assertEquals(ReconnectAction.WAIT_FOR_RECOVERY, response.instructions().action());
    assertTrue(response.recoveryStrategy().willRecover());
    assertEquals(lastReceive, response.recoveryStrategy().timeRange().from());
    assertEquals(clock.millis(), response.recoveryStrategy().timeRange().to());
    assertEquals("recovery-1", response.recoveryStrategy().recoveryJobId());
    assertEquals("conn-1", response.connectionInfo().connectionId());
    assertEquals(30_000L, response.connectionInfo().heartbeatInterval());

    RecoveryJob job = recoveryWorker.jobs().get(0);
    assertEquals(RecoveryPriority.NORMAL, job.priority());
    assertEquals(lastReceive, job.lastReceiveTimestamp());
    assertEquals(List.of("00700.HK", "AAPL.US"), connector.opened().get(0).subscribedSymbols());
    assertTrue(clientRegistry.getClientSubscription("client-1").isPresent());
    assertEquals(
        1.0d,
        registry.get("stream.reconnect.total").tag("outcome", "recovering").counter().count());
  }

  @Test
  void shouldResumeLiveWithoutBackfillWhenGapExceedsWindow() {
    long lastReceive = clock.millis() - Duration.ofMinutes(10).toMillis();

    ReconnectResponse response =
        coordinator.handleReconnect(request(lastReceive, List.of("700.HK"), "timeout"));

    assertTrue(response.success());
    assertEquals(ReconnectAction.NONE, response.instructions().action());
    assertFalse(response.recoveryStrategy().willRecover());
    assertNull(response.recoveryStrategy().recoveryJobId());
    assertTrue(recoveryWorker.jobs().isEmpty());
  }

  @Test
  void shouldRejectInvalidTimestampsWithoutSideEffects() {
    long future = clock.millis() + 1_000L;

    assertThrows(
        ValidationFailedException.class,
        () -> coordinator.handleReconnect(request(future, List.of("700.HK"), "timeout")));
    assertThrows(
        ValidationFailedException.class,
        () -> coordinator.handleReconnect(request(0L, List.of("700.HK"), "timeout")));

    assertTrue(connector.requests().isEmpty());
    assertTrue(recoveryWorker.jobs().isEmpty());
    assertTrue(clientRegistry.getClientSubscription("client-1").isEmpty());
    assertEquals(0, standardizer.calls());
  }

  @Test
  void shouldRejectMissingClientIdAndSymbols() {
    long lastReceive = clock.millis() - 1_000L;

    assertThrows(
        ValidationFailedException.class,
        () ->
            coordinator.handleReconnect(
                new ReconnectRequest(" ", lastReceive, List.of("700.HK"), CAPABILITY, null, null)));
    assertThrows(
        ValidationFailedException.class,
        () -> coordinator.handleReconnect(request(lastReceive, List.of(), "timeout")));
  }

  @Test
  void shouldReportUnmappedSymbolsAsRejected() {
    long lastReceive = clock.millis() - 5_000L;

    ReconnectResponse response =
        coordinator.handleReconnect(request(lastReceive, List.of("700.HK", "ZZZZ.XX"), "timeout"));

    assertTrue(response.success());
    assertEquals(List.of("00700.HK"), response.confirmedSymbols());
    assertEquals(
        List.of(
            new ReconnectResponse.RejectedSymbol(
                "ZZZZ.XX", StreamRecoveryCoordinator.REJECTED_MAPPING)),
        response.rejectedSymbols());
  }

  @Test
  void shouldAskForResubscribeWhenNothingIsConfirmed() {
    long lastReceive = clock.millis() - 5_000L;

    ReconnectResponse response =
        coordinator.handleReconnect(request(lastReceive, List.of("ZZZZ.XX"), "timeout"));

    assertFalse(response.success());
    assertEquals(ReconnectAction.RESUBSCRIBE, response.instructions().action());
    assertTrue(response.confirmedSymbols().isEmpty());
    assertTrue(connector.requests().isEmpty());
  }

  @Test
  void shouldAskForResubscribeWhenRecoveryJobIsRejected() {
    recoveryWorker.failWith(new IllegalStateException("recovery queue full"));
    long lastReceive = clock.millis() - 5_000L;

    ReconnectResponse response =
        coordinator.handleReconnect(request(lastReceive, List.of("700.HK"), "timeout"));

    assertFalse(response.success());
    assertEquals(ReconnectAction.RESUBSCRIBE, response.instructions().action());
    assertEquals("conn-1", response.connectionInfo().connectionId());
    assertEquals(List.of("client-1"), clientRegistry.resubscribeRequests());
    assertEquals(
        1.0d,
        registry.get("stream.reconnect.total").tag("outcome", "job_rejected").counter().count());
  }

  @Test
  void shouldRestorePreviousSubscriptionWhenReconnectCannotOpenUpstream() {
    clientRegistry.addClientSubscription("client-1", List.of("00700.HK"), "ws-option-quote", "Q");
    connector.failWith(new IllegalStateException("upstream handshake refused"));
    long lastReceive = clock.millis() - 5_000L;

    ReconnectResponse response =
        coordinator.handleReconnect(request(lastReceive, List.of("700.HK", "AAPL.US"), "timeout"));

    assertFalse(response.success());
    assertEquals(ReconnectAction.RESUBSCRIBE, response.instructions().action());
    ClientSubscription subscription = clientRegistry.getClientSubscription("client-1").orElseThrow();
    assertEquals(Set.of("00700.HK"), subscription.symbols());
    assertEquals("Q", subscription.provider());
    assertEquals("ws-option-quote", subscription.capability());
    assertTrue(recoveryWorker.jobs().isEmpty());
  }

  @Test
  void shouldDropReconnectSubscriptionOfUnknownClientWhenUpstreamFails() {
    connector.failWith(new IllegalStateException("upstream handshake refused"));

    coordinator.handleReconnect(request(clock.millis() - 5_000L, List.of("700.HK"), "timeout"));

    assertTrue(clientRegistry.getClientSubscription("client-1").isEmpty());
  }

  @Test
  void shouldPrioritizeRecoveryAfterNetworkErrors() {
    long lastReceive = clock.millis() - 5_000L;

    coordinator.handleReconnect(
        request(lastReceive, List.of("700.HK"), StreamRecoveryCoordinator.REASON_NETWORK_ERROR));

    assertEquals(RecoveryPriority.HIGH, recoveryWorker.jobs().get(0).priority());
  }

  @Test
  void shouldFlagClientsOfProvidersWithoutLiveConnection() {
    clientRegistry.addClientSubscription("client-p", List.of("700.HK"), CAPABILITY, "P");
    clientRegistry.addClientSubscription("client-q", List.of("AAPL.US"), CAPABILITY, "Q");
    connectionManager.getOrCreateConnection("Q", CAPABILITY, List.of("AAPL.US"), "client-q");

    ReconnectionSweepResult result = coordinator.detectReconnection();

    assertEquals(2, result.providersChecked());
    assertEquals(List.of("P"), result.disconnectedProviders());
    assertEquals(1, result.clientsFlagged());
    assertEquals(List.of("client-p"), clientRegistry.reconnectFlags());
  }

  private static ReconnectRequest request(long lastReceive, List<String> symbols, String reason) {
    return new ReconnectRequest("client-1", lastReceive, symbols, CAPABILITY, null, reason);
  }
}
