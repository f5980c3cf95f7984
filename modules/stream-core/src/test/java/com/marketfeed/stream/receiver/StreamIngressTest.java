package com.marketfeed.stream.receiver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketfeed.stream.batch.StreamBatchPipeline;
import com.marketfeed.stream.capability.CapabilityMapper;
import com.marketfeed.stream.config.StreamReceiverProperties;
import com.marketfeed.stream.connection.ConnectionHealth;
import com.marketfeed.stream.connection.StreamConnection;
import com.marketfeed.stream.connection.StreamConnectionManager;
import com.marketfeed.stream.observability.NoOpStreamTelemetry;
import com.marketfeed.stream.observability.StreamTelemetry;
import com.marketfeed.stream.pipeline.StreamDataPipeline;
import com.marketfeed.stream.testing.FakeStreamConnection;
import com.marketfeed.stream.testing.FakeStreamConnector;
import com.marketfeed.stream.testing.MapSymbolStandardizer;
import com.marketfeed.stream.testing.MutableClock;
import com.marketfeed.stream.testing.RecordingClientRegistry;
import com.marketfeed.stream.testing.RecordingQuoteCache;
import com.marketfeed.stream.testing.StubDataTransformer;
import com.marketfeed.stream.testing.StubRateLimitGateway;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StreamIngressTest {
  private final ObjectMapper objectMapper = new ObjectMapper();

  private MutableClock clock;
  private FakeStreamConnector connector;
  private StreamConnectionManager connectionManager;
  private StreamDataPipeline dataPipeline;
  private StreamBatchPipeline batchPipeline;
  private StreamIngress ingress;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-02-25T12:00:00Z");
    StreamTelemetry telemetry = new NoOpStreamTelemetry();
    StreamReceiverProperties properties = new StreamReceiverProperties();
    properties.getBatch().setIntervalMs(60_000L);
    properties.getBatch().getDynamic().setEnabled(false);
    connector = new FakeStreamConnector(clock);
    connectionManager =
        new StreamConnectionManager(
            connector, StubRateLimitGateway.allowAll(), properties, telemetry);
    dataPipeline =
        new StreamDataPipeline(
            StubDataTransformer.passThrough(),
            new MapSymbolStandardizer(Map.of()),
            new RecordingQuoteCache(),
            new RecordingClientRegistry(),
            new CapabilityMapper(),
            properties,
            telemetry);
    batchPipeline = new StreamBatchPipeline(dataPipeline, properties, telemetry);
    ingress = new StreamIngress(connectionManager, batchPipeline, clock);
  }

  @AfterEach
  void tearDown() {
    batchPipeline.close();
    dataPipeline.close();
    connectionManager.close();
  }

  @Test
  void shouldBindHandlersOncePerConnection() {
    StreamConnection first = ingress.open("P", "ws-stock-quote", List.of("AAPL.US"), "client-1");
    StreamConnection second = ingress.open("P", "ws-stock-quote", List.of("MSFT.US"), "client-2");

    assertSame(first, second);
    assertEquals(1, ((FakeStreamConnection) first).dataHandlerCount());
  }

  @Test
  void shouldQueueInboundPayloadsForBatching() throws Exception {
    FakeStreamConnection connection =
        (FakeStreamConnection) ingress.open("P", "ws-stock-quote", List.of("AAPL.US"), "client-1");

    connection.emit(objectMapper.readTree("{\"s\":\"AAPL.US\",\"p\":187.2}"), clock.instant());
    connection.emit(objectMapper.readTree("{\"s\":\"MSFT.US\",\"p\":402.1}"), clock.instant());

    assertEquals(2, batchPipeline.pendingUpdates());
  }

  @Test
  void shouldRecordConnectionErrorsAgainstHealth() {
    FakeStreamConnection connection =
        (FakeStreamConnection) ingress.open("P", "ws-stock-quote", List.of("AAPL.US"), "client-1");

    connection.fail(new IllegalStateException("frame decode failed"));

    ConnectionHealth health = connectionManager.health(connection.key()).orElseThrow();
    assertEquals(1, health.consecutiveErrors());
  }

  @Test
  void shouldIgnoreLateErrorsFromReplacedConnection() {
    FakeStreamConnection retired =
        (FakeStreamConnection) ingress.open("P", "ws-stock-quote", List.of("AAPL.US"), "client-1");
    retired.disconnect();
    StreamConnection replacement =
        ingress.open("P", "ws-stock-quote", List.of("AAPL.US"), "client-1");

    retired.fail(new IllegalStateException("socket reset"));

    assertNotSame(retired, replacement);
    ConnectionHealth health = connectionManager.health(replacement.key()).orElseThrow();
    assertEquals(0, health.errorCount());
    assertEquals(0, health.consecutiveErrors());
  }

  @Test
  void shouldExtractSymbolsFromCommonPayloadShapes() throws Exception {
    JsonNode nested =
        objectMapper.readTree(
            "{\"symbols\":[\"700.HK\"],\"quote\":{\"symbol\":\"9988.HK\"},"
                + "\"data\":[{\"symbol\":\"AAPL.US\"},{\"s\":\"MSFT.US\"}]}");
    JsonNode array = objectMapper.readTree("[{\"s\":\"TSLA.US\"},{\"price\":1}]");

    assertEquals(
        List.of("700.HK", "9988.HK", "AAPL.US", "MSFT.US"), PayloadSymbols.extract(nested));
    assertEquals(List.of("TSLA.US"), PayloadSymbols.extract(array));
  }
}
