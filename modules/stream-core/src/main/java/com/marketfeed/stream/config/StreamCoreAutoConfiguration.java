package com.marketfeed.stream.config;

import com.marketfeed.stream.batch.StreamBatchPipeline;
import com.marketfeed.stream.capability.CapabilityMapper;
import com.marketfeed.stream.connection.StreamConnectionManager;
import com.marketfeed.stream.market.MarketProviderResolver;
import com.marketfeed.stream.observability.MicrometerStreamTelemetry;
import com.marketfeed.stream.observability.NoOpStreamTelemetry;
import com.marketfeed.stream.observability.StreamTelemetry;
import com.marketfeed.stream.pipeline.StreamDataPipeline;
import com.marketfeed.stream.port.ClientRegistry;
import com.marketfeed.stream.port.DataTransformer;
import com.marketfeed.stream.port.QuoteCache;
import com.marketfeed.stream.port.RateLimitGateway;
import com.marketfeed.stream.port.RecoveryWorker;
import com.marketfeed.stream.port.StreamConnector;
import com.marketfeed.stream.port.SymbolStandardizer;
import com.marketfeed.stream.receiver.StreamIngress;
import com.marketfeed.stream.receiver.StreamReceiverService;
import com.marketfeed.stream.recovery.StreamRecoveryCoordinator;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the stream core once the host application provides the collaborator ports. Beans whose
 * ports are missing are skipped, together with everything built on top of them.
 */
@AutoConfiguration(
    afterName = {
      "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
    })
@EnableConfigurationProperties(StreamReceiverProperties.class)
public class StreamCoreAutoConfiguration {
  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(StreamTelemetry.class)
  public StreamTelemetry micrometerStreamTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerStreamTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(StreamTelemetry.class)
  public StreamTelemetry noOpStreamTelemetry() {
    return new NoOpStreamTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean
  public CapabilityMapper capabilityMapper() {
    return new CapabilityMapper();
  }

  @Bean
  @ConditionalOnMissingBean
  public MarketProviderResolver marketProviderResolver(StreamReceiverProperties properties) {
    return new MarketProviderResolver(properties.getProviders());
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean({StreamConnector.class, RateLimitGateway.class})
  public StreamConnectionManager streamConnectionManager(
      StreamConnector streamConnector,
      RateLimitGateway rateLimitGateway,
      StreamReceiverProperties properties,
      StreamTelemetry streamTelemetry) {
    return new StreamConnectionManager(
        streamConnector, rateLimitGateway, properties, streamTelemetry);
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean({
    DataTransformer.class,
    SymbolStandardizer.class,
    QuoteCache.class,
    ClientRegistry.class
  })
  public StreamDataPipeline streamDataPipeline(
      DataTransformer dataTransformer,
      SymbolStandardizer symbolStandardizer,
      QuoteCache quoteCache,
      ClientRegistry clientRegistry,
      CapabilityMapper capabilityMapper,
      StreamReceiverProperties properties,
      StreamTelemetry streamTelemetry) {
    return new StreamDataPipeline(
        dataTransformer,
        symbolStandardizer,
        quoteCache,
        clientRegistry,
        capabilityMapper,
        properties,
        streamTelemetry);
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(StreamDataPipeline.class)
  public StreamBatchPipeline streamBatchPipeline(
      StreamDataPipeline streamDataPipeline,
      StreamReceiverProperties properties,
      StreamTelemetry streamTelemetry) {
    return new StreamBatchPipeline(streamDataPipeline, properties, streamTelemetry);
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean({StreamConnectionManager.class, StreamBatchPipeline.class})
  public StreamIngress streamIngress(
      StreamConnectionManager streamConnectionManager, StreamBatchPipeline streamBatchPipeline) {
    return new StreamIngress(streamConnectionManager, streamBatchPipeline);
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean({StreamIngress.class, RecoveryWorker.class})
  public StreamRecoveryCoordinator streamRecoveryCoordinator(
      SymbolStandardizer symbolStandardizer,
      ClientRegistry clientRegistry,
      StreamConnectionManager streamConnectionManager,
      StreamIngress streamIngress,
      RecoveryWorker recoveryWorker,
      MarketProviderResolver marketProviderResolver,
      StreamReceiverProperties properties,
      StreamTelemetry streamTelemetry) {
    return new StreamRecoveryCoordinator(
        symbolStandardizer,
        clientRegistry,
        streamConnectionManager,
        streamIngress,
        recoveryWorker,
        marketProviderResolver,
        properties,
        streamTelemetry);
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(StreamRecoveryCoordinator.class)
  public StreamReceiverService streamReceiverService(
      StreamConnectionManager streamConnectionManager,
      StreamBatchPipeline streamBatchPipeline,
      StreamIngress streamIngress,
      StreamRecoveryCoordinator streamRecoveryCoordinator,
      SymbolStandardizer symbolStandardizer,
      ClientRegistry clientRegistry,
      MarketProviderResolver marketProviderResolver) {
    return new StreamReceiverService(
        streamConnectionManager,
        streamBatchPipeline,
        streamIngress,
        streamRecoveryCoordinator,
        symbolStandardizer,
        clientRegistry,
        marketProviderResolver);
  }
}
