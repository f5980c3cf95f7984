package com.marketfeed.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketfeed.gateway.cache.RedisQuoteCache;
import com.marketfeed.gateway.clients.InMemoryClientRegistry;
import com.marketfeed.gateway.clients.SseClientPushTransport;
import com.marketfeed.gateway.connector.WebSocketStreamConnector;
import com.marketfeed.gateway.ratelimit.RedisRateLimitGateway;
import com.marketfeed.gateway.recovery.RecoveryJobProcessor;
import com.marketfeed.gateway.recovery.RecoveryJobQueue;
import com.marketfeed.gateway.symbols.RuleBasedSymbolStandardizer;
import com.marketfeed.gateway.transform.FieldAliasDataTransformer;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Adapters that back the stream core ports in this application. */
@Configuration
@EnableConfigurationProperties(StreamGatewayProperties.class)
public class StreamGatewayConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock streamGatewayClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean(name = "upstreamHttpClient")
  public HttpClient upstreamHttpClient(StreamGatewayProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(properties.getUpstream().getConnectTimeout())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public RedisRateLimitGateway redisRateLimitGateway(
      StringRedisTemplate redisTemplate, StreamGatewayProperties properties, Clock clock) {
    return new RedisRateLimitGateway(
        redisTemplate, properties.getRedis().getRateLimitKeyPrefix(), clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public RedisQuoteCache redisQuoteCache(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      StreamGatewayProperties properties) {
    StreamGatewayProperties.Redis redis = properties.getRedis();
    return new RedisQuoteCache(
        redisTemplate,
        objectMapper,
        redis.getCacheKeyPrefix(),
        redis.getDefaultTtl(),
        redis.getModeTtl());
  }

  @Bean
  @ConditionalOnMissingBean
  public RuleBasedSymbolStandardizer ruleBasedSymbolStandardizer(
      StreamGatewayProperties properties) {
    StreamGatewayProperties.Symbols symbols = properties.getSymbols();
    return new RuleBasedSymbolStandardizer(
        symbols.getOverrides(),
        symbols.getHongKongCodeWidth(),
        symbols.isStripHongKongLeadingZeros());
  }

  @Bean
  @ConditionalOnMissingBean
  public FieldAliasDataTransformer fieldAliasDataTransformer(
      ObjectMapper objectMapper, StreamGatewayProperties properties) {
    return new FieldAliasDataTransformer(
        objectMapper, properties.getTransform().getFieldAliases());
  }

  @Bean
  @ConditionalOnMissingBean
  public SseClientPushTransport sseClientPushTransport(StreamGatewayProperties properties) {
    return new SseClientPushTransport(properties.getPush().getEmitterTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public InMemoryClientRegistry inMemoryClientRegistry(
      SseClientPushTransport sseClientPushTransport, ObjectMapper objectMapper, Clock clock) {
    return new InMemoryClientRegistry(sseClientPushTransport, objectMapper, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public RecoveryJobQueue recoveryJobQueue(StreamGatewayProperties properties, Clock clock) {
    return new RecoveryJobQueue(properties.getRecoveryQueue().getCapacity(), clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public RecoveryJobProcessor recoveryJobProcessor(
      RecoveryJobQueue recoveryJobQueue,
      RedisQuoteCache redisQuoteCache,
      SseClientPushTransport sseClientPushTransport,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      StreamGatewayProperties properties) {
    return new RecoveryJobProcessor(
        recoveryJobQueue,
        redisQuoteCache,
        sseClientPushTransport,
        objectMapper,
        meterRegistry,
        properties.getRecoveryQueue().getDrainBatchSize());
  }

  @Bean
  @ConditionalOnMissingBean
  public WebSocketStreamConnector webSocketStreamConnector(
      HttpClient upstreamHttpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      RuleBasedSymbolStandardizer ruleBasedSymbolStandardizer,
      StreamGatewayProperties properties,
      Clock clock) {
    return new WebSocketStreamConnector(
        upstreamHttpClient,
        objectMapper,
        meterRegistry,
        ruleBasedSymbolStandardizer,
        properties.getUpstream(),
        clock);
  }
}
