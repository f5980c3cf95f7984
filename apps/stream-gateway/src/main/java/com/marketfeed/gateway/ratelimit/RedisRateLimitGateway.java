package com.marketfeed.gateway.ratelimit;

import com.marketfeed.stream.port.RateLimitDecision;
import com.marketfeed.stream.port.RateLimitGateway;
import com.marketfeed.stream.port.RateLimitRule;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Fixed-window counter in Redis. Each window gets its own key {@code prefix:key:windowIndex} that
 * expires with the window.
 */
public class RedisRateLimitGateway implements RateLimitGateway {
  private final StringRedisTemplate redisTemplate;
  private final String keyPrefix;
  private final Clock clock;

  public RedisRateLimitGateway(StringRedisTemplate redisTemplate, String keyPrefix, Clock clock) {
    this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate must not be null");
    this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public RateLimitDecision checkRateLimit(String key, RateLimitRule rule) {
    long windowMs = Math.max(1L, rule.window().toMillis());
    long now = clock.millis();
    long windowIndex = now / windowMs;
    String redisKey = keyPrefix + ":" + key + ":" + windowIndex;

    Long count = redisTemplate.opsForValue().increment(redisKey);
    if (count != null && count == 1L) {
      redisTemplate.expire(redisKey, Duration.ofMillis(windowMs));
    }
    long current = count != null ? count : 0L;
    if (current <= rule.maxRequests()) {
      return RateLimitDecision.allow(rule.maxRequests(), current);
    }
    long windowEnd = (windowIndex + 1) * windowMs;
    long retryAfterSeconds = Math.max(1L, (windowEnd - now + 999L) / 1000L);
    return new RateLimitDecision(false, rule.maxRequests(), current, retryAfterSeconds);
  }
}
