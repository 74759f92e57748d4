package com.example.translator.ratelimit;

import com.example.translator.domain.entity.RateLimitDecision;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis-backed fixed-window counter, consistent across instances.
 * INCR and the first PEXPIRE run in one script so a window can never be left without a TTL.
 */
public class RedisRateLimiter implements RateLimiter {

  @SuppressWarnings("rawtypes")
  private static final RedisScript<List> WINDOW_SCRIPT = new DefaultRedisScript<>(
      "local count = redis.call('INCR', KEYS[1]) "
          + "if count == 1 then redis.call('PEXPIRE', KEYS[1], ARGV[1]) end "
          + "local ttl = redis.call('PTTL', KEYS[1]) "
          + "if ttl < 0 then redis.call('PEXPIRE', KEYS[1], ARGV[1]) ttl = tonumber(ARGV[1]) end "
          + "return {count, ttl}",
      List.class);

  private final StringRedisTemplate redisTemplate;
  private final String keyPrefix;
  private final Clock clock;

  public RedisRateLimiter(StringRedisTemplate redisTemplate, String keyPrefix, Clock clock) {
    this.redisTemplate = redisTemplate;
    this.clock = clock;
    this.keyPrefix = keyPrefix + ":ratelimit:";
  }

  @Override
  public RateLimitDecision check(String routeName, String clientIdentity, int limit, Duration window) {
    String key = keyPrefix + routeName + ":" + clientIdentity;

    @SuppressWarnings("unchecked")
    List<Object> result = redisTemplate.execute(WINDOW_SCRIPT, List.of(key), String.valueOf(window.toMillis()));
    if (result == null || result.size() < 2) {
      throw new IllegalStateException("Unexpected rate-limit script result: " + result);
    }

    long count = ((Number) result.get(0)).longValue();
    long ttlMillis = ((Number) result.get(1)).longValue();
    Instant resetAt = clock.instant().plusMillis(Math.max(0, ttlMillis));
    return new RateLimitDecision(count <= limit, Math.max(0, limit - count), resetAt);
  }
}
