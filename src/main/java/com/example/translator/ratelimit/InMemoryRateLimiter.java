package com.example.translator.ratelimit;

import com.example.translator.domain.entity.RateLimitDecision;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-process fixed-window counter.
 * <p>
 * Counts are local to this JVM: several instances behind a load balancer each enforce the limit
 * separately, so the effective limit is multiplied by the instance count.
 */
@Slf4j
public class InMemoryRateLimiter implements RateLimiter {

  private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryRateLimiter(Clock clock) {
    this.clock = clock;
  }

  @Override
  public RateLimitDecision check(String routeName, String clientIdentity, int limit, Duration window) {
    Instant now = clock.instant();
    String key = routeName + ":" + clientIdentity;

    // compute() keeps read-check-write atomic per key
    Window current = windows.compute(key, (k, existing) -> {
      if (existing == null || !now.isBefore(existing.resetAt())) {
        return new Window(1, now.plus(window));
      }
      return new Window(existing.count() + 1, existing.resetAt());
    });

    boolean allowed = current.count() <= limit;
    long remaining = Math.max(0, limit - current.count());
    return new RateLimitDecision(allowed, remaining, current.resetAt());
  }

  /**
   * Drops windows that have already ended.
   */
  public int evictExpired() {
    Instant now = clock.instant();
    int before = windows.size();
    windows.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().resetAt()));
    int evicted = before - windows.size();
    if (evicted > 0) {
      log.debug("Evicted {} expired rate-limit windows", evicted);
    }
    return evicted;
  }

  int size() {
    return windows.size();
  }

  private record Window(long count, Instant resetAt) {}
}
