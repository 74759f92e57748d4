package com.example.translator.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.translator.domain.entity.RateLimitDecision;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class InMemoryRateLimiterTest {

  private static final Duration WINDOW = Duration.ofMinutes(1);

  private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
  private final InMemoryRateLimiter limiter = new InMemoryRateLimiter(clock);

  @Test
  void allowsUpToLimitThenDenies() {
    for (int i = 1; i <= 3; i++) {
      RateLimitDecision decision = limiter.check("translate", "10.0.0.1", 3, WINDOW);
      assertThat(decision.allowed()).isTrue();
      assertThat(decision.remaining()).isEqualTo(3 - i);
    }

    RateLimitDecision denied = limiter.check("translate", "10.0.0.1", 3, WINDOW);

    assertThat(denied.allowed()).isFalse();
    assertThat(denied.remaining()).isZero();
    assertThat(denied.resetAt()).isEqualTo(clock.instant().plus(WINDOW));
  }

  @Test
  void newWindowResetsCounter() {
    for (int i = 0; i < 4; i++) {
      limiter.check("translate", "10.0.0.1", 3, WINDOW);
    }

    clock.advance(WINDOW);
    RateLimitDecision decision = limiter.check("translate", "10.0.0.1", 3, WINDOW);

    assertThat(decision.allowed()).isTrue();
    assertThat(decision.remaining()).isEqualTo(2);
    assertThat(decision.resetAt()).isEqualTo(clock.instant().plus(WINDOW));
  }

  @Test
  void clientsAndRoutesAreCountedSeparately() {
    limiter.check("translate", "10.0.0.1", 1, WINDOW);

    assertThat(limiter.check("translate", "10.0.0.1", 1, WINDOW).allowed()).isFalse();
    assertThat(limiter.check("translate", "10.0.0.2", 1, WINDOW).allowed()).isTrue();
    assertThat(limiter.check("auth-login", "10.0.0.1", 1, WINDOW).allowed()).isTrue();
  }

  @Test
  void concurrentChecksNeverAllowMoreThanLimit() throws Exception {
    int limit = 50;
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Callable<Boolean>> calls = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        calls.add(() -> limiter.check("translate", "10.0.0.1", limit, WINDOW).allowed());
      }
      long allowed = 0;
      for (Future<Boolean> result : pool.invokeAll(calls)) {
        if (result.get()) {
          allowed++;
        }
      }
      assertThat(allowed).isEqualTo(limit);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void evictExpiredDropsOnlyEndedWindows() {
    limiter.check("translate", "old", 5, Duration.ofSeconds(10));
    limiter.check("translate", "fresh", 5, Duration.ofMinutes(10));

    clock.advance(Duration.ofSeconds(30));

    assertThat(limiter.evictExpired()).isEqualTo(1);
    assertThat(limiter.size()).isEqualTo(1);
  }

  static final class MutableClock extends Clock {

    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
