package com.example.translator.ratelimit;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps the in-memory limiter from growing without bound. Redis windows expire on their own.
 */
@Component
@RequiredArgsConstructor
public class RateLimitWindowEvictor {

  private final ObjectProvider<InMemoryRateLimiter> inMemoryRateLimiter;

  @Scheduled(fixedDelay = 60_000, initialDelay = 60_000)
  public void evictExpiredWindows() {
    inMemoryRateLimiter.ifAvailable(InMemoryRateLimiter::evictExpired);
  }
}
