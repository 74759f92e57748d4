package com.example.translator.ratelimit;

import com.example.translator.domain.entity.RateLimitDecision;
import java.time.Duration;

/**
 * Window-based request counter keyed by {@code routeName + clientIdentity}.
 */
public interface RateLimiter {

  RateLimitDecision check(String routeName, String clientIdentity, int limit, Duration window);
}
