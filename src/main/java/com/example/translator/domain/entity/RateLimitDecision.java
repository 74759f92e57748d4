package com.example.translator.domain.entity;

import java.time.Instant;

/**
 * Outcome of a single rate-limit check.
 */
public record RateLimitDecision(
    boolean allowed,
    long remaining,
    Instant resetAt
) {}
