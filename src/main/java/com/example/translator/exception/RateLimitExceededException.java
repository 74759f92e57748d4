package com.example.translator.exception;

import java.time.Instant;
import lombok.Getter;

/**
 * Request quota or session capacity exhausted.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

  private final long remaining;
  private final Instant resetAt;

  public RateLimitExceededException(String message, long remaining, Instant resetAt) {
    super(message);
    this.remaining = remaining;
    this.resetAt = resetAt;
  }

  public RateLimitExceededException(String message) {
    this(message, 0, null);
  }
}
