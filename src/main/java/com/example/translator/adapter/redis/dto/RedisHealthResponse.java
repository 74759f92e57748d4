package com.example.translator.adapter.redis.dto;

/**
 * Redis Health Check Response
 */
public record RedisHealthResponse(
    boolean healthy,
    long responseTimeMs,
    String version,
    long activeSessions,
    String error
) {
  public static RedisHealthResponse healthy(long responseTimeMs, String version, long activeSessions) {
    return new RedisHealthResponse(true, responseTimeMs, version, activeSessions, null);
  }

  public static RedisHealthResponse unhealthy(String error) {
    return new RedisHealthResponse(false, 0, null, 0, error);
  }
}
