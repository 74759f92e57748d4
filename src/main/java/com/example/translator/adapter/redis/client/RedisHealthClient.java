package com.example.translator.adapter.redis.client;

import com.example.translator.adapter.redis.dto.RedisHealthResponse;
import com.example.translator.session.SessionStore;
import java.util.Properties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness check of the durable session store.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.redis", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
public class RedisHealthClient {

  private final StringRedisTemplate redisTemplate;
  private final SessionStore sessionStore;

  public RedisHealthResponse checkHealth() {
    long startTime = System.currentTimeMillis();

    try {
      String pingResponse = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());

      if (!"PONG".equals(pingResponse)) {
        return RedisHealthResponse.unhealthy("Invalid PING response: " + pingResponse);
      }

      Properties info = redisTemplate.execute((RedisCallback<Properties>) connection -> connection.serverCommands().info("server"));
      long responseTime = System.currentTimeMillis() - startTime;

      return RedisHealthResponse.healthy(
          responseTime,
          info == null ? "unknown" : info.getProperty("redis_version", "unknown"),
          sessionStore.countActive()
                                        );

    } catch (Exception e) {
      log.error("Redis health check failed", e);
      return RedisHealthResponse.unhealthy(e.getMessage());
    }
  }
}
