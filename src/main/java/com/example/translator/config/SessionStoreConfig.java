package com.example.translator.config;

import com.example.translator.properties.ApplicationProperties;
import com.example.translator.ratelimit.InMemoryRateLimiter;
import com.example.translator.ratelimit.RateLimiter;
import com.example.translator.ratelimit.RedisRateLimiter;
import com.example.translator.session.RedisSessionStore;
import com.example.translator.session.SessionStore;
import com.example.translator.session.SignedTokenSessionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the session store and rate-limiter backend once, at startup.
 * A configured Redis gives durable, revocable sessions with a capacity cap and a shared limiter;
 * otherwise sessions are signed stateless tokens and limits are counted per process.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class SessionStoreConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "app.redis", name = "enabled", havingValue = "true")
  static class Durable {

    @Bean
    public SessionStore sessionStore(StringRedisTemplate redisTemplate, ApplicationProperties properties) {
      log.info("Session store: durable (Redis), max active sessions {}", properties.auth().maxActiveSessions());
      return new RedisSessionStore(redisTemplate, properties.redis().keyPrefix());
    }

    @Bean
    public RateLimiter rateLimiter(StringRedisTemplate redisTemplate, ApplicationProperties properties,
                                   Clock clock) {
      return new RedisRateLimiter(redisTemplate, properties.redis().keyPrefix(), clock);
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "app.redis", name = "enabled", havingValue = "false", matchIfMissing = true)
  static class Stateless {

    @Bean
    public SessionStore sessionStore(ApplicationProperties properties, ObjectMapper objectMapper, Clock clock) {
      log.warn("Session store: stateless signed tokens. Logout cannot revoke tokens and the "
                   + "active-session cap is not enforced.");
      return new SignedTokenSessionStore(() -> properties.security().serverSecret(), objectMapper, clock);
    }

    @Bean
    public InMemoryRateLimiter rateLimiter(Clock clock) {
      log.warn("Rate limiter: in-memory. Limits are enforced per instance only.");
      return new InMemoryRateLimiter(clock);
    }
  }
}
