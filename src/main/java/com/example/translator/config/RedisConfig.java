package com.example.translator.config;

import com.example.translator.properties.ApplicationProperties;
import com.example.translator.properties.ApplicationProperties.RedisProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis wiring for the durable session store and the shared rate limiter.
 * Only active with {@code app.redis.enabled=true}; otherwise the application runs on signed
 * tokens and in-process rate limiting. Actuator picks up the connection factory for its own
 * Redis health contributor.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "app.redis", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
public class RedisConfig {

  private static final Duration EVICTION_INTERVAL = Duration.ofSeconds(30);

  private final ApplicationProperties properties;

  @Bean(destroyMethod = "shutdown")
  public ClientResources lettuceClientResources() {
    int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
    return DefaultClientResources.builder()
        .ioThreadPoolSize(threads)
        .computationThreadPoolSize(threads)
        .build();
  }

  @Bean
  public RedisConnectionFactory redisConnectionFactory(ClientResources lettuceClientResources) {
    RedisProperties redis = properties.redis();

    RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(redis.host(), redis.port());
    if (redis.password() != null && !redis.password().isEmpty()) {
      server.setPassword(redis.password());
    }

    LettucePoolingClientConfiguration.LettucePoolingClientConfigurationBuilder client =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(connectionPool(redis.pool()))
            .clientResources(lettuceClientResources)
            .commandTimeout(redis.timeout())
            .clientOptions(clientOptions(redis.timeout()));
    if (redis.ssl()) {
      client.useSsl();
    }

    log.info("Sessions and rate-limit windows stored in Redis at {}:{} (ssl={})",
             redis.host(), redis.port(), redis.ssl());
    LettuceConnectionFactory factory = new LettuceConnectionFactory(server, client.build());
    factory.setShareNativeConnection(true);
    return factory;
  }

  @Bean
  public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory redisConnectionFactory) {
    return new StringRedisTemplate(redisConnectionFactory);
  }

  private static GenericObjectPoolConfig<StatefulConnection<?, ?>> connectionPool(
      RedisProperties.PoolProperties pool) {
    GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(pool.maxActive());
    config.setMaxIdle(pool.maxIdle());
    config.setMinIdle(pool.minIdle());
    config.setMaxWait(pool.maxWait());
    config.setTestWhileIdle(true);
    config.setTimeBetweenEvictionRuns(EVICTION_INTERVAL);
    return config;
  }

  /**
   * Commands fail fast while disconnected instead of queueing behind a dead link.
   */
  private static ClientOptions clientOptions(Duration timeout) {
    return ClientOptions.builder()
        .socketOptions(SocketOptions.builder()
                           .connectTimeout(timeout)
                           .keepAlive(true)
                           .build())
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .timeoutOptions(TimeoutOptions.enabled(timeout))
        .build();
  }
}
