package com.example.translator;

import com.example.translator.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Translation Gateway Application
 *
 * Gates a paid streaming translation provider behind a fixed user roster with:
 * - Encrypted per-session upstream credentials
 * - Redis-backed or self-signed stateless sessions
 * - Per-route request rate limiting
 * - Per-user result cache in front of the SSE relay
 */
@SpringBootApplication(exclude = {
    RedisAutoConfiguration.class,
    RedisRepositoriesAutoConfiguration.class
})
@EnableConfigurationProperties(ApplicationProperties.class)
@EnableScheduling
public class TranslationGatewayApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(TranslationGatewayApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
