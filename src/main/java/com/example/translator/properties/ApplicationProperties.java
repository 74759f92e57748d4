package com.example.translator.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Centralized configuration properties for the Translation Gateway application.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @DefaultValue @Valid SecurityProperties security,
    @NotNull @DefaultValue @Valid AuthProperties auth,
    @NotNull @DefaultValue @Valid RateLimitProperties rateLimit,
    @NotNull @DefaultValue @Valid UpstreamProperties upstream,
    @NotNull @DefaultValue @Valid RelayProperties relay,
    @NotNull @DefaultValue @Valid NotificationProperties notification,
    @NotNull @DefaultValue @Valid OkHttpProperties http,
    @NotNull @DefaultValue @Valid RedisProperties redis
) {

  /**
   * Server-wide secret used to encrypt upstream credentials and sign stateless tokens.
   * Left empty, every encrypt/sign operation fails at request time.
   */
  public record SecurityProperties(
      @DefaultValue("") String serverSecret
  ) {
    public boolean hasServerSecret() {
      return serverSecret != null && !serverSecret.isBlank();
    }
  }

  /**
   * Fixed user roster and session issuance policy
   */
  public record AuthProperties(
      @NotNull Map<String, String> users,
      @DefaultValue("24h") @DurationUnit(ChronoUnit.SECONDS) Duration sessionTtl,
      @DefaultValue("2") @PositiveOrZero int maxActiveSessions,
      @DefaultValue("sk-") @NotBlank String credentialPrefix
  ) {}

  /**
   * Per-route request limits, keyed by route name
   */
  public record RateLimitProperties(
      @NotNull Map<String, @Valid RouteLimit> routes
  ) {
    public record RouteLimit(
        @NotBlank String path,
        @DefaultValue("30") @Positive int limit,
        @DefaultValue("1m") @DurationUnit(ChronoUnit.SECONDS) Duration window
    ) {}
  }

  /**
   * Streaming text-generation provider
   */
  public record UpstreamProperties(
      @DefaultValue("https://api.openai.com") @NotBlank String baseUrl,
      @DefaultValue("gpt-4o-mini") @NotBlank String model,
      @DefaultValue("0.3") @DecimalMin("0.0") @DecimalMax("2.0") double temperature,
      @DefaultValue("4000") @Positive int maxTokens,
      @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration connectTimeout,
      @DefaultValue("60s") @DurationUnit(ChronoUnit.SECONDS) Duration readTimeout
  ) {}

  /**
   * SSE relay tuning
   */
  public record RelayProperties(
      @DefaultValue("50ms") @DurationUnit(ChronoUnit.MILLIS) Duration demoPacing,
      @DefaultValue("5m") @DurationUnit(ChronoUnit.SECONDS) Duration emitterTimeout,
      @DefaultValue("16") @Positive int workerThreads,
      @DefaultValue("64") @PositiveOrZero int queueCapacity
  ) {}

  /**
   * Login notification e-mail. Mail transport itself is configured under spring.mail.*
   */
  public record NotificationProperties(
      @DefaultValue("false") boolean enabled,
      String to,
      @DefaultValue("no-reply@localhost") String from,
      @DefaultValue("server") String source
  ) {}

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @NotNull @DefaultValue @Valid ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost
    ) {}
  }

  /**
   * Redis configuration. When disabled, sessions become stateless signed tokens and
   * rate limiting falls back to per-process counters.
   */
  public record RedisProperties(
      @DefaultValue("false") boolean enabled,
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      @DefaultValue("") String password,
      @DefaultValue("false") boolean ssl,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @DefaultValue("translator") @NotBlank String keyPrefix,
      @NotNull @DefaultValue @Valid PoolProperties pool
  ) {
    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("2") @PositiveOrZero int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait
    ) {}
  }
}
