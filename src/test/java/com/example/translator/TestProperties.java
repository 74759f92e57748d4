package com.example.translator;

import com.example.translator.properties.ApplicationProperties;
import com.example.translator.properties.ApplicationProperties.RateLimitProperties.RouteLimit;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds {@link ApplicationProperties} for unit tests without a Spring context.
 */
public final class TestProperties {

  public static final String SECRET = "test-server-secret";

  private String serverSecret = SECRET;
  private Map<String, String> users = new LinkedHashMap<>(Map.of("mara", "mara-password", "baru", "baru-password"));
  private int maxActiveSessions = 2;
  private Duration sessionTtl = Duration.ofHours(24);
  private String upstreamBaseUrl = "https://api.openai.com";
  private Duration demoPacing = Duration.ZERO;
  private boolean notificationEnabled;
  private String notificationTo;
  private Map<String, RouteLimit> routes = new LinkedHashMap<>(Map.of(
      "auth-login", new RouteLimit("/auth/login", 10, Duration.ofMinutes(10)),
      "translate", new RouteLimit("/translate-stream", 30, Duration.ofMinutes(1))));

  public static TestProperties builder() {
    return new TestProperties();
  }

  public static ApplicationProperties defaults() {
    return builder().build();
  }

  public TestProperties serverSecret(String serverSecret) {
    this.serverSecret = serverSecret;
    return this;
  }

  public TestProperties users(Map<String, String> users) {
    this.users = users;
    return this;
  }

  public TestProperties maxActiveSessions(int maxActiveSessions) {
    this.maxActiveSessions = maxActiveSessions;
    return this;
  }

  public TestProperties sessionTtl(Duration sessionTtl) {
    this.sessionTtl = sessionTtl;
    return this;
  }

  public TestProperties upstreamBaseUrl(String upstreamBaseUrl) {
    this.upstreamBaseUrl = upstreamBaseUrl;
    return this;
  }

  public TestProperties demoPacing(Duration demoPacing) {
    this.demoPacing = demoPacing;
    return this;
  }

  public TestProperties notification(boolean enabled, String to) {
    this.notificationEnabled = enabled;
    this.notificationTo = to;
    return this;
  }

  public TestProperties routes(Map<String, RouteLimit> routes) {
    this.routes = routes;
    return this;
  }

  public ApplicationProperties build() {
    return new ApplicationProperties(
        new ApplicationProperties.SecurityProperties(serverSecret),
        new ApplicationProperties.AuthProperties(users, sessionTtl, maxActiveSessions, "sk-"),
        new ApplicationProperties.RateLimitProperties(routes),
        new ApplicationProperties.UpstreamProperties(upstreamBaseUrl, "gpt-4o-mini", 0.3, 4000,
                                                     Duration.ofSeconds(5), Duration.ofSeconds(10)),
        new ApplicationProperties.RelayProperties(demoPacing, Duration.ofMinutes(5), 4, 16),
        new ApplicationProperties.NotificationProperties(notificationEnabled, notificationTo,
                                                         "no-reply@localhost", "test"),
        new ApplicationProperties.OkHttpProperties(
            new ApplicationProperties.OkHttpProperties.ClientProperties(5, 1, 10, 5)),
        new ApplicationProperties.RedisProperties(false, "localhost", 6379, "", false,
                                                  Duration.ofSeconds(2), "translator",
                                                  new ApplicationProperties.RedisProperties.PoolProperties(
                                                      4, 2, 0, Duration.ofSeconds(1))));
  }
}
