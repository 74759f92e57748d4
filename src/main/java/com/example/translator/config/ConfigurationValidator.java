package com.example.translator.config;

import com.example.translator.properties.ApplicationProperties;
import com.example.translator.properties.ApplicationProperties.RateLimitProperties.RouteLimit;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/**
 * Configuration validator that enforces business rules beyond basic JSR-303 validation.
 * Structural problems fail startup; a missing server secret and plaintext passwords only warn,
 * so the service still starts and reports the problem per request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String BCRYPT_PREFIX = "$2";
  private static final String PATH_PREFIX_SLASH = "/";
  private static final String ERROR_INVALID_URI = "%s is invalid: %s";

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = new ArrayList<>();

    validateAuthConfig(errors);
    validateRateLimitConfig(errors);
    validateUpstreamConfig(errors);
    validateHttpConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }

    warnOnDegradedSecurity();
    log.info("Configuration validated successfully.");
  }

  private void validateAuthConfig(List<String> errors) {
    Map<String, String> users = properties.auth().users();
    if (users.isEmpty()) {
      errors.add("At least one user must be configured in 'app.auth.users'.");
    }
    users.forEach((username, password) -> {
      if (!username.equals(username.trim().toLowerCase(Locale.ROOT))) {
        errors.add("Username must be lower case without surrounding blanks: " + username);
      }
    });
    if (properties.auth().sessionTtl().compareTo(Duration.ofMinutes(1)) < 0) {
      errors.add("Session TTL must be at least 1 minute.");
    }
  }

  private void validateRateLimitConfig(List<String> errors) {
    for (Map.Entry<String, RouteLimit> route : properties.rateLimit().routes().entrySet()) {
      RouteLimit limit = route.getValue();
      if (!limit.path().startsWith(PATH_PREFIX_SLASH)) {
        errors.add("Rate-limit route '%s' path must start with '/': %s".formatted(route.getKey(), limit.path()));
      }
      if (limit.window().compareTo(Duration.ofSeconds(1)) < 0) {
        errors.add("Rate-limit route '%s' window must be at least 1 second.".formatted(route.getKey()));
      }
    }
  }

  private void validateUpstreamConfig(List<String> errors) {
    String baseUrl = properties.upstream().baseUrl();
    try {
      URI uri = new URI(baseUrl);
      if (uri.getScheme() == null || uri.getHost() == null) {
        errors.add(ERROR_INVALID_URI.formatted("Upstream base URL", baseUrl));
      }
    } catch (URISyntaxException e) {
      errors.add(ERROR_INVALID_URI.formatted("Upstream base URL", baseUrl));
    }
    if (baseUrl.endsWith(PATH_PREFIX_SLASH)) {
      errors.add("Upstream base URL must not end with '/': " + baseUrl);
    }
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.maxRequests() < client.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
  }

  private void warnOnDegradedSecurity() {
    if (!properties.security().hasServerSecret()) {
      log.warn("No server secret configured (app.security.server-secret). Every login will fail "
                   + "with a configuration error until one is set.");
    }
    properties.auth().users().forEach((username, password) -> {
      if (password == null || password.isBlank()) {
        log.warn("User '{}' has no password configured and cannot log in.", username);
      } else if (!password.startsWith(BCRYPT_PREFIX)) {
        log.warn("User '{}' has a plaintext password. Configure a bcrypt hash instead.", username);
      }
    });
  }
}
