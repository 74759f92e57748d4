package com.example.translator.util;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpHeaders;

/**
 * Request helpers shared by filters and controllers
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class RequestUtil {

  private static final String BEARER_PREFIX = "bearer ";
  private static final String X_FORWARDED_FOR = "X-Forwarded-For";
  private static final String UNKNOWN = "unknown";

  /**
   * Extract the bearer token from the Authorization header
   *
   * @param request HTTP request
   * @return Optional containing the token if the header is a well-formed bearer header
   */
  public static Optional<String> getBearerToken(HttpServletRequest request) {
    if (request == null) {
      return Optional.empty();
    }
    String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header == null || header.length() <= BEARER_PREFIX.length()
        || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return Optional.empty();
    }
    String token = header.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }

  /**
   * Client identity for rate limiting: first X-Forwarded-For hop, else the peer address
   */
  public static String getClientIp(HttpServletRequest request) {
    String xForwardedFor = request.getHeader(X_FORWARDED_FOR);
    if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
      // "," alone splits into an empty array
      String[] hops = xForwardedFor.split(",");
      if (hops.length > 0 && !hops[0].isBlank()) {
        return hops[0].trim();
      }
    }
    String remote = request.getRemoteAddr();
    return remote == null ? UNKNOWN : remote;
  }

  public static String maskToken(String token) {
    if (token == null || token.length() < 8) return "INVALID";
    return token.substring(0, 8) + "...";
  }

  public static String maskIpAddress(String ip) {
    if (ip == null || !ip.contains(".")) {
      return "***";
    }
    String[] parts = ip.split("\\.");
    if (parts.length == 4) {
      return parts[0] + "." + parts[1] + ".***." + parts[3];
    }
    return "***";
  }
}
