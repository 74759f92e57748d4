package com.example.translator.security.filter;

import static com.example.translator.util.RequestUtil.maskIpAddress;

import com.example.translator.domain.entity.RateLimitDecision;
import com.example.translator.properties.ApplicationProperties;
import com.example.translator.properties.ApplicationProperties.RateLimitProperties.RouteLimit;
import com.example.translator.ratelimit.RateLimiter;
import com.example.translator.util.RequestUtil;
import com.example.translator.web.rest.errors.ErrorBody;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Applies the configured per-route limits before any authentication happens.
 * Limiter failures let the request through.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 100)
@RequiredArgsConstructor
public class RateLimitFilter extends OncePerRequestFilter {

  public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
  public static final String RESET_HEADER = "X-RateLimit-Reset";
  static final String RATE_LIMIT_EXCEEDED = "Rate limit exceeded";

  private final RateLimiter rateLimiter;
  private final ApplicationProperties properties;
  private final ObjectMapper objectMapper;

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return findRoute(request).isEmpty();
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    Map.Entry<String, RouteLimit> route = findRoute(request).orElseThrow();
    String clientIp = null;

    RateLimitDecision decision;
    try {
      clientIp = RequestUtil.getClientIp(request);
      decision = rateLimiter.check(route.getKey(), clientIp, route.getValue().limit(), route.getValue().window());
    } catch (Exception e) {
      log.warn("Rate limiter unavailable for route {}, letting request through", route.getKey(), e);
      filterChain.doFilter(request, response);
      return;
    }

    response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
    response.setHeader(RESET_HEADER, String.valueOf(decision.resetAt().getEpochSecond()));

    if (!decision.allowed()) {
      log.info("Rate limit exceeded on route {} by {}", route.getKey(), maskIpAddress(clientIp));
      ErrorBody.write(response, objectMapper, HttpStatus.TOO_MANY_REQUESTS, "rate_limit_exceeded",
                      RATE_LIMIT_EXCEEDED, request.getRequestURI());
      return;
    }

    filterChain.doFilter(request, response);
  }

  private Optional<Map.Entry<String, RouteLimit>> findRoute(HttpServletRequest request) {
    String path = requestPath(request);
    return properties.rateLimit().routes().entrySet().stream()
        .filter(entry -> entry.getValue().path().equals(path))
        .findFirst();
  }

  private static String requestPath(HttpServletRequest request) {
    String uri = request.getRequestURI();
    String contextPath = request.getContextPath();
    if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
      return uri.substring(contextPath.length());
    }
    return uri;
  }
}
