package com.example.translator.web.rest.errors;

import com.example.translator.exception.AuthException;
import com.example.translator.security.filter.SessionAuthenticationFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Answers unauthenticated calls to protected endpoints with a 401 JSON error instead of the
 * default login challenge.
 * <p>
 * Triggered when the bearer token is missing, or when {@link SessionAuthenticationFilter}
 * could not resolve it.
 */
@Component
@RequiredArgsConstructor
public class DelegatedAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private final ObjectMapper objectMapper;

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
                       AuthenticationException authException) throws IOException {
    Object reason = request.getAttribute(SessionAuthenticationFilter.AUTH_ERROR_ATTRIBUTE);
    String message = reason instanceof String ? (String) reason : AuthException.INVALID_SESSION;
    ErrorBody.write(response, objectMapper, HttpStatus.UNAUTHORIZED, "unauthorized", message,
                    request.getRequestURI());
  }
}
