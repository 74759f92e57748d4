package com.example.translator.web.rest.errors;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

/**
 * The JSON error shape shared by the controller advice and the servlet filters:
 * {@code {timestamp, status, error, message, path}}.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ErrorBody {

  public static Map<String, Object> of(HttpStatus status, String error, String message, String path) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now().toString());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    body.put("path", path);
    return body;
  }

  /**
   * Write the error directly to a response that has not been committed yet.
   */
  public static void write(HttpServletResponse response, ObjectMapper objectMapper, HttpStatus status,
                           String error, String message, String path) throws IOException {
    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    objectMapper.writeValue(response.getWriter(), of(status, error, message, path));
  }
}
