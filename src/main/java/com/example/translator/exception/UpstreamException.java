package com.example.translator.exception;

/**
 * The streaming provider failed before or during a relay.
 */
public class UpstreamException extends RuntimeException {
  public UpstreamException(String message) {
    super(message);
  }

  public UpstreamException(String message, Throwable cause) {
    super(message, cause);
  }
}
