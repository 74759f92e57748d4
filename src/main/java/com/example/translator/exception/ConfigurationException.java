package com.example.translator.exception;

/**
 * Raised when a required server-side setting (such as the server secret) is missing.
 */
public class ConfigurationException extends RuntimeException {
  public ConfigurationException(String message) {
    super(message);
  }
}
