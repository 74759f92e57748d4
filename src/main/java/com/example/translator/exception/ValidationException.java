package com.example.translator.exception;

/**
 * Validation Exception
 */
public class ValidationException extends RuntimeException {
  public ValidationException(String message) {
    super(message);
  }
}
