package com.example.translator.exception;

/**
 * Malformed or tampered encrypted/signed payload
 */
public class CryptoException extends RuntimeException {
  public CryptoException(String message) {
    super(message);
  }

  public CryptoException(String message, Throwable cause) {
    super(message, cause);
  }
}
