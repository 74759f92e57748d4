package com.example.translator.exception;

/**
 * Authentication failure. The message is deliberately uniform so callers cannot tell an unknown
 * user from a wrong password, or a forged token from an expired one.
 */
public class AuthException extends RuntimeException {

  public static final String INVALID_CREDENTIALS = "Invalid credentials";
  public static final String INVALID_SESSION = "Invalid or expired session";

  public AuthException(String message) {
    super(message);
  }

  public AuthException(String message, Throwable cause) {
    super(message, cause);
  }

  public static AuthException invalidCredentials() {
    return new AuthException(INVALID_CREDENTIALS);
  }

  public static AuthException invalidSession() {
    return new AuthException(INVALID_SESSION);
  }
}
