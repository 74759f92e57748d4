package com.example.translator.domain.entity;

/**
 * Session issued by a successful login.
 *
 * @param expiresIn session lifetime in seconds
 */
public record LoginResult(
    String token,
    String username,
    long expiresIn,
    boolean notificationQueued
) {
  @Override
  public String toString() {
    return "LoginResult[username=" + username + ", expiresIn=" + expiresIn + "]";
  }
}
