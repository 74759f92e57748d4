package com.example.translator.domain.entity;

/**
 * Authenticated principal attached to the security context by the bearer-token filter.
 */
public record AuthenticatedUser(
    String username,
    String token,
    String encryptedCredential
) {
  @Override
  public String toString() {
    return "AuthenticatedUser[username=" + username + "]";
  }
}
