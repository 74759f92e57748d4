package com.example.translator.domain.entity;

import java.time.Instant;

/**
 * Represents the data associated with a user's session, as resolved from a session store.
 */
public record SessionData(
    /**
     * Normalized username from the fixed roster.
     */
    String username,

    /**
     * The user's upstream credential, encrypted before being stored.
     * Never holds the plaintext value.
     */
    String encryptedCredential,

    /**
     * The instant at which the session stops resolving.
     */
    Instant expiresAt
) {
  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  @Override
  public String toString() {
    return "SessionData[username=" + username + ", expiresAt=" + expiresAt + "]";
  }
}
