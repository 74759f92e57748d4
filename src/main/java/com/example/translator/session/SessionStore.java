package com.example.translator.session;

import com.example.translator.domain.entity.SessionData;
import java.time.Duration;
import java.util.Optional;

/**
 * Persistence of {@code token -> (username, encrypted credential)}.
 * One implementation is selected at startup depending on whether a shared store is configured.
 */
public interface SessionStore {

  /**
   * Creates a session and returns its bearer token.
   */
  String create(String username, String encryptedCredential, Duration ttl);

  /**
   * Resolves a token. Unknown, expired, malformed and forged tokens all resolve to empty.
   */
  Optional<SessionData> resolve(String token);

  /**
   * Best-effort revocation.
   */
  void revoke(String token);

  /**
   * Best-effort count of live sessions.
   */
  long countActive();

  /**
   * Whether {@link #countActive()} reflects reality closely enough to enforce a session cap.
   */
  boolean supportsActiveSessionCap();
}
