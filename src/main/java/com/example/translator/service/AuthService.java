package com.example.translator.service;

import static com.example.translator.util.RequestUtil.maskIpAddress;
import static com.example.translator.util.RequestUtil.maskToken;

import com.example.translator.domain.entity.AuthenticatedUser;
import com.example.translator.domain.entity.LoginEvent;
import com.example.translator.domain.entity.LoginResult;
import com.example.translator.domain.entity.SessionData;
import com.example.translator.exception.AuthException;
import com.example.translator.exception.ConfigurationException;
import com.example.translator.exception.RateLimitExceededException;
import com.example.translator.exception.ValidationException;
import com.example.translator.properties.ApplicationProperties;
import com.example.translator.session.SessionStore;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Login, logout and identity checks against the fixed user roster.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

  static final String MISSING_FIELDS = "Missing username, password, or upstream credential";
  private static final String BCRYPT_PREFIX = "$2";

  private final SessionStore sessionStore;
  private final CredentialVault credentialVault;
  private final PasswordEncoder passwordEncoder;
  private final LoginNotificationService notificationService;
  private final ApplicationProperties properties;
  private final Clock clock;

  /**
   * Verify a roster user and issue a session holding the encrypted upstream credential.
   *
   * @param clientIp  caller address, only used for the login notification
   * @param userAgent caller user agent, only used for the login notification
   * @param host      host the request was addressed to
   * @throws ValidationException        on missing fields or a malformed credential
   * @throws ConfigurationException     when no server secret is configured
   * @throws AuthException              on an unknown user or a wrong password (same message)
   * @throws RateLimitExceededException when the active-session cap is reached
   */
  public LoginResult login(String username, String password, String upstreamCredential,
                           String clientIp, String userAgent, String host) {
    if (isBlank(username) || isBlank(password) || isBlank(upstreamCredential)) {
      throw new ValidationException(MISSING_FIELDS);
    }
    if (!properties.security().hasServerSecret()) {
      throw new ConfigurationException("Server misconfigured: missing server secret");
    }
    String credential = upstreamCredential.trim();
    String prefix = properties.auth().credentialPrefix();
    if (!credential.startsWith(prefix)) {
      throw new ValidationException("Upstream credential must start with " + prefix);
    }

    String normalized = normalize(username);
    String configured = properties.auth().users().get(normalized);
    if (isBlank(configured) || !verifyPassword(password, configured)) {
      log.info("Login rejected for user {} from {}", normalized, maskIpAddress(clientIp));
      throw AuthException.invalidCredentials();
    }

    String encryptedCredential = credentialVault.encrypt(credential);

    int maxActive = properties.auth().maxActiveSessions();
    if (sessionStore.supportsActiveSessionCap()) {
      // count and create are separate round-trips; concurrent logins may overshoot by one
      long active = sessionStore.countActive();
      if (active >= maxActive) {
        log.warn("Login for user {} refused: {} of {} sessions active", normalized, active, maxActive);
        throw new RateLimitExceededException("Maximum " + maxActive + " active users already logged in");
      }
    }

    Duration ttl = properties.auth().sessionTtl();
    String token = sessionStore.create(normalized, encryptedCredential, ttl);
    log.info("User {} logged in, session {}", normalized, maskToken(token));

    boolean queued = notificationService.dispatch(
        new LoginEvent(normalized, clientIp, userAgent, host, clock.instant()));

    return new LoginResult(token, normalized, ttl.toSeconds(), queued);
  }

  /**
   * Revoke the session. Never fails from the caller's point of view.
   */
  public void logout(String token) {
    try {
      sessionStore.revoke(token);
      log.info("Session {} logged out", maskToken(token));
    } catch (Exception e) {
      log.warn("Failed to revoke session {}", maskToken(token), e);
    }
  }

  /**
   * @throws AuthException if the token is absent, malformed or resolves to nothing
   */
  public String identify(String token) {
    return authenticate(token)
        .map(AuthenticatedUser::username)
        .orElseThrow(AuthException::invalidSession);
  }

  /**
   * Resolve a bearer token to the user it was issued to.
   */
  public Optional<AuthenticatedUser> authenticate(String token) {
    if (isBlank(token)) {
      return Optional.empty();
    }
    Optional<SessionData> session = sessionStore.resolve(token);
    if (session.isEmpty() || session.get().isExpired(clock.instant())) {
      log.debug("Session {} did not resolve", maskToken(token));
      return Optional.empty();
    }
    SessionData data = session.get();
    return Optional.of(new AuthenticatedUser(data.username(), token, data.encryptedCredential()));
  }

  /**
   * A configured value starting with {@code $2} is a bcrypt hash. Anything else is compared as
   * plaintext, a degraded mode for local setups that {@code ConfigurationValidator} warns about.
   */
  private boolean verifyPassword(String password, String configured) {
    if (configured.startsWith(BCRYPT_PREFIX)) {
      try {
        return passwordEncoder.matches(password, configured);
      } catch (IllegalArgumentException e) {
        log.warn("Configured password hash is malformed");
        return false;
      }
    }
    return MessageDigest.isEqual(
        password.getBytes(StandardCharsets.UTF_8), configured.getBytes(StandardCharsets.UTF_8));
  }

  static String normalize(String username) {
    return username.trim().toLowerCase(Locale.ROOT);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
