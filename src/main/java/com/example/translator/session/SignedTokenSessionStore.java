package com.example.translator.session;

import com.example.translator.domain.entity.SessionData;
import com.example.translator.exception.ConfigurationException;
import com.example.translator.exception.CryptoException;
import com.example.translator.service.CredentialVault;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import java.util.function.Supplier;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;

/**
 * Stateless session store.
 * The token is {@code base64url(json{u, k, exp}) + "." + base64url(HMAC-SHA256(key, payload))}
 * and carries the whole session, so nothing is kept server side.
 * <p>
 * Limitations: a token cannot be revoked before it expires, and the number of live sessions is
 * unknown, so no session cap can be enforced.
 */
@Slf4j
public class SignedTokenSessionStore implements SessionStore {

  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder URL_DECODER = Base64.getUrlDecoder();

  private final Supplier<String> serverSecret;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public SignedTokenSessionStore(Supplier<String> serverSecret, ObjectMapper objectMapper, Clock clock) {
    this.serverSecret = serverSecret;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public String create(String username, String encryptedCredential, Duration ttl) {
    long exp = clock.instant().plus(ttl).getEpochSecond();
    try {
      byte[] json = objectMapper.writeValueAsBytes(new TokenPayload(username, encryptedCredential, exp));
      String payload = URL_ENCODER.encodeToString(json);
      return payload + "." + sign(payload);
    } catch (JsonProcessingException e) {
      throw new CryptoException("Failed to encode session token", e);
    }
  }

  @Override
  public Optional<SessionData> resolve(String token) {
    if (token == null) {
      return Optional.empty();
    }
    int dot = token.indexOf('.');
    if (dot <= 0 || dot == token.length() - 1 || token.indexOf('.', dot + 1) >= 0) {
      return Optional.empty();
    }
    String payload = token.substring(0, dot);
    String signature = token.substring(dot + 1);

    String expected;
    try {
      expected = sign(payload);
    } catch (ConfigurationException e) {
      log.error("Cannot verify session token: {}", e.getMessage());
      return Optional.empty();
    }
    if (!MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), signature.getBytes(StandardCharsets.UTF_8))) {
      return Optional.empty();
    }

    TokenPayload parsed;
    try {
      parsed = objectMapper.readValue(URL_DECODER.decode(payload), TokenPayload.class);
    } catch (Exception e) {
      log.debug("Rejected session token with unreadable payload");
      return Optional.empty();
    }
    if (parsed.username() == null || parsed.credential() == null) {
      return Optional.empty();
    }
    Instant expiresAt = Instant.ofEpochSecond(parsed.exp());
    if (!clock.instant().isBefore(expiresAt)) {
      return Optional.empty();
    }
    return Optional.of(new SessionData(parsed.username(), parsed.credential(), expiresAt));
  }

  /**
   * No-op: a stateless token stays valid until it expires.
   */
  @Override
  public void revoke(String token) {
    log.debug("Stateless session tokens cannot be revoked before expiry");
  }

  @Override
  public long countActive() {
    return 0;
  }

  @Override
  public boolean supportsActiveSessionCap() {
    return false;
  }

  private String sign(String payload) {
    byte[] key = CredentialVault.deriveKeyBytes(serverSecret.get());
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
      return URL_ENCODER.encodeToString(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException e) {
      throw new CryptoException("Failed to sign session token", e);
    }
  }

  record TokenPayload(
      @JsonProperty("u") String username,
      @JsonProperty("k") String credential,
      @JsonProperty("exp") long exp
  ) {}
}
