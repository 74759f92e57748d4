package com.example.translator.session;

import static com.example.translator.util.RequestUtil.maskToken;

import com.example.translator.domain.entity.SessionData;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.lang.NonNull;

/**
 * Durable session store.
 * Each session is a Redis hash written with a TTL; a set of live tokens answers
 * {@link #countActive()} and is pruned lazily of tokens whose hash has already expired.
 * <p>
 * The capacity check done by callers before {@link #create} is not atomic with it, so concurrent
 * logins can briefly exceed the configured cap by one.
 */
@Slf4j
public class RedisSessionStore implements SessionStore {

  public static final String FIELD_USERNAME = "username";
  public static final String FIELD_CREDENTIAL = "credential";
  public static final String FIELD_CREATED_AT = "createdAt";
  private static final int SESSION_ID_ENTROPY_BYTES = 32;
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final StringRedisTemplate redisTemplate;
  private final String sessionKeyPrefix;
  private final String registryKey;

  public RedisSessionStore(StringRedisTemplate redisTemplate, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.sessionKeyPrefix = keyPrefix + ":session:";
    this.registryKey = keyPrefix + ":sessions";
  }

  @Override
  public String create(String username, String encryptedCredential, Duration ttl) {
    String token = generateSecureToken();
    String sessionKey = sessionKeyPrefix + token;
    Map<String, String> sessionData = Map.of(
        FIELD_USERNAME, username,
        FIELD_CREDENTIAL, encryptedCredential,
        FIELD_CREATED_AT, String.valueOf(System.currentTimeMillis()));

    redisTemplate.executePipelined(new SessionCallback<Object>() {
      @Override
      public Object execute(@NonNull RedisOperations operations) {
        @SuppressWarnings("unchecked")
        RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
        redisOps.opsForHash().putAll(sessionKey, sessionData);
        redisOps.expire(sessionKey, ttl.toSeconds(), TimeUnit.SECONDS);
        redisOps.opsForSet().add(registryKey, token);
        return null;
      }
    });
    log.debug("Created durable session {}", maskToken(token));
    return token;
  }

  @Override
  public Optional<SessionData> resolve(String token) {
    if (!isValidToken(token)) {
      return Optional.empty();
    }
    String sessionKey = sessionKeyPrefix + token;

    List<Object> results = redisTemplate.executePipelined(new SessionCallback<Object>() {
      @Override
      public Object execute(@NonNull RedisOperations operations) {
        @SuppressWarnings("unchecked")
        RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
        redisOps.opsForHash().entries(sessionKey);
        redisOps.getExpire(sessionKey, TimeUnit.SECONDS);
        return null;
      }
    });

    @SuppressWarnings("unchecked")
    Map<String, String> sessionData = (Map<String, String>) results.get(0);
    Long ttlSeconds = (Long) results.get(1);

    if (sessionData == null || sessionData.isEmpty() || ttlSeconds == null || ttlSeconds <= 0) {
      return Optional.empty();
    }
    String username = sessionData.get(FIELD_USERNAME);
    String credential = sessionData.get(FIELD_CREDENTIAL);
    if (username == null || credential == null) {
      log.warn("Durable session {} is missing fields", maskToken(token));
      return Optional.empty();
    }
    return Optional.of(new SessionData(username, credential, Instant.now().plusSeconds(ttlSeconds)));
  }

  @Override
  public void revoke(String token) {
    if (!isValidToken(token)) {
      return;
    }
    try {
      redisTemplate.opsForSet().remove(registryKey, token);
    } catch (Exception e) {
      log.error("Could not clean up session registry for session: {}.", maskToken(token), e);
    } finally {
      redisTemplate.delete(sessionKeyPrefix + token);
    }
  }

  @Override
  public long countActive() {
    Set<String> tokens = redisTemplate.opsForSet().members(registryKey);
    if (tokens == null || tokens.isEmpty()) {
      return 0;
    }
    // Small roster: a linear prune is cheap
    for (String token : tokens) {
      if (!Boolean.TRUE.equals(redisTemplate.hasKey(sessionKeyPrefix + token))) {
        redisTemplate.opsForSet().remove(registryKey, token);
      }
    }
    Long size = redisTemplate.opsForSet().size(registryKey);
    return size == null ? 0 : size;
  }

  @Override
  public boolean supportsActiveSessionCap() {
    return true;
  }

  private String generateSecureToken() {
    byte[] randomBytes = new byte[SESSION_ID_ENTROPY_BYTES];
    SECURE_RANDOM.nextBytes(randomBytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
  }

  private boolean isValidToken(String token) {
    return token != null && token.length() == 43 && token.indexOf('.') < 0;
  }
}
