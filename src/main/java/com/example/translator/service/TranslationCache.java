package com.example.translator.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

/**
 * Last complete translation per {@code (user, content fingerprint, target language)}.
 * Entries never expire; they are dropped only by {@link #clear()} or a restart.
 * The user is part of every key, so one user can never read another user's result.
 */
@Slf4j
@Component
public class TranslationCache {

  private final Cache<String, String> entries = Caffeine.newBuilder()
      .recordStats()
      .build();

  public Optional<String> get(String username, String content, String targetLanguage) {
    return Optional.ofNullable(entries.getIfPresent(key(username, content, targetLanguage)));
  }

  public void put(String username, String content, String targetLanguage, String text) {
    entries.put(key(username, content, targetLanguage), text);
  }

  public void clear() {
    long size = size();
    entries.invalidateAll();
    log.info("Translation cache cleared ({} entries)", size);
  }

  public long size() {
    return entries.estimatedSize();
  }

  static String key(String username, String content, String targetLanguage) {
    return username + ":" + fingerprint(content) + "_" + targetLanguage;
  }

  /**
   * Fixed-length content fingerprint. Collisions are tolerable; this is not a security boundary.
   */
  static String fingerprint(String content) {
    return DigestUtils.md5DigestAsHex(content.getBytes(StandardCharsets.UTF_8));
  }
}
