package com.example.translator.domain.entity;

/**
 * One translate request on behalf of an authenticated user.
 */
public record TranslationJob(
    String username,
    String encryptedCredential,
    String content,
    String targetLanguage,
    boolean force
) {
  @Override
  public String toString() {
    return "TranslationJob[username=" + username + ", targetLanguage=" + targetLanguage
        + ", contentLength=" + (content == null ? 0 : content.length()) + ", force=" + force + "]";
  }
}
