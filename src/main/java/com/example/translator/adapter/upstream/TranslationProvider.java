package com.example.translator.adapter.upstream;

/**
 * External streaming text-generation provider.
 */
public interface TranslationProvider {

  /**
   * Opens a streaming translation of {@code content} into {@code targetLanguage}.
   *
   * @param credential plaintext upstream credential, used for this call only
   * @throws com.example.translator.exception.UpstreamException if the call cannot be set up
   */
  FragmentStream openStream(String credential, String content, String targetLanguage);
}
