package com.example.translator.service;

import com.example.translator.adapter.upstream.TranslationProvider;
import com.example.translator.domain.entity.TranslationJob;
import com.example.translator.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Creates one {@link TranslationRelay} per translate request.
 */
@Service
@RequiredArgsConstructor
public class TranslationStreamService {

  private final TranslationCache translationCache;
  private final CredentialVault credentialVault;
  private final TranslationProvider translationProvider;
  private final DemoTranslationGenerator demoGenerator;
  private final ApplicationProperties properties;

  public TranslationRelay newRelay(TranslationJob job, ChunkSink sink) {
    return new TranslationRelay(job, sink, translationCache, credentialVault, translationProvider,
                                demoGenerator, properties.relay().demoPacing(),
                                properties.auth().credentialPrefix());
  }

  public long cacheSize() {
    return translationCache.size();
  }

  public void clearCache() {
    translationCache.clear();
  }
}
