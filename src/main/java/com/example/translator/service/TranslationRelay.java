package com.example.translator.service;

import com.example.translator.adapter.upstream.FragmentStream;
import com.example.translator.adapter.upstream.TranslationProvider;
import com.example.translator.domain.entity.TranslationChunk;
import com.example.translator.domain.entity.TranslationJob;
import com.example.translator.exception.ConfigurationException;
import com.example.translator.exception.CryptoException;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Relays one translate request to its caller.
 * <p>
 * {@code START -> CACHE_HIT | NO_CREDENTIAL | UPSTREAM -> STREAMING -> DONE | FAILED}, with
 * {@code CANCELLED} reachable whenever the caller goes away. Exactly one terminal chunk is sent,
 * and the cache is written only on {@code DONE}.
 * <p>
 * {@link #run()} is driven by a single worker thread; {@link #cancel()} may come from any thread.
 */
@Slf4j
public class TranslationRelay {

  static final String FAILURE_MESSAGE = "Translation failed. Please try again.";

  private final TranslationJob job;
  private final ChunkSink sink;
  private final TranslationCache cache;
  private final CredentialVault credentialVault;
  private final TranslationProvider provider;
  private final DemoTranslationGenerator demoGenerator;
  private final Duration demoPacing;
  private final String credentialPrefix;

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final StringBuilder accumulator = new StringBuilder();
  private volatile RelayState state = RelayState.START;
  private volatile FragmentStream upstream;
  private boolean terminalSent;

  TranslationRelay(TranslationJob job, ChunkSink sink, TranslationCache cache,
                   CredentialVault credentialVault, TranslationProvider provider,
                   DemoTranslationGenerator demoGenerator, Duration demoPacing,
                   String credentialPrefix) {
    this.job = job;
    this.sink = sink;
    this.cache = cache;
    this.credentialVault = credentialVault;
    this.provider = provider;
    this.demoGenerator = demoGenerator;
    this.demoPacing = demoPacing;
    this.credentialPrefix = credentialPrefix;
  }

  public RelayState getState() {
    return state;
  }

  /**
   * Runs the relay to a terminal state and completes the sink.
   */
  public RelayState run() {
    try {
      if (!job.force()) {
        Optional<String> cached = cache.get(job.username(), job.content(), job.targetLanguage());
        if (cached.isPresent()) {
          relayCached(cached.get());
          return state;
        }
      }

      Optional<String> credential = usableCredential();
      if (credential.isEmpty()) {
        transition(RelayState.NO_CREDENTIAL);
        relayDemo();
      } else {
        transition(RelayState.UPSTREAM);
        relayUpstream(credential.get());
      }
    } catch (RuntimeException e) {
      log.error("Translation relay failed unexpectedly in state {}", state, e);
      if (!state.isTerminal()) {
        fail();
      }
    } finally {
      completeSink();
    }
    return state;
  }

  /**
   * Stops the relay: no further chunks are sent and an open upstream call is aborted.
   */
  public void cancel() {
    if (state.isTerminal()) {
      return;
    }
    if (cancelled.compareAndSet(false, true)) {
      FragmentStream stream = upstream;
      if (stream != null) {
        stream.close();
      }
      log.debug("Translation relay for user {} cancelled in state {}", job.username(), state);
    }
  }

  private void relayCached(String text) {
    transition(RelayState.CACHE_HIT);
    log.debug("Cache hit for user {}", job.username());
    if (!emit(TranslationChunk.complete(text))) {
      transition(RelayState.CANCELLED);
      return;
    }
    transition(RelayState.DONE);
  }

  private void relayDemo() {
    log.info("No usable upstream credential for user {}, streaming demo response", job.username());
    String text = demoGenerator.generate(job.content(), job.targetLanguage());
    transition(RelayState.STREAMING);

    for (String piece : demoGenerator.split(text)) {
      if (!emit(TranslationChunk.fragment(piece)) || !pause()) {
        transition(RelayState.CANCELLED);
        return;
      }
    }
    if (!emit(TranslationChunk.complete(""))) {
      transition(RelayState.CANCELLED);
      return;
    }
    transition(RelayState.DONE);
    cache.put(job.username(), job.content(), job.targetLanguage(), text);
  }

  private void relayUpstream(String credential) {
    FragmentStream stream;
    try {
      stream = provider.openStream(credential, job.content(), job.targetLanguage());
    } catch (RuntimeException e) {
      log.warn("Could not open upstream stream for user {}: {}", job.username(), e.getMessage());
      fail();
      return;
    }

    upstream = stream;
    if (cancelled.get()) {
      stream.close();
      transition(RelayState.CANCELLED);
      return;
    }
    transition(RelayState.STREAMING);

    try {
      if (!forwardFragments(stream)) {
        transition(RelayState.CANCELLED);
        return;
      }
    } catch (RuntimeException e) {
      if (cancelled.get()) {
        transition(RelayState.CANCELLED);
        return;
      }
      log.warn("Upstream stream failed for user {} after {} chars", job.username(),
               accumulator.length(), e);
      fail();
      return;
    } finally {
      stream.close();
    }

    if (cancelled.get() || !emit(TranslationChunk.complete(""))) {
      transition(RelayState.CANCELLED);
      return;
    }
    transition(RelayState.DONE);
    if (accumulator.length() > 0) {
      cache.put(job.username(), job.content(), job.targetLanguage(), accumulator.toString());
    }
  }

  /**
   * @return false if the caller went away before the provider finished
   */
  private boolean forwardFragments(FragmentStream stream) {
    Optional<String> fragment = stream.next();
    while (fragment.isPresent()) {
      accumulator.append(fragment.get());
      if (!emit(TranslationChunk.fragment(fragment.get()))) {
        return false;
      }
      fragment = stream.next();
    }
    return !cancelled.get();
  }

  private Optional<String> usableCredential() {
    String encrypted = job.encryptedCredential();
    if (encrypted == null || encrypted.isBlank()) {
      return Optional.empty();
    }
    try {
      String plaintext = credentialVault.decrypt(encrypted);
      return plaintext.startsWith(credentialPrefix) ? Optional.of(plaintext) : Optional.empty();
    } catch (CryptoException | ConfigurationException e) {
      log.warn("Session credential for user {} is unusable: {}", job.username(), e.getMessage());
      return Optional.empty();
    }
  }

  private void fail() {
    transition(RelayState.FAILED);
    emit(TranslationChunk.failure(FAILURE_MESSAGE));
  }

  private boolean pause() {
    if (demoPacing.isZero() || demoPacing.isNegative()) {
      return !cancelled.get();
    }
    try {
      Thread.sleep(demoPacing.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel();
    }
    return !cancelled.get();
  }

  /**
   * @return false if the chunk was not delivered because the caller is gone
   */
  private boolean emit(TranslationChunk chunk) {
    if (terminalSent) {
      throw new IllegalStateException("Chunk emitted after the terminal chunk");
    }
    if (cancelled.get()) {
      return false;
    }
    try {
      sink.send(chunk);
    } catch (IOException e) {
      log.debug("Client disconnected during translation relay: {}", e.getMessage());
      cancel();
      return false;
    }
    if (chunk.done()) {
      terminalSent = true;
    }
    return true;
  }

  private void transition(RelayState target) {
    if (!state.canTransitionTo(target)) {
      throw new IllegalStateException("Illegal relay transition " + state + " -> " + target);
    }
    log.trace("Relay {} -> {}", state, target);
    state = target;
  }

  private void completeSink() {
    try {
      sink.complete();
    } catch (RuntimeException e) {
      log.debug("Could not complete relay sink: {}", e.getMessage());
    }
  }
}
