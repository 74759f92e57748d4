package com.example.translator.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.translator.TestProperties;
import com.example.translator.adapter.upstream.FragmentStream;
import com.example.translator.adapter.upstream.TranslationProvider;
import com.example.translator.domain.entity.TranslationChunk;
import com.example.translator.domain.entity.TranslationJob;
import com.example.translator.exception.UpstreamException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TranslationRelayTest {

  private static final String CREDENTIAL = "sk-test-credential";

  private final CredentialVault vault = new CredentialVault(TestProperties.defaults());
  private final DemoTranslationGenerator demoGenerator = new DemoTranslationGenerator();
  private TranslationCache cache;
  private ScriptedProvider provider;
  private String encryptedCredential;

  @BeforeEach
  void setUp() {
    cache = new TranslationCache();
    provider = new ScriptedProvider();
    encryptedCredential = vault.encrypt(CREDENTIAL);
  }

  @Test
  void forwardsFragmentsInOrderThenCachesResult() {
    provider.fragments("Hal", "lo ", "Welt");
    RecordingSink sink = new RecordingSink();

    RelayState state = relay(job("mara", "Hello world", false), sink).run();

    assertThat(state).isEqualTo(RelayState.DONE);
    assertThat(sink.chunks).containsExactly(
        TranslationChunk.fragment("Hal"),
        TranslationChunk.fragment("lo "),
        TranslationChunk.fragment("Welt"),
        TranslationChunk.complete(""));
    assertThat(sink.completions).isEqualTo(1);
    assertThat(provider.lastCredential).isEqualTo(CREDENTIAL);
    assertThat(provider.stream.closed).isTrue();
    assertThat(cache.get("mara", "Hello world", "german")).contains("Hallo Welt");
  }

  @Test
  void repeatedRequestIsServedFromCacheAsOneTerminalChunk() {
    provider.fragments("hal", "lo");
    relay(job("mara", "hello", false), new RecordingSink()).run();
    RecordingSink second = new RecordingSink();

    RelayState state = relay(job("mara", "hello", false), second).run();

    assertThat(state).isEqualTo(RelayState.DONE);
    assertThat(second.chunks).containsExactly(TranslationChunk.complete("hallo"));
    assertThat(provider.calls).isEqualTo(1);
  }

  @Test
  void cachedResultIsNeverServedToAnotherUser() {
    provider.fragments("hallo");
    relay(job("mara", "hello", false), new RecordingSink()).run();
    provider.fragments("hallo baru");
    RecordingSink sink = new RecordingSink();

    relay(job("baru", "hello", false), sink).run();

    assertThat(provider.calls).isEqualTo(2);
    assertThat(sink.text()).isEqualTo("hallo baru");
    assertThat(sink.chunks).hasSize(2);
  }

  @Test
  void forceBypassesCacheAndOverwritesIt() {
    cache.put("mara", "hello", "german", "old");
    provider.fragments("neu");
    RecordingSink sink = new RecordingSink();

    relay(job("mara", "hello", true), sink).run();

    assertThat(provider.calls).isEqualTo(1);
    assertThat(sink.chunks).containsExactly(TranslationChunk.fragment("neu"), TranslationChunk.complete(""));
    assertThat(cache.get("mara", "hello", "german")).contains("neu");
  }

  @Test
  void missingCredentialStreamsDeterministicDemoWithoutCallingProvider() {
    RecordingSink first = new RecordingSink();
    RecordingSink second = new RecordingSink();

    RelayState state = relay(new TranslationJob("mara", null, "Some page text", "german", true), first).run();
    relay(new TranslationJob("mara", null, "Some page text", "german", true), second).run();

    assertThat(state).isEqualTo(RelayState.DONE);
    assertThat(provider.calls).isZero();
    assertThat(first.text()).isNotBlank().contains("GERMAN").contains("Some page text");
    assertThat(first.text()).isEqualTo(second.text());
    assertThat(first.chunks.size()).isGreaterThan(2);
    assertThat(first.terminalChunks()).containsExactly(TranslationChunk.complete(""));
    assertThat(cache.get("mara", "Some page text", "german")).contains(first.text());
  }

  @Test
  void credentialWithWrongPrefixFallsBackToDemo() {
    String foreign = vault.encrypt("pk-not-an-upstream-key");

    RelayState state = relay(new TranslationJob("mara", foreign, "text", "french", false),
                             new RecordingSink()).run();

    assertThat(state).isEqualTo(RelayState.DONE);
    assertThat(provider.calls).isZero();
  }

  @Test
  void undecryptableCredentialFallsBackToDemo() {
    String otherSecret = vault.encrypt(CREDENTIAL, "another-secret");
    RecordingSink sink = new RecordingSink();

    relay(new TranslationJob("mara", otherSecret, "text", "french", false), sink).run();

    assertThat(provider.calls).isZero();
    assertThat(sink.text()).contains("FRENCH");
  }

  @Test
  void midStreamFailureEndsWithOneErrorChunkAndCachesNothing() {
    cache.put("mara", "hello", "german", "previous");
    provider.fragments("Hal", "lo").failAfter(2);
    RecordingSink sink = new RecordingSink();

    RelayState state = relay(job("mara", "hello", true), sink).run();

    assertThat(state).isEqualTo(RelayState.FAILED);
    assertThat(sink.chunks).containsExactly(
        TranslationChunk.fragment("Hal"),
        TranslationChunk.fragment("lo"),
        TranslationChunk.failure(TranslationRelay.FAILURE_MESSAGE));
    assertThat(sink.terminalChunks()).hasSize(1);
    assertThat(cache.get("mara", "hello", "german")).contains("previous");
    assertThat(provider.stream.closed).isTrue();
  }

  @Test
  void failureToOpenStreamIsReportedInBand() {
    provider.failOnOpen = true;
    RecordingSink sink = new RecordingSink();

    RelayState state = relay(job("mara", "hello", false), sink).run();

    assertThat(state).isEqualTo(RelayState.FAILED);
    assertThat(sink.chunks).containsExactly(TranslationChunk.failure(TranslationRelay.FAILURE_MESSAGE));
    assertThat(sink.completions).isEqualTo(1);
    assertThat(cache.size()).isZero();
  }

  @Test
  void emptyUpstreamResultIsNotCached() {
    provider.fragments();
    RecordingSink sink = new RecordingSink();

    RelayState state = relay(job("mara", "hello", false), sink).run();

    assertThat(state).isEqualTo(RelayState.DONE);
    assertThat(sink.chunks).containsExactly(TranslationChunk.complete(""));
    assertThat(cache.size()).isZero();
  }

  @Test
  void clientDisconnectCancelsRelayAndClosesUpstream() {
    provider.fragments("a", "b", "c", "d");
    RecordingSink sink = new RecordingSink();
    sink.failOnSend = 2;

    RelayState state = relay(job("mara", "hello", false), sink).run();

    assertThat(state).isEqualTo(RelayState.CANCELLED);
    assertThat(sink.chunks).containsExactly(TranslationChunk.fragment("a"));
    assertThat(provider.stream.closed).isTrue();
    assertThat(provider.stream.consumed).isLessThan(4);
    assertThat(cache.size()).isZero();
  }

  @Test
  void externalCancelStopsStreamWithoutTerminalChunk() {
    provider.fragments("a", "b", "c");
    RecordingSink sink = new RecordingSink();
    TranslationRelay relay = relay(job("mara", "hello", false), sink);
    provider.onNext = index -> {
      if (index == 1) {
        relay.cancel();
      }
    };

    RelayState state = relay.run();

    assertThat(state).isEqualTo(RelayState.CANCELLED);
    assertThat(sink.terminalChunks()).isEmpty();
    assertThat(provider.stream.closed).isTrue();
    assertThat(cache.size()).isZero();
    assertThat(sink.completions).isEqualTo(1);
  }

  @Test
  void cancelAfterCompletionHasNoEffect() {
    provider.fragments("x");
    TranslationRelay relay = relay(job("mara", "hello", false), new RecordingSink());
    relay.run();

    relay.cancel();

    assertThat(relay.getState()).isEqualTo(RelayState.DONE);
  }

  @Test
  void everyTerminalStateRejectsFurtherTransitions() {
    for (RelayState terminal : List.of(RelayState.DONE, RelayState.FAILED, RelayState.CANCELLED)) {
      assertThat(terminal.isTerminal()).isTrue();
      for (RelayState target : RelayState.values()) {
        assertThat(terminal.canTransitionTo(target)).isFalse();
      }
    }
    assertThat(RelayState.START.canTransitionTo(RelayState.STREAMING)).isFalse();
    assertThat(RelayState.CACHE_HIT.canTransitionTo(RelayState.STREAMING)).isFalse();
    assertThat(RelayState.UPSTREAM.canTransitionTo(RelayState.STREAMING)).isTrue();
  }

  private TranslationRelay relay(TranslationJob job, ChunkSink sink) {
    return new TranslationRelay(job, sink, cache, vault, provider, demoGenerator, Duration.ZERO, "sk-");
  }

  private TranslationJob job(String username, String content, boolean force) {
    return new TranslationJob(username, encryptedCredential, content, "german", force);
  }

  static final class RecordingSink implements ChunkSink {

    final List<TranslationChunk> chunks = new ArrayList<>();
    int completions;
    int failOnSend = -1;
    private int sends;

    @Override
    public void send(TranslationChunk chunk) throws IOException {
      sends++;
      if (sends == failOnSend) {
        throw new IOException("Broken pipe");
      }
      chunks.add(chunk);
    }

    @Override
    public void complete() {
      completions++;
    }

    String text() {
      return chunks.stream()
          .map(TranslationChunk::content)
          .filter(c -> c != null)
          .collect(Collectors.joining());
    }

    List<TranslationChunk> terminalChunks() {
      return chunks.stream().filter(TranslationChunk::done).collect(Collectors.toList());
    }
  }

  static final class ScriptedProvider implements TranslationProvider {

    int calls;
    String lastCredential;
    boolean failOnOpen;
    Consumer<Integer> onNext = index -> { };
    ScriptedStream stream;
    private List<String> fragments = List.of();
    private int failAfter = -1;

    ScriptedProvider fragments(String... fragments) {
      this.fragments = List.of(fragments);
      this.failAfter = -1;
      return this;
    }

    ScriptedProvider failAfter(int count) {
      this.failAfter = count;
      return this;
    }

    @Override
    public FragmentStream openStream(String credential, String content, String targetLanguage) {
      calls++;
      lastCredential = credential;
      if (failOnOpen) {
        throw new UpstreamException("Translation provider rejected the request, status: 401");
      }
      stream = new ScriptedStream(fragments, failAfter, onNext);
      return stream;
    }
  }

  static final class ScriptedStream implements FragmentStream {

    private final List<String> fragments;
    private final int failAfter;
    private final Consumer<Integer> onNext;
    int consumed;
    volatile boolean closed;

    ScriptedStream(List<String> fragments, int failAfter, Consumer<Integer> onNext) {
      this.fragments = fragments;
      this.failAfter = failAfter;
      this.onNext = onNext;
    }

    @Override
    public Optional<String> next() {
      if (closed) {
        throw new UpstreamException("Translation stream interrupted");
      }
      if (consumed == failAfter) {
        throw new UpstreamException("Translation stream interrupted");
      }
      if (consumed >= fragments.size()) {
        return Optional.empty();
      }
      onNext.accept(consumed);
      return Optional.of(fragments.get(consumed++));
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
