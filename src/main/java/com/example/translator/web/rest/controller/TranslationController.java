package com.example.translator.web.rest.controller;

import com.example.translator.domain.entity.AuthenticatedUser;
import com.example.translator.domain.entity.TranslationChunk;
import com.example.translator.domain.entity.TranslationJob;
import com.example.translator.properties.ApplicationProperties;
import com.example.translator.service.ChunkSink;
import com.example.translator.service.TranslationRelay;
import com.example.translator.service.TranslationStreamService;
import com.example.translator.web.rest.dto.TranslationRequest;
import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Opens one SSE stream per translate request and hands it to a relay running on the relay pool.
 * Closing the stream from either side cancels the relay.
 */
@Slf4j
@RestController
public class TranslationController implements TranslationAPI {

  private final TranslationStreamService translationStreamService;
  private final TaskExecutor relayTaskExecutor;
  private final ApplicationProperties properties;

  public TranslationController(
      TranslationStreamService translationStreamService,
      @Qualifier("relayTaskExecutor") TaskExecutor relayTaskExecutor,
      ApplicationProperties properties) {
    this.translationStreamService = translationStreamService;
    this.relayTaskExecutor = relayTaskExecutor;
    this.properties = properties;
  }

  @Override
  public SseEmitter translateStream(AuthenticatedUser user, TranslationRequest translationRequest) {
    TranslationJob job = new TranslationJob(
        user.username(),
        user.encryptedCredential(),
        translationRequest.content(),
        translationRequest.targetLanguage(),
        translationRequest.forceRefresh());
    log.info("Translation request: {}", job);

    SseEmitter emitter = new SseEmitter(properties.relay().emitterTimeout().toMillis());
    TranslationRelay relay = translationStreamService.newRelay(job, new SseChunkSink(emitter));

    emitter.onCompletion(relay::cancel);
    emitter.onTimeout(() -> {
      log.warn("Translation stream for user {} timed out", job.username());
      relay.cancel();
    });
    emitter.onError(e -> relay.cancel());

    relayTaskExecutor.execute(relay::run);
    return emitter;
  }

  @Override
  public ResponseEntity<Map<String, Object>> cacheStatus() {
    return ResponseEntity.ok(Map.of(
        "cacheSize", translationStreamService.cacheSize(),
        "timestamp", Instant.now().toString()
                                   ));
  }

  @Override
  public ResponseEntity<Map<String, Object>> clearCache() {
    translationStreamService.clearCache();
    return ResponseEntity.ok(Map.of("message", "Cache cleared successfully"));
  }

  /**
   * Writes each chunk as one {@code data:} event of JSON.
   */
  static final class SseChunkSink implements ChunkSink {

    private final SseEmitter emitter;

    SseChunkSink(SseEmitter emitter) {
      this.emitter = emitter;
    }

    @Override
    public void send(TranslationChunk chunk) throws IOException {
      try {
        emitter.send(SseEmitter.event().data(chunk, MediaType.APPLICATION_JSON));
      } catch (IllegalStateException e) {
        throw new IOException("Event stream already closed", e);
      }
    }

    @Override
    public void complete() {
      emitter.complete();
    }
  }
}
