package com.example.translator.service;

import com.example.translator.domain.entity.TranslationChunk;
import java.io.IOException;

/**
 * Caller-side end of a relay. An {@link IOException} means the caller has gone away.
 */
public interface ChunkSink {

  void send(TranslationChunk chunk) throws IOException;

  void complete();
}
