package com.example.translator.domain.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One server-sent event of a translation stream. Exactly one chunk per stream is terminal
 * ({@code isDone = true}); it carries either the remaining content or an error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranslationChunk(
    String content,
    String error,
    @JsonProperty("isDone") boolean done
) {

  public static TranslationChunk fragment(String content) {
    return new TranslationChunk(content, null, false);
  }

  public static TranslationChunk complete(String content) {
    return new TranslationChunk(content, null, true);
  }

  public static TranslationChunk failure(String error) {
    return new TranslationChunk(null, error, true);
  }

  public boolean hasError() {
    return error != null;
  }
}
