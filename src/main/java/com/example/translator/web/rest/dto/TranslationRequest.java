package com.example.translator.web.rest.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

/**
 * Translate body. {@code pageText} is accepted as an alias of {@code content}.
 */
public record TranslationRequest(
    @NotBlank(message = "Missing content or targetLanguage") @JsonAlias("pageText") String content,
    @NotBlank(message = "Missing content or targetLanguage") String targetLanguage,
    Boolean force
) {
  public boolean forceRefresh() {
    return Boolean.TRUE.equals(force);
  }
}
