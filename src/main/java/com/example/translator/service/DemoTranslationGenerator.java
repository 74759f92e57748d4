package com.example.translator.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Fixed explanatory response used when a session has no usable upstream credential.
 * Output depends only on the input, so repeated requests yield identical text.
 */
@Component
public class DemoTranslationGenerator {

  private static final int QUOTE_LENGTH = 100;

  public String generate(String content, String targetLanguage) {
    String quoted = content.length() > QUOTE_LENGTH ? content.substring(0, QUOTE_LENGTH) : content;
    return String.join("\n",
        "",
        "**DEMO TRANSLATION** (" + targetLanguage.toUpperCase(Locale.ROOT) + ")",
        "",
        "This is a simulated translation of the page.",
        "",
        "**Original text began with:**",
        "\"" + quoted + "...\"",
        "",
        "**A real translation appears here once a valid API key is supplied at login.**",
        "",
        "Everything else works in demo mode: streaming, caching, page navigation and "
            + "language switching.",
        "");
  }

  /**
   * Word-sized pieces whose concatenation is exactly {@code text}.
   */
  public List<String> split(String text) {
    List<String> chunks = new ArrayList<>();
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == ' ') {
        chunks.add(text.substring(start, i + 1));
        start = i + 1;
      }
    }
    if (start < text.length()) {
      chunks.add(text.substring(start));
    }
    return chunks;
  }
}
