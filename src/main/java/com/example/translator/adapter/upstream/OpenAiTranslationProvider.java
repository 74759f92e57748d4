package com.example.translator.adapter.upstream;

import com.example.translator.exception.UpstreamException;
import com.example.translator.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.springframework.stereotype.Component;

/**
 * OpenAI-compatible chat-completions client in streaming mode.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiTranslationProvider implements TranslationProvider {

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final String COMPLETIONS_PATH = "/v1/chat/completions";
  private static final String DATA_PREFIX = "data:";
  private static final String DONE_MARKER = "[DONE]";

  static final String SYSTEM_INSTRUCTION =
      "You are a professional translator specializing in technical and certification documents. "
          + "Translate the following text to %s.\n\n"
          + "1. Preserve line breaks and paragraphs. Keep every newline of the input; never merge "
          + "separate lines into continuous text.\n"
          + "2. Preserve the document structure: headings, bullet points and numbering, chapter, "
          + "section, page, figure and reference numbers, indentation and list formatting.\n"
          + "3. Preserve formatting markers: use **text** for bold and *text* for italics, keep "
          + "special characters, symbols and table structures.\n"
          + "4. Use precise technical language and keep standard acronyms untranslated.\n"
          + "5. Output only the translated content, without explanations or notes. Each input line "
          + "corresponds to exactly one output line.";

  private final OkHttpClient upstreamOkHttpClient;
  private final ObjectMapper objectMapper;
  private final ApplicationProperties properties;

  @Override
  @CircuitBreaker(name = "translationProvider", fallbackMethod = "openStreamFallback")
  public FragmentStream openStream(String credential, String content, String targetLanguage) {
    ApplicationProperties.UpstreamProperties upstream = properties.upstream();
    log.debug("Opening upstream stream, model={}, targetLanguage={}, contentLength={}",
              upstream.model(), targetLanguage, content.length());

    Request request = new Request.Builder()
        .url(upstream.baseUrl() + COMPLETIONS_PATH)
        .header("Authorization", "Bearer " + credential)
        .header("Accept", "text/event-stream")
        .post(RequestBody.create(buildRequestBody(content, targetLanguage), JSON))
        .build();

    Call call = upstreamOkHttpClient.newCall(request);
    Response response;
    try {
      response = call.execute();
    } catch (IOException e) {
      throw new UpstreamException("Translation provider unreachable", e);
    }

    if (!response.isSuccessful() || response.body() == null) {
      int status = response.code();
      response.close();
      throw new UpstreamException("Translation provider rejected the request, status: " + status);
    }
    return new OpenAiFragmentStream(call, response);
  }

  public FragmentStream openStreamFallback(String credential, String content,
                                           String targetLanguage, Throwable ex) {
    if (ex instanceof UpstreamException) {
      throw (UpstreamException) ex;
    }
    log.error("Translation provider circuit breaker is open.", ex);
    throw new UpstreamException("Translation provider is temporarily unavailable.", ex);
  }

  private String buildRequestBody(String content, String targetLanguage) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model", properties.upstream().model());
    body.put("messages", List.of(
        Map.of("role", "system", "content", SYSTEM_INSTRUCTION.formatted(targetLanguage)),
        Map.of("role", "user", "content", content)));
    body.put("stream", true);
    body.put("temperature", properties.upstream().temperature());
    body.put("max_tokens", properties.upstream().maxTokens());
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new UpstreamException("Failed to encode provider request", e);
    }
  }

  /**
   * Reads {@code data:} lines of the provider's event stream and yields delta contents.
   */
  private final class OpenAiFragmentStream implements FragmentStream {

    private final Call call;
    private final Response response;
    private final BufferedSource source;
    private boolean finished;

    private OpenAiFragmentStream(Call call, Response response) {
      this.call = call;
      this.response = response;
      ResponseBody body = response.body();
      this.source = body.source();
    }

    @Override
    public Optional<String> next() {
      try {
        while (!finished) {
          String line = source.readUtf8Line();
          if (line == null) {
            finished = true;
            break;
          }
          if (!line.startsWith(DATA_PREFIX)) {
            continue;
          }
          String data = line.substring(DATA_PREFIX.length()).trim();
          if (DONE_MARKER.equals(data)) {
            finished = true;
            break;
          }
          String fragment = extractContent(data);
          if (fragment != null && !fragment.isEmpty()) {
            return Optional.of(fragment);
          }
        }
        return Optional.empty();
      } catch (IOException e) {
        throw new UpstreamException("Translation stream interrupted", e);
      }
    }

    private String extractContent(String data) {
      JsonNode node;
      try {
        node = objectMapper.readTree(data);
      } catch (JsonProcessingException e) {
        throw new UpstreamException("Malformed event from translation provider", e);
      }
      if (node.hasNonNull("error")) {
        throw new UpstreamException("Translation provider reported an error: "
                                        + node.path("error").path("message").asText("unknown"));
      }
      JsonNode content = node.path("choices").path(0).path("delta").path("content");
      return content.isTextual() ? content.asText() : null;
    }

    @Override
    public void close() {
      finished = true;
      call.cancel();
      response.close();
    }
  }
}
