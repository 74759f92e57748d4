package com.example.translator.web.rest.controller;

import static com.example.translator.web.rest.ApiConstants.ApiPath.*;

import com.example.translator.domain.entity.AuthenticatedUser;
import com.example.translator.web.rest.dto.TranslationRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Tag(
    name = "Translation",
    description = "Streaming translation relay and its per-user result cache"
)
public interface TranslationAPI {

  @Operation(
      summary = "Translate as a server-sent event stream",
      description = "Streams {content, isDone:false} fragments followed by one terminal event, either "
          + "{content:\"\", isDone:true} or {error, isDone:true}. A cached result is sent as a single "
          + "terminal event unless force is set.",
      security = @SecurityRequirement(name = "bearer")
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Event stream opened"),
      @ApiResponse(responseCode = "400", description = "Missing content or target language"),
      @ApiResponse(responseCode = "401", description = "Missing, invalid or expired token"),
      @ApiResponse(responseCode = "429", description = "Rate limit exceeded")
  })
  @PostMapping(value = TRANSLATE_STREAM, consumes = MediaType.APPLICATION_JSON_VALUE)
  SseEmitter translateStream(
      @Parameter(hidden = true) @AuthenticationPrincipal AuthenticatedUser user,
      @Valid @RequestBody TranslationRequest translationRequest
                            );

  @Operation(
      summary = "Cache status",
      description = "Number of cached translations across all users"
  )
  @ApiResponse(responseCode = "200", description = "Cache size returned")
  @GetMapping(value = CACHE_STATUS, produces = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> cacheStatus();

  @Operation(
      summary = "Clear cache",
      description = "Drops every cached translation"
  )
  @ApiResponse(responseCode = "200", description = "Cache cleared")
  @DeleteMapping(value = CACHE, produces = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> clearCache();
}
