package com.example.translator.web.rest.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

/**
 * Login body. {@code openaiApiKey} is accepted as an alias of {@code upstreamCredential}.
 */
public record LoginRequest(
    @NotBlank(message = "Missing username, password, or upstream credential") String username,
    @NotBlank(message = "Missing username, password, or upstream credential") String password,
    @NotBlank(message = "Missing username, password, or upstream credential")
    @JsonAlias("openaiApiKey") String upstreamCredential
) {
  @Override
  public String toString() {
    return "LoginRequest[username=" + username + "]";
  }
}
