package com.example.translator.web.rest.dto;

import com.example.translator.domain.entity.LoginResult;

public record LoginResponse(
    String token,
    String username,
    long expiresIn,
    boolean notificationQueued
) {
  public static LoginResponse from(LoginResult result) {
    return new LoginResponse(result.token(), result.username(), result.expiresIn(),
                             result.notificationQueued());
  }
}
