package com.example.translator.web.rest.controller;

import com.example.translator.domain.entity.AuthenticatedUser;
import com.example.translator.domain.entity.LoginResult;
import com.example.translator.service.AuthService;
import com.example.translator.util.RequestUtil;
import com.example.translator.web.rest.dto.LoginRequest;
import com.example.translator.web.rest.dto.LoginResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for login, logout and the current-user check.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class AuthController implements AuthAPI {

  private final AuthService authService;

  @Override
  public ResponseEntity<LoginResponse> login(LoginRequest loginRequest, HttpServletRequest request) {
    log.debug("Login request for user {}", loginRequest.username());

    LoginResult result = authService.login(
        loginRequest.username(),
        loginRequest.password(),
        loginRequest.upstreamCredential(),
        RequestUtil.getClientIp(request),
        request.getHeader(HttpHeaders.USER_AGENT),
        request.getHeader(HttpHeaders.HOST)
                                          );

    return ResponseEntity.ok(LoginResponse.from(result));
  }

  @Override
  public ResponseEntity<Map<String, Object>> logout(AuthenticatedUser user) {
    authService.logout(user.token());
    return ResponseEntity.ok(Map.of("ok", true));
  }

  @Override
  public ResponseEntity<Map<String, Object>> me(AuthenticatedUser user) {
    return ResponseEntity.ok(Map.of("username", authService.identify(user.token())));
  }
}
