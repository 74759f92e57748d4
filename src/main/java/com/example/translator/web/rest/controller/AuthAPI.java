package com.example.translator.web.rest.controller;

import static com.example.translator.web.rest.ApiConstants.ApiPath.*;

import com.example.translator.domain.entity.AuthenticatedUser;
import com.example.translator.web.rest.dto.LoginRequest;
import com.example.translator.web.rest.dto.LoginResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(
    name = "Authentication",
    description = "Login against the fixed user roster and bearer-token session management"
)
@RequestMapping(
    value = AUTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface AuthAPI {

  @Operation(
      summary = "Log in",
      description = "Verifies the user's password, stores the encrypted upstream credential in a new "
          + "session and returns its bearer token"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session created"),
      @ApiResponse(responseCode = "400", description = "Missing fields or malformed upstream credential"),
      @ApiResponse(responseCode = "401", description = "Invalid credentials"),
      @ApiResponse(responseCode = "429", description = "Rate limit or active-session cap reached"),
      @ApiResponse(responseCode = "500", description = "Server secret not configured")
  })
  @PostMapping(value = LOGIN, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<LoginResponse> login(
      @Valid @RequestBody LoginRequest loginRequest,
      HttpServletRequest request
                                     );

  @Operation(
      summary = "Log out",
      description = "Revokes the session. Stateless tokens stay valid until they expire.",
      security = @SecurityRequirement(name = "bearer")
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Logged out"),
      @ApiResponse(responseCode = "401", description = "Missing, invalid or expired token")
  })
  @PostMapping(value = LOGOUT)
  ResponseEntity<Map<String, Object>> logout(
      @Parameter(hidden = true) @AuthenticationPrincipal AuthenticatedUser user
                                            );

  @Operation(
      summary = "Current user",
      description = "Returns the username the bearer token was issued to",
      security = @SecurityRequirement(name = "bearer")
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Token is valid"),
      @ApiResponse(responseCode = "401", description = "Missing, invalid or expired token")
  })
  @GetMapping(value = ME)
  ResponseEntity<Map<String, Object>> me(
      @Parameter(hidden = true) @AuthenticationPrincipal AuthenticatedUser user
                                        );
}
