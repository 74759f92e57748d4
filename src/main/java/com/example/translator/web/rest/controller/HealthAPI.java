package com.example.translator.web.rest.controller;

import static com.example.translator.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(
    name = "Health",
    description = "Process and session-store probes for load balancers and orchestrators"
)
@RequestMapping(
    value = HEALTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface HealthAPI {

  @Operation(
      summary = "Health check",
      description = "Answers {status:\"OK\", timestamp} while the process is serving requests"
  )
  @ApiResponse(responseCode = "200", description = "Gateway is up")
  @GetMapping
  ResponseEntity<Map<String, Object>> health();

  @Operation(
      summary = "Liveness probe",
      description = "Fails once heap usage crosses the critical threshold"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Heap usage acceptable"),
      @ApiResponse(responseCode = "503", description = "Heap nearly exhausted, restart the instance")
  })
  @GetMapping(value = LIVE)
  ResponseEntity<Map<String, Object>> liveness();

  @Operation(
      summary = "Readiness probe",
      description = "Pings Redis when sessions are durable; signed-token deployments are always ready"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session store reachable"),
      @ApiResponse(responseCode = "503", description = "Redis down or slow")
  })
  @GetMapping(value = READY)
  ResponseEntity<Map<String, Object>> readiness();
}
