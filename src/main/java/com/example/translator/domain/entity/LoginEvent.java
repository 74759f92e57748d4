package com.example.translator.domain.entity;

import java.time.Instant;

/**
 * A successful login, as reported to the notification sink.
 */
public record LoginEvent(
    String username,
    String clientIp,
    String userAgent,
    String host,
    Instant occurredAt
) {}
