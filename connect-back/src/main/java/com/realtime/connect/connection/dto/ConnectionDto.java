package com.realtime.connect.connection.dto;

import com.realtime.connect.connection.model.ConnectionStatus;

import java.time.Instant;
import java.util.UUID;

public record ConnectionDto(
        Long id,
        UUID requestedBy,
        UUID receiver,
        ConnectionStatus status,
        String matchedOn,
        Instant createdAt,
        Instant acceptedAt
) {}
