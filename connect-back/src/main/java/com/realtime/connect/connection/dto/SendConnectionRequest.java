package com.realtime.connect.connection.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record SendConnectionRequest(
        @NotNull UUID targetUserId,
        @Size(max = 32) String mood
) {}
