package com.realtime.connect.connection.dto;

import com.realtime.connect.directory.dto.UserSummaryDto;

import java.time.Instant;

public record ConnectedUserDto(
        Long connectionId,
        UserSummaryDto user,
        String matchedOn,
        Instant acceptedAt
) {}
