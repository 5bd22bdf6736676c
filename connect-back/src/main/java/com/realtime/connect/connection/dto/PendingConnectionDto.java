package com.realtime.connect.connection.dto;

import com.realtime.connect.directory.dto.UserSummaryDto;

import java.time.Instant;

/** user = 상대(받은 요청이면 요청자, 보낸 요청이면 대상) */
public record PendingConnectionDto(
        Long connectionId,
        UserSummaryDto user,
        String matchedOn,
        Instant createdAt
) {}
