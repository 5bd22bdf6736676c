package com.realtime.connect.message.dto;

import com.realtime.connect.message.model.MessageType;

import java.time.Instant;
import java.util.UUID;

public record DirectMessageDto(
        Long id,
        UUID senderId,
        UUID receiverId,
        String content,
        MessageType messageType,
        Instant createdAt
) {}
