package com.realtime.connect.message.dto;

import com.realtime.connect.message.model.MessageType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record SendMessageRequest(
        @NotNull UUID receiverId,
        @NotBlank @Size(max = 2000) String content,
        @NotNull MessageType messageType
) {}
