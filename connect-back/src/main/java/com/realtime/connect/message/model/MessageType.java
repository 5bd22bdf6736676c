package com.realtime.connect.message.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** image/voice/file의 content는 URL 또는 라벨(검증은 호출측 책임) */
public enum MessageType {
    TEXT,
    IMAGE,
    VOICE,
    FILE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageType from(String raw) {
        if (raw == null) return null;
        return MessageType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
