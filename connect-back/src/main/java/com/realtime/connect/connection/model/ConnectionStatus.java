package com.realtime.connect.connection.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConnectionStatus {
    PENDING,
    ACCEPTED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
