package com.realtime.connect.connection.dto;

import com.realtime.connect.connection.model.RequestOutcome;

public record ConnectionRequestResult(ConnectionDto connection, RequestOutcome outcome) {}
