package com.realtime.connect.security;

import java.util.Optional;

/** "Bearer xxx" 헤더 값 → 토큰. HTTP 필터와 STOMP CONNECT가 같이 쓴다 */
public final class BearerToken {

    private static final String PREFIX = "Bearer ";

    private BearerToken() {
    }

    public static Optional<String> extract(String header) {
        if (header == null || !header.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return Optional.empty();
        }
        String token = header.substring(PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
