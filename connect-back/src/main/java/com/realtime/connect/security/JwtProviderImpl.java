package com.realtime.connect.security;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;

@Component
public class JwtProviderImpl implements JwtProvider {

    private static final String HMAC_ALG = "HmacSHA256"; // 인증 서비스와 같은 HS256

    private final JwtParser parser;

    public JwtProviderImpl(
            @Value("${jwt.secret}") String secret,
            @Value("${jwt.secret-base64:false}") boolean base64,
            @Value("${jwt.clock-skew-seconds:30}") long clockSkewSeconds
    ) {
        byte[] bytes = base64
                ? Base64.getDecoder().decode(secret)
                : secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < 32) {
            throw new IllegalArgumentException("JWT secret length must be >= 32 bytes (256 bits).");
        }

        // 파서는 불변이라 한 번만 만든다
        this.parser = Jwts.parser()
                .verifyWith(new SecretKeySpec(bytes, HMAC_ALG))
                .clockSkewSeconds(clockSkewSeconds)
                .build();
    }

    @Override
    public UUID parseUserId(String accessToken) {
        String subject;
        try {
            subject = parser.parseSignedClaims(accessToken).getPayload().getSubject();
        } catch (JwtException | IllegalArgumentException e) {
            throw new SecurityException("Invalid access token", e);
        }
        if (subject == null) {
            throw new SecurityException("Access token has no subject");
        }
        try {
            return UUID.fromString(subject);
        } catch (IllegalArgumentException e) {
            throw new SecurityException("Access token subject is not a user id", e);
        }
    }
}
