package com.realtime.connect.security;

import java.util.UUID;

/**
 * 인증 서비스가 발급한 액세스 토큰 검증. 발급은 이 모듈의 책임이 아니다.
 */
public interface JwtProvider {

    /**
     * 서명과 만료를 검증하고 subject(디렉터리 사용자 id)를 꺼낸다.
     * 토큰이 무효이거나 subject가 UUID가 아니면 SecurityException.
     */
    UUID parseUserId(String accessToken);
}
