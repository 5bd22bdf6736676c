package com.realtime.connect.common;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    // 수락된 연결 없이 메시지 접근
    FORBIDDEN(HttpStatus.FORBIDDEN),
    // 이미 수락됨 / 요청자가 스스로 수락
    INVALID_STATE(HttpStatus.CONFLICT),
    // canonical pair 유니크 제약 위반
    CONFLICT(HttpStatus.CONFLICT),
    // 스토리지/네트워크 타임아웃, 재시도 가능
    TRANSIENT(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;
}
