package com.realtime.connect.common;

import lombok.Getter;
import org.springframework.web.server.ResponseStatusException;

/**
 * 연결/메시지 도메인 예외. HTTP 상태는 {@link ErrorCode}에서 결정된다.
 */
@Getter
public class ConnectException extends ResponseStatusException {

    private final ErrorCode code;

    public ConnectException(ErrorCode code, String reason) {
        super(code.getStatus(), reason);
        this.code = code;
    }

    public ConnectException(ErrorCode code, String reason, Throwable cause) {
        super(code.getStatus(), reason, cause);
        this.code = code;
    }

    public static ConnectException badRequest(String reason)   { return new ConnectException(ErrorCode.BAD_REQUEST, reason); }
    public static ConnectException notFound(String reason)     { return new ConnectException(ErrorCode.NOT_FOUND, reason); }
    public static ConnectException forbidden(String reason)    { return new ConnectException(ErrorCode.FORBIDDEN, reason); }
    public static ConnectException invalidState(String reason) { return new ConnectException(ErrorCode.INVALID_STATE, reason); }
}
