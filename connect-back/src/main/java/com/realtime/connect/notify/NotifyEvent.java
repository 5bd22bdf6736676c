package com.realtime.connect.notify;

import com.realtime.connect.connection.model.ConnectionStatus;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * /topic/connections/{userId} 로 나가는 연결 이벤트. 클라이언트는 이걸 받으면 목록/뱃지를 다시 읽는다.
 */
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class NotifyEvent {

    public enum Type { CONNECTION_REQUESTED, CONNECTION_ACCEPTED }

    private Type type;
    private Long connectionId;
    private UUID from;          // 행동한 사람
    private UUID to;
    private ConnectionStatus status;
    private String matchedOn;
    private Instant at;
}
