package com.realtime.connect.notify;

import com.realtime.connect.connection.dto.ConnectionDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * 연결 상태 변화를 양쪽 사용자 토픽으로 알린다. 실패해도 원래 작업은 성공으로 끝난다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionEventPublisher {

    public static final String TOPIC_PREFIX = "/topic/connections/";

    private final SimpMessagingTemplate messaging;

    public static String topic(UUID userId) {
        return TOPIC_PREFIX + userId;
    }

    public void requested(ConnectionDto c) {
        publish(NotifyEvent.Type.CONNECTION_REQUESTED, c, c.requestedBy(), c.receiver());
    }

    /** actor = 수락한 사람, 알림 대상은 원래 요청자 */
    public void accepted(ConnectionDto c, UUID actor) {
        UUID other = actor.equals(c.requestedBy()) ? c.receiver() : c.requestedBy();
        publish(NotifyEvent.Type.CONNECTION_ACCEPTED, c, actor, other);
    }

    private void publish(NotifyEvent.Type type, ConnectionDto c, UUID from, UUID to) {
        NotifyEvent ev = NotifyEvent.builder()
                .type(type)
                .connectionId(c.id())
                .from(from)
                .to(to)
                .status(c.status())
                .matchedOn(c.matchedOn())
                .at(Instant.now())
                .build();

        send(from, ev);
        send(to, ev);
    }

    private void send(UUID userId, NotifyEvent ev) {
        try {
            messaging.convertAndSend(topic(userId), ev);
        } catch (MessagingException e) {
            log.warn("connection event dropped: type={} user={} err={}", ev.getType(), userId, e.toString());
        }
    }
}
