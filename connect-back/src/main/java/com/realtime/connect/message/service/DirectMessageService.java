package com.realtime.connect.message.service;

import com.realtime.connect.common.ConnectException;
import com.realtime.connect.common.PairKey;
import com.realtime.connect.common.PairLockRegistry;
import com.realtime.connect.connection.service.ConnectionService;
import com.realtime.connect.message.dto.DirectMessageDto;
import com.realtime.connect.message.entity.DirectMessage;
import com.realtime.connect.message.model.MessageType;
import com.realtime.connect.message.repository.DirectMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DirectMessageService {

    public static final int MAX_LIMIT = 200;
    public static final int MAX_CONTENT = 2000;

    private final DirectMessageRepository messageRepo;
    private final ConnectionService connectionService;
    private final PairLockRegistry pairLocks;
    private final TransactionTemplate tx;

    private static DirectMessageDto toDto(DirectMessage m) {
        return new DirectMessageDto(
                m.getId(),
                m.getSenderId(),
                m.getReceiverId(),
                m.getContent(),
                m.getMessageType(),
                m.getCreatedAt()
        );
    }

    /**
     * 수락된 연결이 있는 쌍에만 저장. 저장된 레코드(id, 시각 포함)를 그대로 돌려준다.
     */
    public DirectMessageDto send(UUID senderId, UUID receiverId, String content, MessageType type) {
        PairKey pair = pairOf(senderId, receiverId);
        if (type == null) throw ConnectException.badRequest("메시지 유형이 필요합니다.");
        if (content == null || content.isBlank()) throw ConnectException.badRequest("내용이 비어 있습니다.");
        if (content.length() > MAX_CONTENT) throw ConnectException.badRequest("메시지가 너무 깁니다.");

        return pairLocks.withLock(pair, () -> tx.execute(status -> {
            requireConnected(pair);
            DirectMessage m = messageRepo.save(DirectMessage.builder()
                    .pairLow(pair.low())
                    .pairHigh(pair.high())
                    .senderId(senderId)
                    .receiverId(receiverId)
                    .content(content)
                    .messageType(type)
                    .createdAt(Instant.now())
                    .build());
            return toDto(m);
        }));
    }

    /**
     * 스레드 조회. offset은 최신 메시지부터 건너뛸 개수이고, 결과는 과거→현재(ASC)로 정렬된다.
     */
    @Transactional(readOnly = true)
    public List<DirectMessageDto> history(UUID me, UUID other, int limit, int offset) {
        PairKey pair = pairOf(me, other);
        requireConnected(pair);

        int capped = Math.min(MAX_LIMIT, Math.max(1, limit));
        List<DirectMessage> newestFirst = messageRepo.findNewestFirst(pair, Math.max(0, offset), capped);
        if (newestFirst.isEmpty()) return List.of();

        // 프론트가 과거→현재로 그리므로 뒤집어서 반환
        List<DirectMessageDto> asc = new ArrayList<>(newestFirst.stream().map(DirectMessageService::toDto).toList());
        Collections.reverse(asc);
        return asc;
    }

    /** 쌍의 메시지 전체 삭제. 연결 상태는 건드리지 않으며 빈 스레드도 성공 */
    public int clear(UUID me, UUID other) {
        PairKey pair = pairOf(me, other);
        Integer deleted = pairLocks.withLock(pair,
                () -> tx.execute(status -> messageRepo.deleteThread(pair.low(), pair.high())));
        int n = deleted == null ? 0 : deleted;
        log.info("thread cleared: pair={} by={} deleted={}", pair, me, n);
        return n;
    }

    private void requireConnected(PairKey pair) {
        if (!connectionService.isConnected(pair)) {
            throw ConnectException.forbidden("연결된 사용자에게만 메시지를 주고받을 수 있습니다.");
        }
    }

    private static PairKey pairOf(UUID me, UUID other) {
        if (me.equals(other)) throw ConnectException.badRequest("자기 자신과는 대화할 수 없습니다.");
        return PairKey.of(me, other);
    }
}
