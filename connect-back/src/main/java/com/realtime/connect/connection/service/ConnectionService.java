package com.realtime.connect.connection.service;

import com.realtime.connect.common.ConnectException;
import com.realtime.connect.common.ErrorCode;
import com.realtime.connect.common.Normalizer;
import com.realtime.connect.common.PairKey;
import com.realtime.connect.common.PairLockRegistry;
import com.realtime.connect.connection.dto.ConnectedUserDto;
import com.realtime.connect.connection.dto.ConnectionDto;
import com.realtime.connect.connection.dto.ConnectionRequestResult;
import com.realtime.connect.connection.dto.PendingConnectionDto;
import com.realtime.connect.connection.entity.Connection;
import com.realtime.connect.connection.model.ConnectionStatus;
import com.realtime.connect.connection.model.RequestOutcome;
import com.realtime.connect.connection.repository.ConnectionRepository;
import com.realtime.connect.directory.dto.UserSummaryDto;
import com.realtime.connect.directory.entity.User;
import com.realtime.connect.directory.service.DirectoryService;
import com.realtime.connect.notify.ConnectionEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionService {

    private static final int INSERT_ATTEMPTS = 3;

    private final ConnectionRepository connectionRepo;
    private final DirectoryService directory;
    private final PairLockRegistry pairLocks;
    private final TransactionTemplate tx;
    private final ConnectionEventPublisher events;
    private final Normalizer normalizer;

    private ConnectionDto toDto(Connection c) {
        return new ConnectionDto(
                c.getId(),
                c.getRequestedBy(),
                c.counterpartOf(c.getRequestedBy()),
                c.getStatus(),
                c.getMatchedOn(),
                c.getCreatedAt(),
                c.getAcceptedAt()
        );
    }

    /* ===================== 요청 ===================== */

    /**
     * 연결 요청. 같은 쌍에는 레코드가 하나뿐이며, 반복 호출은 기존 상태를 돌려준다.
     * 상대가 이미 나에게 보낸 보류 요청이 있으면 그 요청을 수락한다.
     *
     * @param mood 요청 시점에 공유한 무드(선택). 없으면 양쪽 디렉터리 무드가 같을 때만 기록
     */
    public ConnectionRequestResult request(UUID requesterId, UUID targetId, @Nullable String mood) {
        if (requesterId.equals(targetId)) {
            throw ConnectException.badRequest("자기 자신에게는 요청할 수 없습니다.");
        }
        User requester = directory.requireUser(requesterId);
        User target = directory.requireUser(targetId);
        String matchedOn = matchedOn(mood, requester, target);
        PairKey pair = PairKey.of(requesterId, targetId);

        ConnectionRequestResult result = requestWithRetry(pair, requesterId, matchedOn);

        switch (result.outcome()) {
            case CREATED -> events.requested(result.connection());
            case MUTUAL_ACCEPTED -> events.accepted(result.connection(), requesterId);
            default -> log.debug("repeated request ignored: pair={} outcome={}", pair, result.outcome());
        }
        return result;
    }

    /**
     * 락은 노드 단위라 다른 인스턴스와의 동시 생성은 유니크 제약이 막는다.
     * 제약 위반이면 레코드가 이미 있으니 다시 읽어서 기존 상태로 응답한다.
     */
    private ConnectionRequestResult requestWithRetry(PairKey pair, UUID requesterId, @Nullable String matchedOn) {
        DataIntegrityViolationException last = null;
        for (int attempt = 1; attempt <= INSERT_ATTEMPTS; attempt++) {
            try {
                return pairLocks.withLock(pair, () -> tx.execute(status -> doRequest(pair, requesterId, matchedOn)));
            } catch (DataIntegrityViolationException e) {
                last = e;
                log.debug("concurrent insert on pair={} attempt={}, re-reading", pair, attempt);
            }
        }
        throw new ConnectException(ErrorCode.CONFLICT, "이미 처리 중인 연결 요청입니다.", last);
    }

    private ConnectionRequestResult doRequest(PairKey pair, UUID requesterId, @Nullable String matchedOn) {
        Optional<Connection> existing = connectionRepo.findByPair(pair);
        if (existing.isEmpty()) {
            Connection saved = connectionRepo.saveAndFlush(Connection.builder()
                    .userLow(pair.low())
                    .userHigh(pair.high())
                    .requestedBy(requesterId)
                    .status(ConnectionStatus.PENDING)
                    .matchedOn(matchedOn)
                    .build());
            return new ConnectionRequestResult(toDto(saved), RequestOutcome.CREATED);
        }

        Connection c = existing.get();
        if (c.getStatus() == ConnectionStatus.ACCEPTED) {
            return new ConnectionRequestResult(toDto(c), RequestOutcome.ALREADY_CONNECTED);
        }
        if (c.getRequestedBy().equals(requesterId)) {
            return new ConnectionRequestResult(toDto(c), RequestOutcome.ALREADY_REQUESTED);
        }
        // 양쪽이 서로 요청 = 수락
        c.accept(Instant.now());
        return new ConnectionRequestResult(toDto(c), RequestOutcome.MUTUAL_ACCEPTED);
    }

    @Nullable
    private String matchedOn(@Nullable String supplied, User requester, User target) {
        String mood = normalizer.normalizeMood(supplied);
        if (mood != null) return mood;
        return normalizer.sameMood(requester.getCurrentMood(), target.getCurrentMood())
                ? normalizer.normalizeMood(requester.getCurrentMood())
                : null;
    }

    /* ===================== 수락 ===================== */

    public ConnectionDto accept(UUID actorId, Long connectionId) {
        Connection found = connectionRepo.findById(connectionId)
                .filter(c -> c.involves(actorId))
                .orElseThrow(() -> ConnectException.notFound("요청이 없거나 권한이 없습니다."));

        ConnectionDto dto = pairLocks.withLock(found.pair(), () -> tx.execute(status -> {
            Connection c = connectionRepo.findById(connectionId)
                    .orElseThrow(() -> ConnectException.notFound("요청이 없거나 권한이 없습니다."));
            if (c.getStatus() == ConnectionStatus.ACCEPTED) {
                throw ConnectException.invalidState("이미 수락된 연결입니다.");
            }
            if (c.getRequestedBy().equals(actorId)) {
                throw ConnectException.invalidState("요청자는 자신의 요청을 수락할 수 없습니다.");
            }
            c.accept(Instant.now());
            return toDto(c);
        }));

        events.accepted(dto, actorId);
        return dto;
    }

    /* ===================== 조회 ===================== */

    /** 받은 보류 요청(내가 처리해야 하는 것), 최신순 */
    @Transactional(readOnly = true)
    public List<PendingConnectionDto> listPending(UUID userId) {
        return toPendingDtos(userId, connectionRepo.findIncoming(userId, ConnectionStatus.PENDING));
    }

    /** 내가 보낸 보류 요청, 최신순 */
    @Transactional(readOnly = true)
    public List<PendingConnectionDto> listOutgoing(UUID userId) {
        return toPendingDtos(userId,
                connectionRepo.findByRequestedByAndStatusOrderByCreatedAtDesc(userId, ConnectionStatus.PENDING));
    }

    @Transactional(readOnly = true)
    public List<ConnectedUserDto> listAccepted(UUID userId) {
        List<Connection> accepted = connectionRepo.findByMemberAndStatus(userId, ConnectionStatus.ACCEPTED);
        Map<UUID, UserSummaryDto> profiles = directory.summaries(
                accepted.stream().map(c -> c.counterpartOf(userId)).collect(Collectors.toSet()));

        return accepted.stream()
                .filter(c -> profiles.containsKey(c.counterpartOf(userId)))
                .map(c -> new ConnectedUserDto(
                        c.getId(),
                        profiles.get(c.counterpartOf(userId)),
                        c.getMatchedOn(),
                        c.getAcceptedAt()))
                .toList();
    }

    @Transactional(readOnly = true)
    public long countPending(UUID userId) {
        return connectionRepo.countIncoming(userId, ConnectionStatus.PENDING);
    }

    public boolean isConnected(PairKey pair) {
        return connectionRepo.existsByUserLowAndUserHighAndStatus(pair.low(), pair.high(), ConnectionStatus.ACCEPTED);
    }

    /** 내가 요청자로 남아 있는 상대 id (보류/수락 모두) */
    @Transactional(readOnly = true)
    public Set<UUID> requestedTargets(UUID requesterId) {
        return connectionRepo.findByRequestedBy(requesterId).stream()
                .map(c -> c.counterpartOf(requesterId))
                .collect(Collectors.toSet());
    }

    private List<PendingConnectionDto> toPendingDtos(UUID userId, List<Connection> pending) {
        Map<UUID, UserSummaryDto> profiles = directory.summaries(
                pending.stream().map(c -> c.counterpartOf(userId)).collect(Collectors.toSet()));

        return pending.stream()
                .filter(c -> profiles.containsKey(c.counterpartOf(userId)))
                .map(c -> new PendingConnectionDto(
                        c.getId(),
                        profiles.get(c.counterpartOf(userId)),
                        c.getMatchedOn(),
                        c.getCreatedAt()))
                .toList();
    }
}
