package com.realtime.connect.connection.repository;

import com.realtime.connect.common.PairKey;
import com.realtime.connect.connection.entity.Connection;
import com.realtime.connect.connection.model.ConnectionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ConnectionRepository extends JpaRepository<Connection, Long> {

    Optional<Connection> findByUserLowAndUserHigh(UUID userLow, UUID userHigh);

    boolean existsByUserLowAndUserHighAndStatus(UUID userLow, UUID userHigh, ConnectionStatus status);

    default Optional<Connection> findByPair(PairKey pair) {
        return findByUserLowAndUserHigh(pair.low(), pair.high());
    }

    /** 내가 멤버인 특정 상태의 연결 */
    @Query("""
        select c from Connection c
        where c.status = :status and (c.userLow = :userId or c.userHigh = :userId)
        order by c.createdAt desc, c.id desc
        """)
    List<Connection> findByMemberAndStatus(@Param("userId") UUID userId, @Param("status") ConnectionStatus status);

    /** 받은 요청: 내가 멤버이고 요청자는 상대 */
    @Query("""
        select c from Connection c
        where c.status = :status and (c.userLow = :userId or c.userHigh = :userId)
          and c.requestedBy <> :userId
        order by c.createdAt desc, c.id desc
        """)
    List<Connection> findIncoming(@Param("userId") UUID userId, @Param("status") ConnectionStatus status);

    /** 뱃지용 카운트: 인덱스(user_low/high, status)만 탄다 */
    @Query("""
        select count(c) from Connection c
        where c.status = :status and (c.userLow = :userId or c.userHigh = :userId)
          and c.requestedBy <> :userId
        """)
    long countIncoming(@Param("userId") UUID userId, @Param("status") ConnectionStatus status);

    List<Connection> findByRequestedByAndStatusOrderByCreatedAtDesc(UUID requestedBy, ConnectionStatus status);

    List<Connection> findByRequestedBy(UUID requestedBy);
}
