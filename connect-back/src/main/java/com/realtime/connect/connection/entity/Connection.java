package com.realtime.connect.connection.entity;

import com.realtime.connect.common.PairKey;
import com.realtime.connect.connection.model.ConnectionStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "connections",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_connection_pair", columnNames = {"user_low", "user_high"})
    },
    indexes = {
        @Index(name = "ix_connections_low_status", columnList = "user_low, status"),
        @Index(name = "ix_connections_high_status", columnList = "user_high, status"),
        @Index(name = "ix_connections_requested_by", columnList = "requested_by")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Connection {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // canonical 순서: user_low < user_high
    @Column(name = "user_low", nullable = false)
    private UUID userLow;

    @Column(name = "user_high", nullable = false)
    private UUID userHigh;

    @Column(name = "requested_by", nullable = false)
    private UUID requestedBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ConnectionStatus status; // PENDING, ACCEPTED

    @Column(name = "matched_on", length = 32)
    private String matchedOn;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @Column(name = "accepted_at")
    private Instant acceptedAt;

    public PairKey pair() {
        return new PairKey(userLow, userHigh);
    }

    public boolean involves(UUID userId) {
        return userLow.equals(userId) || userHigh.equals(userId);
    }

    public UUID counterpartOf(UUID userId) {
        return pair().other(userId);
    }

    /** pending → accepted, 한 번만 */
    public void accept(Instant at) {
        if (status != ConnectionStatus.PENDING) {
            throw new IllegalStateException("connection " + id + " is " + status);
        }
        this.status = ConnectionStatus.ACCEPTED;
        this.acceptedAt = at;
    }
}
