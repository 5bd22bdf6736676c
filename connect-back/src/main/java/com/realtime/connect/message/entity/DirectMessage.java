package com.realtime.connect.message.entity;

import com.realtime.connect.message.model.MessageType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "direct_messages",
        indexes = {
                @Index(name = "ix_dm_pair_created", columnList = "pair_low, pair_high, created_at, id")
        }
)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DirectMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // 스레드 키(canonical pair). 연결 FK 없이 쌍만으로 조회
    @Column(name = "pair_low", nullable = false)
    private UUID pairLow;

    @Column(name = "pair_high", nullable = false)
    private UUID pairHigh;

    @Column(name = "sender_id", nullable = false)
    private UUID senderId;

    @Column(name = "receiver_id", nullable = false)
    private UUID receiverId;

    @Column(nullable = false, length = 2000)
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false, length = 10)
    private MessageType messageType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
