package com.realtime.connect.directory.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 사용자 디렉터리 레코드. 프로필/인증 서비스가 관리하며 이 모듈은 읽기만 한다.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class User {

    @Id
    private UUID id;

    @Column(name = "username", length = 100, nullable = false, unique = true)
    private String username;

    /** 화면 표시용 이름 */
    @Column(name = "display_name", length = 100)
    private String displayName;

    /** 최근 감정(소문자). 미설정이면 null */
    @Column(name = "current_mood", length = 32)
    private String currentMood;

    @Column(name = "is_online", nullable = false)
    private boolean online;

    @Column(name = "avatar_url", length = 512)
    private String avatarUrl;

    @Column(length = 500)
    private String bio;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
