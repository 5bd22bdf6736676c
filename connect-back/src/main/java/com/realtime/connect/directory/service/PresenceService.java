package com.realtime.connect.directory.service;

import com.realtime.connect.directory.entity.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PresenceService {

    // Redis 미사용 환경에서도 동작하도록 optional
    @Autowired(required = false)
    private StringRedisTemplate redis;

    /** Redis 접속 키가 있으면 우선, 없으면 디렉터리의 is_online 값 */
    public boolean isOnline(User user) {
        if (redis == null) return user.isOnline();
        try {
            String v = redis.opsForValue().get(key(user.getId()));
            return v != null ? "1".equals(v) : user.isOnline();
        } catch (Exception e) {
            log.debug("presence lookup failed for {}: {}", user.getId(), e.toString());
            return user.isOnline();
        }
    }

    public static String key(UUID userId) {
        return "presence:online:" + userId;
    }
}
