package com.realtime.connect.directory.service;

import com.realtime.connect.common.ConnectException;
import com.realtime.connect.directory.dto.UserSummaryDto;
import com.realtime.connect.directory.entity.User;
import com.realtime.connect.directory.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 사용자 디렉터리 읽기 전용 창구.
 */
@Service
@RequiredArgsConstructor
public class DirectoryService {

    private final UserRepository userRepo;
    private final PresenceService presence;

    @Transactional(readOnly = true)
    public User requireUser(UUID id) {
        return userRepo.findById(id)
                .orElseThrow(() -> ConnectException.notFound("존재하지 않는 사용자입니다."));
    }

    /** mood가 null이면 필터 없음 */
    @Transactional(readOnly = true)
    public List<User> candidates(UUID excludeId, @Nullable String mood, int limit) {
        var page = PageRequest.of(0, Math.max(1, limit));
        return (mood == null)
                ? userRepo.findOthers(excludeId, page)
                : userRepo.findOthersByMood(excludeId, mood, page);
    }

    /** 한 번의 IN 조회로 요약 맵 생성. 디렉터리에서 사라진 사용자는 빠진다 */
    @Transactional(readOnly = true)
    public Map<UUID, UserSummaryDto> summaries(Collection<UUID> ids) {
        if (ids.isEmpty()) return Map.of();
        return userRepo.findAllById(ids).stream()
                .map(this::summarize)
                .collect(Collectors.toMap(UserSummaryDto::getId, Function.identity()));
    }

    public UserSummaryDto summarize(User u) {
        return UserSummaryDto.builder()
                .id(u.getId())
                .username(u.getUsername())
                .displayName(u.getDisplayName())
                .avatarUrl(u.getAvatarUrl())
                .currentMood(u.getCurrentMood())
                .bio(u.getBio())
                .online(presence.isOnline(u))
                .build();
    }
}
