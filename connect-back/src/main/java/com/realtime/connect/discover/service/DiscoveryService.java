package com.realtime.connect.discover.service;

import com.realtime.connect.common.Normalizer;
import com.realtime.connect.config.DiscoverProps;
import com.realtime.connect.connection.service.ConnectionService;
import com.realtime.connect.directory.entity.User;
import com.realtime.connect.directory.service.DirectoryService;
import com.realtime.connect.discover.dto.CandidateDto;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

@Service
@RequiredArgsConstructor
public class DiscoveryService {

    private final DirectoryService directory;
    private final ConnectionService connectionService;
    private final DiscoverProps props;
    private final Normalizer normalizer;

    /**
     * 나를 제외한 사용자(선택적으로 무드 일치)를 디렉터리 순서로 돌려준다.
     * 후보와 요청 여부는 호출 시점에 한 번 읽고, 요약 변환은 스트림을 소비할 때 일어난다.
     * 같은 입력으로 다시 호출하면 그 시점의 스냅샷을 새로 만든다.
     */
    public Stream<CandidateDto> discover(UUID requesterId, @Nullable String moodFilter) {
        directory.requireUser(requesterId);
        String mood = normalizer.normalizeMood(moodFilter);

        List<User> snapshot = directory.candidates(requesterId, mood, props.getLimit());
        Set<UUID> requested = connectionService.requestedTargets(requesterId);

        return snapshot.stream()
                .map(u -> new CandidateDto(directory.summarize(u), requested.contains(u.getId())));
    }
}
