package com.realtime.connect.discover.dto;

import com.realtime.connect.directory.dto.UserSummaryDto;

/** requested = 내가 이 사용자에게 보낸 요청이 있음(보류/수락 무관) */
public record CandidateDto(UserSummaryDto user, boolean requested) {}
