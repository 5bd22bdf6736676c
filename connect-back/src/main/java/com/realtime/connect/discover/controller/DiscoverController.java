package com.realtime.connect.discover.controller;

import com.realtime.connect.common.CurrentUser;
import com.realtime.connect.discover.dto.CandidateDto;
import com.realtime.connect.discover.dto.DiscoverRequest;
import com.realtime.connect.discover.service.DiscoveryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/discover")
@RequiredArgsConstructor
public class DiscoverController {

    private final DiscoveryService discoveryService;

    /** body 생략 또는 mood 비어있으면 전체 */
    @PostMapping
    public List<CandidateDto> discover(@Valid @RequestBody(required = false) DiscoverRequest body,
                                       Authentication auth) {
        String mood = body == null ? null : body.mood();
        return discoveryService.discover(CurrentUser.id(auth), mood).toList();
    }
}
