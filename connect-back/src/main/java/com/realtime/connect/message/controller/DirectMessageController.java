package com.realtime.connect.message.controller;

import com.realtime.connect.common.CurrentUser;
import com.realtime.connect.message.dto.DirectMessageDto;
import com.realtime.connect.message.dto.SendMessageRequest;
import com.realtime.connect.message.service.DirectMessageService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
public class DirectMessageController {

    private final DirectMessageService messageService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public DirectMessageDto send(@Valid @RequestBody SendMessageRequest body, Authentication auth) {
        return messageService.send(CurrentUser.id(auth), body.receiverId(), body.content(), body.messageType());
    }

    @GetMapping("/{counterpartId}")
    public List<DirectMessageDto> history(@PathVariable("counterpartId") UUID counterpartId,
                                          @RequestParam(name = "limit", defaultValue = "50") int limit,
                                          @RequestParam(name = "offset", defaultValue = "0") int offset,
                                          Authentication auth) {
        return messageService.history(CurrentUser.id(auth), counterpartId, limit, offset);
    }

    @DeleteMapping("/{counterpartId}")
    public Map<String, Object> clear(@PathVariable("counterpartId") UUID counterpartId, Authentication auth) {
        int deleted = messageService.clear(CurrentUser.id(auth), counterpartId);
        return Map.of("message", "대화 기록이 삭제되었습니다.", "deleted", deleted);
    }
}
