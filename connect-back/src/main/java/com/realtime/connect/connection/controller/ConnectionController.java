package com.realtime.connect.connection.controller;

import com.realtime.connect.common.CurrentUser;
import com.realtime.connect.connection.dto.ConnectedUserDto;
import com.realtime.connect.connection.dto.ConnectionDto;
import com.realtime.connect.connection.dto.ConnectionRequestResult;
import com.realtime.connect.connection.dto.PendingConnectionDto;
import com.realtime.connect.connection.dto.SendConnectionRequest;
import com.realtime.connect.connection.model.RequestOutcome;
import com.realtime.connect.connection.service.ConnectionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/connections")
@RequiredArgsConstructor
public class ConnectionController {

    private final ConnectionService connectionService;

    /** 연결 요청: 새로 만들면 201, 반복/상호 요청이면 200 */
    @PostMapping("/request")
    public ResponseEntity<ConnectionRequestResult> request(@Valid @RequestBody SendConnectionRequest body,
                                                           Authentication auth) {
        UUID myId = CurrentUser.id(auth);
        ConnectionRequestResult result = connectionService.request(myId, body.targetUserId(), body.mood());
        HttpStatus status = result.outcome() == RequestOutcome.CREATED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    /* ======= 수락 ======= */
    @PutMapping("/{id}/accept")
    public ConnectionDto accept(@PathVariable("id") Long id, Authentication auth) {
        return connectionService.accept(CurrentUser.id(auth), id);
    }

    /* ======= 요청 들어옴 ======= */
    @GetMapping("/pending")
    public List<PendingConnectionDto> pending(Authentication auth) {
        return connectionService.listPending(CurrentUser.id(auth));
    }

    /** 뱃지 폴링용 */
    @GetMapping("/pending/count")
    public long pendingCount(Authentication auth) {
        return connectionService.countPending(CurrentUser.id(auth));
    }

    /* ======= 요청 나감 ======= */
    @GetMapping("/outgoing")
    public List<PendingConnectionDto> outgoing(Authentication auth) {
        return connectionService.listOutgoing(CurrentUser.id(auth));
    }

    @GetMapping("/accepted")
    public List<ConnectedUserDto> accepted(Authentication auth) {
        return connectionService.listAccepted(CurrentUser.id(auth));
    }
}
