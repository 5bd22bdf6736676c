package com.realtime.connect.config;

import com.realtime.connect.notify.ConnectionEventPublisher;
import com.realtime.connect.security.BearerToken;
import com.realtime.connect.security.JwtProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.stereotype.Component;

import java.security.Principal;
import java.util.UUID;

/**
 * STOMP 인바운드 검사.
 * CONNECT: 액세스 토큰 필수, 세션 principal = 사용자 UUID.
 * SUBSCRIBE: 연결 이벤트 토픽은 본인 것만.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtStompInterceptor implements ChannelInterceptor {

    private final JwtProvider jwtProvider;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor acc = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (acc == null || acc.getCommand() == null) return message;

        switch (acc.getCommand()) {
            case CONNECT -> acc.setUser(authenticate(acc));
            case SUBSCRIBE -> checkSubscription(acc.getDestination(), acc.getUser());
            default -> { }
        }
        return message;
    }

    private UsernamePasswordAuthenticationToken authenticate(StompHeaderAccessor acc) {
        String token = BearerToken.extract(acc.getFirstNativeHeader("Authorization"))
                .orElseThrow(() -> new MessageDeliveryException("STOMP CONNECT without bearer token"));
        try {
            UUID userId = jwtProvider.parseUserId(token);
            return new UsernamePasswordAuthenticationToken(userId.toString(), null, JWTAuthenticationFilter.USER);
        } catch (SecurityException e) {
            log.warn("STOMP CONNECT token invalid: {}", e.getMessage());
            throw new MessageDeliveryException("Invalid STOMP CONNECT token");
        }
    }

    private static void checkSubscription(String destination, Principal user) {
        if (destination == null || !destination.startsWith(ConnectionEventPublisher.TOPIC_PREFIX)) return;

        String owner = destination.substring(ConnectionEventPublisher.TOPIC_PREFIX.length());
        if (user == null || !owner.equals(user.getName())) {
            throw new MessageDeliveryException("Cannot subscribe to " + destination);
        }
    }
}
