package com.realtime.connect.config;

import com.realtime.connect.security.BearerToken;
import com.realtime.connect.security.JwtProvider;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Authorization 헤더의 액세스 토큰 → SecurityContext. principal 이름은 사용자 UUID 문자열.
 * 토큰이 없거나 무효면 인증 없이 통과시키고, /api/** 는 체인 뒤쪽에서 401이 된다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JWTAuthenticationFilter extends OncePerRequestFilter {

    static final List<SimpleGrantedAuthority> USER = List.of(new SimpleGrantedAuthority("ROLE_USER"));

    private final JwtProvider jwtProvider;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // SockJS 핸드셰이크는 CONNECT 프레임에서 따로 검사
        return request.getServletPath().startsWith("/ws")
                || "OPTIONS".equalsIgnoreCase(request.getMethod());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            BearerToken.extract(req.getHeader(HttpHeaders.AUTHORIZATION)).ifPresent(token -> {
                try {
                    UUID userId = jwtProvider.parseUserId(token);
                    var auth = new UsernamePasswordAuthenticationToken(userId.toString(), null, USER);
                    SecurityContextHolder.getContext().setAuthentication(auth);
                } catch (SecurityException e) {
                    log.debug("rejected access token on {} {}: {}", req.getMethod(), req.getRequestURI(), e.getMessage());
                }
            });
        }
        chain.doFilter(req, res);
    }
}
