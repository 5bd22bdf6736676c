package com.realtime.connect.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "app.poller")
@Data
public class PollerProps {
    private Duration interval = Duration.ofSeconds(30);  // 뱃지 갱신 주기
    private Duration timeout = Duration.ofSeconds(10);   // 한 번의 조회 타임아웃
    private int poolSize = 2;
}
