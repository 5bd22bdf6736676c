package com.realtime.connect.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "app.locks")
@Data
public class LockProps {
    private Duration pairTimeout = Duration.ofSeconds(5);   // 쌍 단위 락 대기 한도
}
