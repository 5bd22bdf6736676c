package com.realtime.connect.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.discover")
@Data
public class DiscoverProps {
    private int limit = 20;     // 한 번에 보여줄 후보 수
}
