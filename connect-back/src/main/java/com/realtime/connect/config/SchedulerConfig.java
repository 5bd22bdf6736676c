package com.realtime.connect.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

    /** 세션별 뱃지 폴러가 공유하는 타이머 */
    @Bean(name = "pollerScheduler")
    public ThreadPoolTaskScheduler pollerScheduler(PollerProps props) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setThreadNamePrefix("poller-");
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
