package com.realtime.connect.poller;

import com.realtime.connect.config.PollerProps;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * 세션마다 폴러를 열어 준다. 반환된 폴러는 세션 종료 시 호출측이 stop() 해야 한다.
 */
@Component
public class PendingCountPollers {

    private final TaskScheduler scheduler;
    private final PollerProps props;

    public PendingCountPollers(@Qualifier("pollerScheduler") TaskScheduler scheduler, PollerProps props) {
        this.scheduler = scheduler;
        this.props = props;
    }

    public PendingCountPoller open(String baseUrl, String accessToken, PendingCountListener listener) {
        return open(new RestPendingCountClient(baseUrl, accessToken, props.getTimeout()), listener);
    }

    public PendingCountPoller open(PendingCountSource source, PendingCountListener listener) {
        PendingCountPoller poller = new PendingCountPoller(source, listener, scheduler, props.getInterval());
        poller.start();
        return poller;
    }
}
