package com.realtime.connect.poller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 세션 하나에 대응하는 보류 요청 수 폴러.
 * 고정 주기 + 화면 이동 시 {@link #pollNow()}. 이전 조회가 진행 중이면 이번 틱은 건너뛴다(쌓지 않음).
 * 실패는 로그만 남기고 다음 틱에서 재시도. {@link #stop()} 이후로는 리스너를 호출하지 않는다.
 */
@Slf4j
public class PendingCountPoller {

    private final PendingCountSource source;
    private final PendingCountListener listener;
    private final TaskScheduler scheduler;
    private final Duration interval;

    private final AtomicBoolean inFlight = new AtomicBoolean();
    private final AtomicLong skippedTicks = new AtomicLong();
    private volatile boolean stopped;
    private volatile ScheduledFuture<?> task;

    public PendingCountPoller(PendingCountSource source, PendingCountListener listener,
                              TaskScheduler scheduler, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.source = source;
        this.listener = listener;
        this.scheduler = scheduler;
        this.interval = interval;
    }

    /** 즉시 한 번 + 이후 interval 마다 */
    public synchronized void start() {
        if (stopped) throw new IllegalStateException("poller already stopped");
        if (task != null) return;
        task = scheduler.scheduleAtFixedRate(this::tick, Instant.now(), interval);
    }

    /** 화면 이동 등으로 당장 갱신이 필요할 때 */
    public void pollNow() {
        if (stopped) return;
        scheduler.schedule(this::tick, Instant.now());
    }

    /** 로그아웃/연결 종료 시 */
    public synchronized void stop() {
        stopped = true;
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }

    public boolean isRunning() {
        return !stopped && task != null;
    }

    public long getSkippedTicks() {
        return skippedTicks.get();
    }

    void tick() {
        if (stopped) return;
        if (!inFlight.compareAndSet(false, true)) {
            skippedTicks.incrementAndGet();
            log.debug("pending count poll still in flight, tick skipped");
            return;
        }
        try {
            long count = source.fetchPendingCount();
            if (!stopped) listener.onCount(count);
        } catch (RuntimeException e) {
            log.warn("pending count poll failed, retry next tick: {}", e.toString());
            if (!stopped) listener.onFailure(e);
        } finally {
            inFlight.set(false);
        }
    }
}
