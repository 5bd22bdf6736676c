package com.realtime.connect.poller;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 알림 뱃지 상태. 조회 실패 시 마지막으로 받은 값을 유지한다.
 */
public class PendingBadge implements PendingCountListener {

    private final AtomicLong count = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile boolean stale;

    @Override
    public void onCount(long value) {
        count.set(value);
        stale = false;
    }

    @Override
    public void onFailure(RuntimeException error) {
        failures.incrementAndGet();
        stale = true;
    }

    public long getCount() {
        return count.get();
    }

    public boolean hasPending() {
        return count.get() > 0;
    }

    /** 마지막 조회가 실패했으면 true */
    public boolean isStale() {
        return stale;
    }

    public long getFailures() {
        return failures.get();
    }
}
