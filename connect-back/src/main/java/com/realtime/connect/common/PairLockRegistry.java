package com.realtime.connect.common;

import com.realtime.connect.config.LockProps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * canonical pair 단위 상호배제. 서로 다른 쌍은 절대 같은 락을 공유하지 않으며,
 * 사용 중인 쌍만 맵에 남는다(참조 카운트 0이 되면 제거).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PairLockRegistry {

    private final LockProps props;
    private final ConcurrentHashMap<PairKey, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(PairKey pair, Supplier<T> action) {
        Entry entry = locks.compute(pair, (k, v) -> {
            Entry e = (v == null) ? new Entry() : v;
            e.refs++;
            return e;
        });
        try {
            acquire(pair, entry.lock);
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(pair, (k, v) -> --v.refs == 0 ? null : v);
        }
    }

    /** 현재 맵에 남아있는 쌍 수 */
    int activePairs() {
        return locks.size();
    }

    private void acquire(PairKey pair, ReentrantLock lock) {
        long waitMs = props.getPairTimeout().toMillis();
        boolean acquired;
        try {
            acquired = lock.tryLock(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectException(ErrorCode.TRANSIENT, "요청이 중단되었습니다. 다시 시도해 주세요.", e);
        }
        if (!acquired) {
            log.warn("pair lock timeout: pair={} waitMs={}", pair, waitMs);
            throw new ConnectException(ErrorCode.TRANSIENT, "요청이 많습니다. 잠시 후 다시 시도해 주세요.");
        }
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int refs;   // compute 안에서만 변경
    }
}
