package com.realtime.connect.common;

import java.util.Objects;
import java.util.UUID;

/**
 * 순서 없는 사용자 쌍을 (low, high)로 정규화한 키. {A,B}와 {B,A}는 같은 키가 된다.
 */
public record PairKey(UUID low, UUID high) {

    public PairKey {
        Objects.requireNonNull(low, "low");
        Objects.requireNonNull(high, "high");
        if (low.compareTo(high) >= 0) {
            throw new IllegalArgumentException("low must sort before high");
        }
    }

    public static PairKey of(UUID a, UUID b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.equals(b)) throw new IllegalArgumentException("pair members must differ");
        return a.compareTo(b) < 0 ? new PairKey(a, b) : new PairKey(b, a);
    }

    public boolean contains(UUID userId) {
        return low.equals(userId) || high.equals(userId);
    }

    /** userId의 상대편. 쌍에 속하지 않으면 IllegalArgumentException */
    public UUID other(UUID userId) {
        if (low.equals(userId)) return high;
        if (high.equals(userId)) return low;
        throw new IllegalArgumentException("not a member of pair: " + userId);
    }
}
