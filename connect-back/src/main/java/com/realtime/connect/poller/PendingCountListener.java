package com.realtime.connect.poller;

public interface PendingCountListener {

    void onCount(long count);

    /** 일시적 실패. 다음 틱에서 다시 시도한다 */
    default void onFailure(RuntimeException error) {
    }
}
