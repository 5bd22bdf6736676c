package com.realtime.connect.poller;

/** 받은 보류 요청 수를 한 번 조회한다. 실패는 RuntimeException으로 */
@FunctionalInterface
public interface PendingCountSource {
    long fetchPendingCount();
}
