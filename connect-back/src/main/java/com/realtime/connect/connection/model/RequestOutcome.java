package com.realtime.connect.connection.model;

/** request 호출 결과. 반복 클릭은 오류가 아니라 기존 상태를 돌려준다 */
public enum RequestOutcome {
    CREATED,
    ALREADY_REQUESTED,
    ALREADY_CONNECTED,
    // 상대가 먼저 보낸 요청이 있으면 요청 = 수락
    MUTUAL_ACCEPTED
}
