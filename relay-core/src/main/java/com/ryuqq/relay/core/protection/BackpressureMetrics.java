package com.ryuqq.relay.core.protection;

/**
 * 백프레셔 윈도우 스냅샷.
 *
 * @param inFlight 현재 진행 중인 작업 수
 * @param maxInflight 설정된 최대값
 * @param waiting 현재 대기 중인 호출자 수
 * @param accepted 누적 허가 수
 * @param rejected 누적 거부 수
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record BackpressureMetrics(
    int inFlight,
    int maxInflight,
    int waiting,
    long accepted,
    long rejected
) {
}
