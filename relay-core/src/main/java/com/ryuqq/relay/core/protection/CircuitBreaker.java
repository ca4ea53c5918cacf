package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.exception.CircuitOpenException;

import java.util.function.Supplier;

/**
 * Circuit Breaker SPI.
 *
 * <p>하위 호출(트랜스포트 publish, ack/reject 등)의 실패를 추적하고, 임계값 도달 시
 * 빠르게 실패(Fail-Fast)하여 장애가 파이프라인 전체로 전파되는 것을 막습니다.
 * 하나의 인스턴스는 보통 하나의 논리적 destination 또는 호출 범주를 보호합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = ...;
 *
 * // 호출 전체를 감싸는 방식 (권장)
 * String result = cb.execute(() -> externalApi.call());
 *
 * // 호출을 감쌀 수 없는 경우
 * long stamp = cb.tryAcquire();
 * if (stamp == CircuitBreaker.NOT_PERMITTED) {
 *     throw new CircuitOpenException(cb.getName(), cb.getState());
 * }
 * long start = System.nanoTime();
 * try {
 *     externalApi.call();
 *     cb.recordSuccess(stamp, System.nanoTime() - start);
 * } catch (RuntimeException e) {
 *     cb.recordFailure(stamp, System.nanoTime() - start, e);
 *     throw e;
 * }
 * }</pre>
 *
 * <p><strong>구현 요구사항:</strong> 상태 읽기/쓰기는 동시 호출자에 대해 선형화(linearizable)
 * 되어야 합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 허가되지 않은 호출을 나타내는 stamp.
     */
    long NOT_PERMITTED = 0L;

    /**
     * Circuit Breaker 이름 (로깅 및 이벤트용).
     *
     * @return 이름
     */
    String getName();

    /**
     * 호출 통과 허가 획득.
     *
     * <ul>
     *   <li>CLOSED: 항상 허가</li>
     *   <li>OPEN: openTimeout 경과 시 HALF_OPEN으로 전이 후 탐색 허가, 그 전에는 거부 (거부 이벤트 발행)</li>
     *   <li>HALF_OPEN: 진행 중인 탐색 호출이 없을 때만 허가</li>
     * </ul>
     *
     * <p>반환된 stamp는 허가 시점의 상태 세대를 나타냅니다. 허가된 호출자는 같은 stamp로
     * recordSuccess 또는 recordFailure를 반드시 호출해야 하며, 이후 상태가 바뀐 뒤 도착한
     * 결과는 누적 카운터에만 반영되고 상태 전이에는 영향을 주지 않습니다.</p>
     *
     * @return 허가 stamp, 차단 시 {@link #NOT_PERMITTED}
     */
    long tryAcquire();

    /**
     * 호출 성공 기록.
     *
     * @param stamp tryAcquire가 반환한 stamp
     * @param durationNanos 호출 소요 시간 (나노초, 느린 호출 판정에 사용)
     */
    void recordSuccess(long stamp, long durationNanos);

    /**
     * 호출 실패 기록.
     *
     * @param stamp tryAcquire가 반환한 stamp
     * @param durationNanos 호출 소요 시간 (나노초)
     * @param throwable 발생한 예외
     */
    void recordFailure(long stamp, long durationNanos, Throwable throwable);

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 카운터 스냅샷 조회.
     *
     * @return 메트릭 스냅샷
     */
    CircuitBreakerMetrics getMetrics();

    /**
     * CLOSED 상태로 강제 리셋하고 모든 카운터를 초기화.
     */
    void reset();

    /**
     * OPEN 상태로 강제 전이 (수동 차단 스위치).
     *
     * <p>isolate된 Circuit Breaker는 openTimeout이 지나도 HALF_OPEN으로 가지 않으며,
     * {@link #reset()}으로만 해제됩니다.</p>
     */
    void isolate();

    /**
     * 보호 대상 호출 실행.
     *
     * <p>OPEN 상태이면 operation을 호출하지 않고 {@link CircuitOpenException}을 던집니다.
     * 그 외에는 호출 시간을 측정해 성공/실패를 기록하고 원래 결과 또는 예외를 그대로 전달합니다.</p>
     *
     * @param operation 보호 대상 호출
     * @param <T> 결과 타입
     * @return operation 결과
     * @throws CircuitOpenException 호출이 차단된 경우
     */
    default <T> T execute(Supplier<T> operation) {
        long stamp = tryAcquire();
        if (stamp == NOT_PERMITTED) {
            throw new CircuitOpenException(getName(), getState());
        }
        long startNanos = System.nanoTime();
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException | Error e) {
            recordFailure(stamp, System.nanoTime() - startNanos, e);
            throw e;
        }
        recordSuccess(stamp, System.nanoTime() - startNanos);
        return result;
    }

    /**
     * 반환값 없는 보호 대상 호출 실행.
     *
     * @param operation 보호 대상 호출
     * @throws CircuitOpenException 호출이 차단된 경우
     */
    default void run(Runnable operation) {
        execute(() -> {
            operation.run();
            return null;
        });
    }
}
