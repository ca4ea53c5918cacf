package com.ryuqq.relay.core.protection;

/**
 * 백프레셔 진입 허가 (scoped).
 *
 * <p>try-with-resources로 사용하여 성공, 실패, 취소 등 모든 종료 경로에서
 * 반드시 해제되도록 합니다. {@link #close()}는 멱등입니다.</p>
 *
 * <pre>{@code
 * try (Permit permit = backpressure.acquire("orders")) {
 *     transport.publishRaw(...);
 * }
 * }</pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface Permit extends AutoCloseable {

    /**
     * 허가 해제. 두 번째 호출부터는 아무 동작도 하지 않습니다.
     */
    @Override
    void close();
}
