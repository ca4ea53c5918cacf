package com.ryuqq.relay.core.retry;

import com.ryuqq.relay.core.exception.CircuitOpenException;
import com.ryuqq.relay.core.exception.TransientTransportException;

/**
 * 일시적 오류 판별기.
 *
 * <p>RetryExecutor는 이 판별기가 true를 반환한 오류만 재시도합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransientErrorDetector {

    /**
     * 오류가 재시도 가능한 일시적 오류인지 판별.
     *
     * @param error 발생한 오류
     * @return 재시도 가능하면 true
     */
    boolean isTransient(Throwable error);

    /**
     * 기본 판별기.
     *
     * <p>cause 체인 어딘가에 {@link TransientTransportException}이 있으면 일시적 오류로 봅니다.
     * {@link CircuitOpenException}은 항상 일시적 오류가 아닙니다.</p>
     *
     * @return 기본 판별기
     */
    static TransientErrorDetector defaultDetector() {
        return error -> {
            if (error instanceof CircuitOpenException) {
                return false;
            }
            Throwable current = error;
            int depth = 0;
            while (current != null && depth++ < 32) {
                if (current instanceof TransientTransportException) {
                    return true;
                }
                current = current.getCause();
            }
            return false;
        };
    }
}
