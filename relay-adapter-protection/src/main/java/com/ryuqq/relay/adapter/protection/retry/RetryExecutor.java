package com.ryuqq.relay.adapter.protection.retry;

import com.ryuqq.relay.core.exception.RelayException;
import com.ryuqq.relay.core.retry.RetryPolicy;
import com.ryuqq.relay.core.retry.TransientErrorDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 일시적 오류에 대한 재시도 실행기.
 *
 * <p><strong>동작:</strong></p>
 * <ol>
 *   <li>operation 실행, 성공 시 결과 반환</li>
 *   <li>실패 시 {@link TransientErrorDetector}로 일시적 오류 여부 판별</li>
 *   <li>일시적 오류이고 시도 횟수가 maxAttempts 미만이면 {@link BackoffCalculator} 지연 후 재시도</li>
 *   <li>그 외에는 원래 예외를 그대로 전파</li>
 * </ol>
 *
 * <p>재시도 대기 중 인터럽트되면 인터럽트 플래그를 복원하고 마지막 오류를 cause로 하는
 * {@link RelayException}을 던집니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final TransientErrorDetector detector;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, TransientErrorDetector.defaultDetector());
    }

    public RetryExecutor(RetryPolicy policy, TransientErrorDetector detector) {
        this(policy, detector, new BackoffCalculator(policy), Sleeper.threadSleep());
    }

    public RetryExecutor(
        RetryPolicy policy,
        TransientErrorDetector detector,
        BackoffCalculator backoffCalculator,
        Sleeper sleeper
    ) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (detector == null) {
            throw new IllegalArgumentException("detector cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.policy = policy;
        this.detector = detector;
        this.backoffCalculator = backoffCalculator;
        this.sleeper = sleeper;
    }

    /**
     * 재시도 정책에 따라 operation 실행.
     *
     * @param operation 실행할 작업
     * @param <T> 결과 타입
     * @return operation 결과
     */
    public <T> T execute(Supplier<T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }

        int attempt = 1;
        while (true) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (!detector.isTransient(e)) {
                    throw e;
                }
                if (attempt >= policy.maxAttempts()) {
                    log.warn("Retry exhausted after {} attempts: {}", attempt, e.toString());
                    throw e;
                }

                long delayMs = backoffCalculator.calculate(attempt);
                log.debug("Transient failure on attempt {}/{}, retrying in {}ms: {}",
                    attempt, policy.maxAttempts(), delayMs, e.toString());
                pause(delayMs, e);
                attempt++;
            }
        }
    }

    /**
     * 반환값 없는 작업 실행.
     *
     * @param operation 실행할 작업
     */
    public void run(Runnable operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        execute(() -> {
            operation.run();
            return null;
        });
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private void pause(long delayMs, RuntimeException lastError) {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            RelayException interrupted = new RelayException("Retry interrupted", lastError);
            interrupted.addSuppressed(ie);
            throw interrupted;
        }
    }
}
