package com.ryuqq.relay.core.saga;

/**
 * Saga 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>NOT_STARTED → RUNNING, ABORTED</li>
 *   <li>RUNNING → COMPLETED, COMPENSATING</li>
 *   <li>COMPENSATING → COMPENSATED, FAILED, ABORTED</li>
 * </ul>
 *
 * <p>종료 상태에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class SagaStateTransition {

    private SagaStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SagaState from, SagaState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid;
        switch (from) {
            case NOT_STARTED:
                valid = to == SagaState.RUNNING || to == SagaState.ABORTED;
                break;
            case RUNNING:
                valid = to == SagaState.COMPLETED || to == SagaState.COMPENSATING;
                break;
            case COMPENSATING:
                valid = to == SagaState.COMPENSATED || to == SagaState.FAILED || to == SagaState.ABORTED;
                break;
            default:
                valid = false;
        }

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid saga state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static SagaState transition(SagaState current, SagaState next) {
        validate(current, next);
        return next;
    }
}
