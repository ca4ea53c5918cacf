package com.ryuqq.relay.core.saga;

/**
 * Saga를 구성하는 단일 단계.
 *
 * <p><strong>멱등성 계약:</strong></p>
 * <ul>
 *   <li>{@link #execute(Object)}는 두 번 적용해도 안전해야 합니다.
 *       크래시 후 {@code resume}은 부분적으로 실행되었던 단계를 다시 실행할 수 있습니다.
 *       (예: data에 담긴 멱등성 키로 외부 호출 중복 제거)</li>
 *   <li>{@link #compensate(Object)}도 같은 이유로 멱등이어야 합니다.
 *       보상 직후 체크포인트 저장 전에 크래시가 나면 재개 시 다시 호출됩니다.</li>
 * </ul>
 *
 * <p>단계는 data를 변경할 수 있으며, 변경된 data는 단계가 성공한 직후
 * 체크포인트에 스냅샷으로 저장됩니다.</p>
 *
 * @param <D> Saga 데이터 타입
 * @author Relay Team
 * @since 1.0.0
 */
public interface SagaStep<D> {

    /**
     * 단계 이름 (Saga 내에서 고유).
     *
     * @return 이름
     */
    String name();

    /**
     * 정방향 작업 실행 (멱등).
     *
     * @param data Saga 데이터
     * @throws Exception 실패 시 (보상이 시작됨)
     */
    void execute(D data) throws Exception;

    /**
     * 보상 작업 실행 (멱등).
     *
     * @param data Saga 데이터
     * @throws Exception 보상 실패 시 (나머지 보상은 계속 진행됨)
     */
    void compensate(D data) throws Exception;

    /**
     * 람다로 단계 생성.
     *
     * @param name 단계 이름
     * @param execute 정방향 작업
     * @param compensate 보상 작업
     * @param <D> 데이터 타입
     * @return SagaStep
     */
    static <D> SagaStep<D> of(String name, StepAction<D> execute, StepAction<D> compensate) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (execute == null) {
            throw new IllegalArgumentException("execute cannot be null");
        }
        if (compensate == null) {
            throw new IllegalArgumentException("compensate cannot be null");
        }
        return new SagaStep<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void execute(D data) throws Exception {
                execute.apply(data);
            }

            @Override
            public void compensate(D data) throws Exception {
                compensate.apply(data);
            }

            @Override
            public String toString() {
                return "SagaStep{" + name + '}';
            }
        };
    }

    /**
     * 단계 작업 함수.
     *
     * @param <D> 데이터 타입
     */
    @FunctionalInterface
    interface StepAction<D> {
        void apply(D data) throws Exception;
    }
}
