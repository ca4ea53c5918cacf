package com.ryuqq.relay.application.saga;

import com.ryuqq.relay.core.saga.SagaStep;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Saga 정의 (타입 이름, 데이터 타입, 순서 있는 단계 목록).
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SagaDefinition&lt;OrderData&gt; definition = SagaDefinition.builder("place-order", OrderData.class)
 *     .step("reserve-stock", inventory::reserve, inventory::release)
 *     .step("charge-payment", payments::charge, payments::refund)
 *     .step("ship", shipping::ship, shipping::cancel)
 *     .build();
 * </pre>
 *
 * @param <D> Saga 데이터 타입
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class SagaDefinition<D> {

    private final String sagaType;
    private final Class<D> dataType;
    private final List<SagaStep<D>> steps;

    private SagaDefinition(String sagaType, Class<D> dataType, List<SagaStep<D>> steps) {
        this.sagaType = sagaType;
        this.dataType = dataType;
        this.steps = List.copyOf(steps);
    }

    public static <D> Builder<D> builder(String sagaType, Class<D> dataType) {
        return new Builder<>(sagaType, dataType);
    }

    public String getSagaType() {
        return sagaType;
    }

    public Class<D> getDataType() {
        return dataType;
    }

    public List<SagaStep<D>> getSteps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    /**
     * 이름으로 단계 위치 조회.
     *
     * @param name 단계 이름
     * @return 인덱스 (없으면 -1)
     */
    public int indexOf(String name) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "SagaDefinition{sagaType='" + sagaType + "', steps=" + steps.size() + '}';
    }

    /**
     * SagaDefinition 빌더.
     *
     * @param <D> Saga 데이터 타입
     */
    public static final class Builder<D> {

        private final String sagaType;
        private final Class<D> dataType;
        private final List<SagaStep<D>> steps = new ArrayList<>();

        private Builder(String sagaType, Class<D> dataType) {
            if (sagaType == null || sagaType.isBlank()) {
                throw new IllegalArgumentException("sagaType cannot be null or blank");
            }
            if (dataType == null) {
                throw new IllegalArgumentException("dataType cannot be null");
            }
            this.sagaType = sagaType;
            this.dataType = dataType;
        }

        public Builder<D> step(SagaStep<D> step) {
            if (step == null) {
                throw new IllegalArgumentException("step cannot be null");
            }
            steps.add(step);
            return this;
        }

        public Builder<D> step(String name, SagaStep.StepAction<D> execute, SagaStep.StepAction<D> compensate) {
            return step(SagaStep.of(name, execute, compensate));
        }

        /**
         * @throws IllegalArgumentException 단계가 없거나 이름이 중복된 경우
         */
        public SagaDefinition<D> build() {
            if (steps.isEmpty()) {
                throw new IllegalArgumentException("saga must have at least one step");
            }
            Set<String> names = new HashSet<>();
            for (SagaStep<D> step : steps) {
                if (!names.add(step.name())) {
                    throw new IllegalArgumentException("duplicate step name: " + step.name());
                }
            }
            return new SagaDefinition<>(sagaType, dataType, steps);
        }
    }
}
