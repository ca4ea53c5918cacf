package com.ryuqq.relay.application.saga;

import com.ryuqq.relay.core.model.SagaId;
import com.ryuqq.relay.core.saga.SagaState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SagaDefinition / SagaResult 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@DisplayName("SagaDefinition 테스트")
class SagaDefinitionTest {

    @Test
    void 단계는_등록한_순서대로_유지() {
        // given & when
        SagaDefinition<List<String>> definition = newBuilder()
            .step("a", data -> data.add("a"), data -> data.remove("a"))
            .step("b", data -> data.add("b"), data -> data.remove("b"))
            .build();

        // then
        assertThat(definition.size()).isEqualTo(2);
        assertThat(definition.getSteps()).extracting(step -> step.name()).containsExactly("a", "b");
        assertThat(definition.indexOf("b")).isEqualTo(1);
        assertThat(definition.indexOf("missing")).isEqualTo(-1);
    }

    @Test
    void 단계_이름이_중복되면_예외() {
        assertThatThrownBy(() -> newBuilder()
            .step("a", data -> { }, data -> { })
            .step("a", data -> { }, data -> { })
            .build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("duplicate step name");
    }

    @Test
    void 단계가_없으면_예외() {
        assertThatThrownBy(() -> newBuilder().build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void SagaResult_상태_판별() {
        // given
        SagaResult<String> result = new SagaResult<>(SagaId.of("saga-1"), SagaState.COMPENSATED, "data",
            List.of(), "b", new IllegalStateException("b failed"), null);

        // then
        assertThat(result.isCompensated()).isTrue();
        assertThat(result.isCompleted()).isFalse();
        assertThat(result.failureCause()).isPresent();
        assertThat(result.isFailed()).isFalse();
        assertThat(result.compensationErrors()).isEmpty();
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static SagaDefinition.Builder<List<String>> newBuilder() {
        return SagaDefinition.builder("test-saga", (Class<List<String>>) (Class) ArrayList.class);
    }
}
