package com.ryuqq.relay.adapter.runner.saga;

import com.ryuqq.relay.application.saga.SagaDefinition;
import com.ryuqq.relay.application.saga.SagaOrchestrator;
import com.ryuqq.relay.application.saga.SagaResult;
import com.ryuqq.relay.core.exception.RelayException;
import com.ryuqq.relay.core.exception.SagaCompensationFailedException;
import com.ryuqq.relay.core.exception.SagaNotFoundException;
import com.ryuqq.relay.core.exception.SagaStepFailedException;
import com.ryuqq.relay.core.model.SagaId;
import com.ryuqq.relay.core.saga.SagaCheckpoint;
import com.ryuqq.relay.core.saga.SagaState;
import com.ryuqq.relay.core.saga.SagaStateTransition;
import com.ryuqq.relay.core.saga.SagaStep;
import com.ryuqq.relay.core.spi.Codec;
import com.ryuqq.relay.core.spi.SafeTelemetrySink;
import com.ryuqq.relay.core.spi.SagaPersistence;
import com.ryuqq.relay.core.spi.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * SagaOrchestrator 기본 구현.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * execute(sagaId, data)
 *   ↓
 * NOT_STARTED → RUNNING (체크포인트 v1)
 *   ↓
 * For each step (nextStepIndex부터):
 *   1. 취소 확인 (cancelled 신호 또는 abort 요청)
 *   2. step.execute(data)
 *   3. completedSteps에 추가 → 체크포인트 저장
 *   ↓
 * 모두 성공 → COMPLETED
 * 단계 실패/취소 → COMPENSATING → 완료 단계 역순 보상 (보상마다 체크포인트 저장)
 *   → COMPENSATED / ABORTED / FAILED
 * </pre>
 *
 * <p><strong>체크포인트 규칙:</strong></p>
 * <ul>
 *   <li>completedSteps는 아직 보상되지 않은 완료 단계만 담음 (보상 성공 시 제거)</li>
 *   <li>nextStepIndex는 다음에 실행할 단계 (실패/취소 시 해당 단계를 가리킴)</li>
 *   <li>보상 오류는 "단계명: 오류" 요약으로 저장되어 FAILED Saga를 resume해도 결과에 포함됨</li>
 *   <li>저장은 항상 마지막으로 읽거나 쓴 version을 기대값으로 사용 (낙관적 잠금)</li>
 * </ul>
 *
 * <p>같은 SagaId는 이 인스턴스 안에서 한 번에 하나의 실행만 허용됩니다. 인스턴스 간 경합은
 * 저장소의 version 검사로 감지되어 {@link com.ryuqq.relay.core.exception.ConcurrencyConflictException}으로
 * 전파됩니다.</p>
 *
 * @param <D> Saga 데이터 타입
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class DefaultSagaOrchestrator<D> implements SagaOrchestrator<D> {

    private static final Logger log = LoggerFactory.getLogger(DefaultSagaOrchestrator.class);

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final SagaDefinition<D> definition;
    private final SagaPersistence persistence;
    private final Codec codec;
    private final TelemetrySink telemetry;
    private final Clock clock;
    private final Map<String, String> tags;
    private final Map<SagaId, SagaRun<D>> activeRuns = new ConcurrentHashMap<>();

    public DefaultSagaOrchestrator(SagaDefinition<D> definition, SagaPersistence persistence, Codec codec) {
        this(definition, persistence, codec, TelemetrySink.noop(), Clock.systemUTC());
    }

    public DefaultSagaOrchestrator(
        SagaDefinition<D> definition,
        SagaPersistence persistence,
        Codec codec,
        TelemetrySink telemetry
    ) {
        this(definition, persistence, codec, telemetry, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param definition Saga 정의
     * @param persistence 체크포인트 저장소
     * @param codec 데이터 스냅샷 직렬화
     * @param telemetry 지표 sink (null이면 NoOp)
     * @param clock 체크포인트 시각
     * @throws IllegalArgumentException 필수 의존성이 null인 경우
     */
    public DefaultSagaOrchestrator(
        SagaDefinition<D> definition,
        SagaPersistence persistence,
        Codec codec,
        TelemetrySink telemetry,
        Clock clock
    ) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (persistence == null) {
            throw new IllegalArgumentException("persistence cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.definition = definition;
        this.persistence = persistence;
        this.codec = codec;
        this.telemetry = SafeTelemetrySink.wrap(telemetry);
        this.clock = clock;
        this.tags = Map.of("saga_type", definition.getSagaType());
    }

    @Override
    public SagaResult<D> execute(D data) {
        return execute(SagaId.generate(), data);
    }

    @Override
    public SagaResult<D> execute(SagaId sagaId, D data) {
        return execute(sagaId, data, NEVER_CANCELLED);
    }

    @Override
    public SagaResult<D> execute(SagaId sagaId, D data, BooleanSupplier cancelled) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        if (cancelled == null) {
            throw new IllegalArgumentException("cancelled cannot be null");
        }
        if (persistence.loadCheckpoint(sagaId).isPresent()) {
            throw new IllegalStateException("Saga already exists: " + sagaId.getValue());
        }

        SagaRun<D> run = SagaRun.start(sagaId, data, cancelled);
        if (activeRuns.putIfAbsent(sagaId, run) != null) {
            throw new IllegalStateException("Saga is already running: " + sagaId.getValue());
        }
        try {
            telemetry.counter("relay.saga.started", tags);
            log.debug("Starting saga {} ({})", sagaId.getValue(), definition.getSagaType());
            return drive(run);
        } finally {
            activeRuns.remove(sagaId, run);
        }
    }

    @Override
    public SagaResult<D> resume(SagaId sagaId) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        SagaCheckpoint checkpoint = load(sagaId);
        D data = codec.deserialize(checkpoint.dataSnapshot(), definition.getDataType());
        if (checkpoint.state().isTerminal()) {
            return resultOf(SagaRun.restore(checkpoint, data));
        }

        SagaRun<D> run = SagaRun.restore(checkpoint, data);
        if (activeRuns.putIfAbsent(sagaId, run) != null) {
            throw new IllegalStateException("Saga is already running: " + sagaId.getValue());
        }
        try {
            log.info("Resuming saga {} from {} (next step: {}, completed: {})",
                sagaId.getValue(), checkpoint.state(), checkpoint.nextStepIndex(), checkpoint.completedSteps());
            return drive(run);
        } finally {
            activeRuns.remove(sagaId, run);
        }
    }

    @Override
    public boolean abort(SagaId sagaId) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        while (true) {
            SagaRun<D> active = activeRuns.get(sagaId);
            if (active != null) {
                active.abortRequested = true;
                log.info("Abort requested for running saga {}", sagaId.getValue());
                return true;
            }

            SagaCheckpoint checkpoint = load(sagaId);
            if (checkpoint.state().isTerminal()) {
                return false;
            }
            D data = codec.deserialize(checkpoint.dataSnapshot(), definition.getDataType());
            SagaRun<D> run = SagaRun.restore(checkpoint, data);
            run.abortRequested = true;
            if (activeRuns.putIfAbsent(sagaId, run) != null) {
                continue;
            }
            try {
                log.info("Aborting inactive saga {} from {}", sagaId.getValue(), checkpoint.state());
                drive(run);
                return true;
            } finally {
                activeRuns.remove(sagaId, run);
            }
        }
    }

    @Override
    public SagaState getState(SagaId sagaId) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        return load(sagaId).state();
    }

    public SagaDefinition<D> getDefinition() {
        return definition;
    }

    private SagaCheckpoint load(SagaId sagaId) {
        SagaCheckpoint checkpoint = persistence.loadCheckpoint(sagaId)
            .orElseThrow(() -> new SagaNotFoundException(sagaId));
        if (!definition.getSagaType().equals(checkpoint.sagaType())) {
            throw new IllegalStateException("Saga " + sagaId.getValue() + " is of type '" + checkpoint.sagaType()
                + "', not '" + definition.getSagaType() + "'");
        }
        return checkpoint;
    }

    private SagaResult<D> drive(SagaRun<D> run) {
        long startNanos = System.nanoTime();

        if (run.state == SagaState.NOT_STARTED) {
            if (run.isCancelled()) {
                run.failure = new CancellationException("Saga " + run.sagaId.getValue() + " cancelled before start");
                run.failureReason = run.failure.getMessage();
                transition(run, SagaState.ABORTED);
                save(run);
                return finish(run, startNanos);
            }
            transition(run, SagaState.RUNNING);
            save(run);
        }
        if (run.state == SagaState.RUNNING) {
            runForward(run);
        }
        if (run.state == SagaState.COMPENSATING) {
            runCompensation(run, startNanos);
        }
        return finish(run, startNanos);
    }

    private void runForward(SagaRun<D> run) {
        List<SagaStep<D>> steps = definition.getSteps();
        while (run.nextStepIndex < steps.size()) {
            SagaStep<D> step = steps.get(run.nextStepIndex);

            if (run.isCancelled()) {
                log.info("Saga {} cancelled before step '{}'", run.sagaId.getValue(), step.name());
                beginCompensation(run, new CancellationException(
                    "Saga " + run.sagaId.getValue() + " cancelled before step '" + step.name() + "'"
                ));
                return;
            }

            try {
                step.execute(run.data);
            } catch (Exception e) {
                log.warn("Saga {} step '{}' failed: {}", run.sagaId.getValue(), step.name(), e.toString());
                beginCompensation(run, new SagaStepFailedException(run.sagaId, step.name(), run.nextStepIndex, e));
                return;
            }

            run.completedSteps.add(step.name());
            run.nextStepIndex++;
            save(run);
        }
        transition(run, SagaState.COMPLETED);
        save(run);
    }

    private void beginCompensation(SagaRun<D> run, Throwable cause) {
        run.failure = cause;
        run.failureReason = cause.getMessage();
        transition(run, SagaState.COMPENSATING);
        save(run);
    }

    private void runCompensation(SagaRun<D> run, long startNanos) {
        // 이전 시도의 오류는 남은 단계를 다시 보상하면서 대체됨
        run.compensationErrors.clear();
        run.compensationErrorSummaries.clear();
        List<Throwable> errors = run.compensationErrors;
        List<String> pending = new ArrayList<>(run.completedSteps);

        for (int i = pending.size() - 1; i >= 0; i--) {
            String name = pending.get(i);
            int index = definition.indexOf(name);
            if (index < 0) {
                IllegalStateException unknown = new IllegalStateException("Unknown step in checkpoint: " + name);
                errors.add(unknown);
                run.compensationErrorSummaries.add(name + ": " + unknown);
                continue;
            }
            try {
                definition.getSteps().get(index).compensate(run.data);
                run.completedSteps.remove(name);
            } catch (Exception e) {
                log.warn("Saga {} compensation of '{}' failed: {}", run.sagaId.getValue(), name, e.toString());
                errors.add(e);
                run.compensationErrorSummaries.add(name + ": " + e);
            }
            save(run);
        }

        if (!errors.isEmpty()) {
            transition(run, SagaState.FAILED);
            save(run);
            recordOutcome(run, startNanos);
            Throwable trigger = run.failure != null
                ? run.failure
                : new RelayException(String.valueOf(run.failureReason));
            throw new SagaCompensationFailedException(run.sagaId, trigger, errors);
        }
        transition(run, run.abortRequested ? SagaState.ABORTED : SagaState.COMPENSATED);
        save(run);
    }

    private SagaResult<D> finish(SagaRun<D> run, long startNanos) {
        recordOutcome(run, startNanos);
        return resultOf(run);
    }

    private void recordOutcome(SagaRun<D> run, long startNanos) {
        telemetry.counter("relay.saga." + run.state.name().toLowerCase(Locale.ROOT), tags);
        telemetry.histogram("relay.saga.duration", (System.nanoTime() - startNanos) / 1_000_000.0, tags);
        if (run.state == SagaState.COMPLETED) {
            log.info("Saga {} completed ({} steps)", run.sagaId.getValue(), run.completedSteps.size());
        } else if (run.state == SagaState.FAILED) {
            log.warn("Saga {} failed during compensation (uncompensated: {})",
                run.sagaId.getValue(), run.completedSteps);
        } else {
            log.info("Saga {} ended {}: {}", run.sagaId.getValue(), run.state, run.failureReason);
        }
    }

    private SagaResult<D> resultOf(SagaRun<D> run) {
        Throwable failure = run.failure;
        if (failure == null && run.failureReason != null) {
            failure = new RelayException(run.failureReason);
        }
        return new SagaResult<>(run.sagaId, run.state, run.data, run.completedSteps, failedStepOf(run), failure,
            run.compensationErrors);
    }

    private String failedStepOf(SagaRun<D> run) {
        if (run.abortRequested || run.state == SagaState.COMPLETED || run.state == SagaState.RUNNING) {
            return null;
        }
        if (run.failureReason == null || run.nextStepIndex >= definition.size()) {
            return null;
        }
        return definition.getSteps().get(run.nextStepIndex).name();
    }

    private void transition(SagaRun<D> run, SagaState target) {
        run.state = SagaStateTransition.transition(run.state, target);
    }

    private void save(SagaRun<D> run) {
        SagaCheckpoint checkpoint = new SagaCheckpoint(
            run.sagaId,
            definition.getSagaType(),
            run.state,
            run.nextStepIndex,
            run.completedSteps,
            definition.getDataType().getName(),
            codec.serialize(run.data),
            run.failureReason,
            run.compensationErrorSummaries,
            run.abortRequested,
            run.version,
            clock.instant()
        );
        run.version = persistence.saveCheckpoint(checkpoint, run.version);
    }

    /**
     * 한 번의 실행(또는 재개) 동안의 가변 상태.
     */
    private static final class SagaRun<D> {

        private final SagaId sagaId;
        private final D data;
        private final BooleanSupplier cancelled;
        private final List<String> completedSteps;
        private final List<Throwable> compensationErrors = new ArrayList<>();
        private final List<String> compensationErrorSummaries = new ArrayList<>();
        private SagaState state;
        private int nextStepIndex;
        private long version;
        private String failureReason;
        private Throwable failure;
        private volatile boolean abortRequested;

        private SagaRun(
            SagaId sagaId,
            D data,
            BooleanSupplier cancelled,
            SagaState state,
            int nextStepIndex,
            List<String> completedSteps,
            long version
        ) {
            this.sagaId = sagaId;
            this.data = data;
            this.cancelled = cancelled;
            this.state = state;
            this.nextStepIndex = nextStepIndex;
            this.completedSteps = new ArrayList<>(completedSteps);
            this.version = version;
        }

        static <D> SagaRun<D> start(SagaId sagaId, D data, BooleanSupplier cancelled) {
            return new SagaRun<>(sagaId, data, cancelled, SagaState.NOT_STARTED, 0, List.of(), 0L);
        }

        static <D> SagaRun<D> restore(SagaCheckpoint checkpoint, D data) {
            SagaRun<D> run = new SagaRun<>(
                checkpoint.sagaId(),
                data,
                NEVER_CANCELLED,
                checkpoint.state(),
                checkpoint.nextStepIndex(),
                checkpoint.completedSteps(),
                checkpoint.version()
            );
            run.failureReason = checkpoint.failureReason();
            run.abortRequested = checkpoint.abortRequested();
            for (String summary : checkpoint.compensationErrors()) {
                run.compensationErrorSummaries.add(summary);
                run.compensationErrors.add(new RelayException(summary));
            }
            return run;
        }

        boolean isCancelled() {
            if (!abortRequested && cancelled.getAsBoolean()) {
                abortRequested = true;
            }
            return abortRequested;
        }
    }
}
