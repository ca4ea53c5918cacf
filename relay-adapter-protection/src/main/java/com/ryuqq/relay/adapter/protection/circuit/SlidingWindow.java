package com.ryuqq.relay.adapter.protection.circuit;

/**
 * 시간 버킷 기반 롤링 윈도우.
 *
 * <p>samplingWindow를 고정 개수의 버킷으로 나누고, 오래된 버킷은 조회/기록 시점에
 * 비워서 재사용합니다. 외부 동기화가 필요합니다 (DefaultCircuitBreaker의 lock 안에서만 사용).</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
final class SlidingWindow {

    static final int BUCKET_COUNT = 10;

    private final long bucketNanos;
    private final long[] bucketStart = new long[BUCKET_COUNT];
    private final int[] calls = new int[BUCKET_COUNT];
    private final int[] failures = new int[BUCKET_COUNT];
    private final int[] slowCalls = new int[BUCKET_COUNT];
    private final int[] slowSuccesses = new int[BUCKET_COUNT];

    SlidingWindow(long windowNanos) {
        this.bucketNanos = Math.max(1L, windowNanos / BUCKET_COUNT);
        clear();
    }

    void record(long nowNanos, boolean failure, boolean slow) {
        int index = bucketFor(nowNanos);
        calls[index]++;
        if (failure) {
            failures[index]++;
        }
        if (slow) {
            slowCalls[index]++;
            if (!failure) {
                slowSuccesses[index]++;
            }
        }
    }

    Snapshot snapshot(long nowNanos) {
        long oldestAllowed = alignedStart(nowNanos) - bucketNanos * (BUCKET_COUNT - 1);
        int totalCalls = 0;
        int totalFailures = 0;
        int totalSlow = 0;
        int totalSlowSuccesses = 0;
        for (int i = 0; i < BUCKET_COUNT; i++) {
            if (bucketStart[i] != Long.MIN_VALUE && bucketStart[i] >= oldestAllowed) {
                totalCalls += calls[i];
                totalFailures += failures[i];
                totalSlow += slowCalls[i];
                totalSlowSuccesses += slowSuccesses[i];
            }
        }
        return new Snapshot(totalCalls, totalFailures, totalSlow, totalSlowSuccesses);
    }

    void clear() {
        for (int i = 0; i < BUCKET_COUNT; i++) {
            bucketStart[i] = Long.MIN_VALUE;
            calls[i] = 0;
            failures[i] = 0;
            slowCalls[i] = 0;
            slowSuccesses[i] = 0;
        }
    }

    private int bucketFor(long nowNanos) {
        long start = alignedStart(nowNanos);
        int index = (int) Math.floorMod(Math.floorDiv(nowNanos, bucketNanos), (long) BUCKET_COUNT);
        if (bucketStart[index] != start) {
            bucketStart[index] = start;
            calls[index] = 0;
            failures[index] = 0;
            slowCalls[index] = 0;
            slowSuccesses[index] = 0;
        }
        return index;
    }

    private long alignedStart(long nowNanos) {
        return Math.floorDiv(nowNanos, bucketNanos) * bucketNanos;
    }

    /**
     * 윈도우 집계 결과.
     */
    record Snapshot(int calls, int failures, int slowCalls, int slowSuccesses) {

        double failureRate() {
            return calls == 0 ? 0.0 : (double) failures / calls;
        }

        double slowCallRate() {
            return calls == 0 ? 0.0 : (double) slowCalls / calls;
        }

        /**
         * 느린 성공 호출을 실패로 간주한 실패율.
         */
        double failureRateCountingSlow() {
            return calls == 0 ? 0.0 : (double) (failures + slowSuccesses) / calls;
        }
    }
}
