package com.ryuqq.relay.adapter.protection.retry;

/**
 * 재시도 대기 추상화 (테스트에서 실제 대기 없이 검증하기 위함).
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper threadSleep() {
        return Thread::sleep;
    }
}
