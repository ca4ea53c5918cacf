package com.ryuqq.relay.adapter.runner.pipeline;

import com.ryuqq.relay.core.spi.DeadLetter;
import com.ryuqq.relay.core.spi.DeadLetterSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DeadLetterSink가 설정되지 않았을 때 사용하는 기본 구현.
 *
 * <p>격리된 메시지를 warn 로그로만 남깁니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
final class LoggingDeadLetterSink implements DeadLetterSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingDeadLetterSink.class);

    @Override
    public void deadLetter(DeadLetter deadLetter) {
        log.warn("Dead letter on '{}': {} after {} failures ({})",
            deadLetter.destination(),
            deadLetter.envelope().messageId().getValue(),
            deadLetter.failureCount(),
            deadLetter.reason() == null ? "unknown" : deadLetter.reason().toString());
    }
}
