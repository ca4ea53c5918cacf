package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.MessageId;

/**
 * 반복 실패로 격리된 메시지.
 *
 * <p>파이프라인 실패로 호출자에게 전파되지 않으며, Dead-letter 항목의
 * 사유로만 기록됩니다. cause는 마지막 핸들러 오류입니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class PoisonMessageQuarantinedException extends RelayException {

    private final String destination;
    private final MessageId messageId;
    private final int failureCount;

    public PoisonMessageQuarantinedException(String destination, MessageId messageId, int failureCount, Throwable lastError) {
        super("Message " + messageId.getValue() + " on '" + destination + "' quarantined after "
            + failureCount + " failures", lastError);
        this.destination = destination;
        this.messageId = messageId;
        this.failureCount = failureCount;
    }

    public String getDestination() {
        return destination;
    }

    public MessageId getMessageId() {
        return messageId;
    }

    public int getFailureCount() {
        return failureCount;
    }
}
