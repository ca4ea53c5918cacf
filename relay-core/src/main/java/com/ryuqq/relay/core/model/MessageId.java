package com.ryuqq.relay.core.model;

import java.util.UUID;

/**
 * 메시지의 전역 고유 식별자.
 *
 * <p>MessageId는 Envelope 헤더에 기록되어 발행부터 소비, Poison 추적, Dead-letter까지
 * 동일 메시지를 식별하는 데 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.), 콜론(:)만 허용</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class MessageId {

    private final String value;

    private MessageId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("MessageId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("MessageId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.:]+$")) {
            throw new IllegalArgumentException("MessageId contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * MessageId 생성.
     *
     * @param value MessageId 값
     * @return MessageId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static MessageId of(String value) {
        return new MessageId(value);
    }

    /**
     * UUID 기반 MessageId 생성.
     *
     * @return 새 MessageId
     */
    public static MessageId generate() {
        return new MessageId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageId that = (MessageId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "MessageId{" + value + '}';
    }
}
