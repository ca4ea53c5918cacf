package com.ryuqq.relay.core.contract;

import com.ryuqq.relay.core.model.MessageId;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 트랜스포트와 주고받는 직렬화된 메시지 봉투 (Envelope).
 *
 * <p>Envelope은 직렬화된 payload에 타입 태그와 헤더 메타데이터를 결합한
 * 불변 값입니다. 트랜스포트에 전달된 이후 헤더는 절대 변경되지 않습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>messageId:</strong> 메시지 고유 식별자</li>
 *   <li><strong>typeTag:</strong> 역직렬화 대상 타입 태그</li>
 *   <li><strong>payload:</strong> 직렬화 (및 선택적 압축) 된 바이트</li>
 *   <li><strong>headers:</strong> correlation id, routing key, timestamp 등</li>
 * </ul>
 *
 * <p>payload 배열과 헤더 맵은 생성 시 방어적으로 복사되며,
 * {@link #payload()}는 매 호출마다 복사본을 반환합니다.</p>
 *
 * @param messageId 메시지 식별자
 * @param typeTag 타입 태그
 * @param payload 직렬화된 payload
 * @param headers 헤더 (읽기 전용)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Envelope(
    MessageId messageId,
    String typeTag,
    byte[] payload,
    Map<String, String> headers
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 typeTag가 비어있는 경우
     */
    public Envelope {
        if (messageId == null) {
            throw new IllegalArgumentException("messageId cannot be null");
        }
        if (typeTag == null || typeTag.isBlank()) {
            throw new IllegalArgumentException("typeTag cannot be null or blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (headers == null) {
            throw new IllegalArgumentException("headers cannot be null");
        }
        payload = payload.clone();
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * 헤더 값 조회.
     *
     * @param name 헤더 이름
     * @return 헤더 값 (없으면 null)
     */
    public String header(String name) {
        return headers.get(name);
    }

    /**
     * payload 크기 (바이트).
     *
     * @return payload 길이
     */
    public int size() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Envelope)) return false;
        Envelope other = (Envelope) o;
        return messageId.equals(other.messageId)
            && typeTag.equals(other.typeTag)
            && Arrays.equals(payload, other.payload)
            && headers.equals(other.headers);
    }

    @Override
    public int hashCode() {
        int result = messageId.hashCode();
        result = 31 * result + typeTag.hashCode();
        result = 31 * result + Arrays.hashCode(payload);
        result = 31 * result + headers.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "Envelope{" + messageId + ", type=" + typeTag + ", " + payload.length + " bytes}";
    }
}
