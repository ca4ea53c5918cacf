/**
 * Poison 메시지 추적 및 격리 결정 SPI.
 *
 * <p>실패 횟수는 (destination, messageId) 쌍으로 집계됩니다. 같은 메시지가 여러
 * destination에서 소비되어도 각 destination의 실패는 독립적으로 계산됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.poison;
