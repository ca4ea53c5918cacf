/**
 * 재시도 실행 패키지.
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.protection.retry;
