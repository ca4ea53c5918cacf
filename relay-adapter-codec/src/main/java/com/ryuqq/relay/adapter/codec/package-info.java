/**
 * Codec 어댑터 패키지.
 *
 * <p>Jackson JSON 직렬화({@link com.ryuqq.relay.adapter.codec.JacksonCodec})와
 * GZIP 압축({@link com.ryuqq.relay.adapter.codec.GzipMessageCompressor})을 제공합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.codec;
