package com.ryuqq.relay.adapter.codec;

import com.ryuqq.relay.core.exception.SerializationException;
import com.ryuqq.relay.core.spi.MessageCompressor;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP payload 압축기.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class GzipMessageCompressor implements MessageCompressor {

    public static final String ALGORITHM = "gzip";

    private static final int BUFFER_SIZE = 8192;

    @Override
    public String algorithm() {
        return ALGORITHM;
    }

    @Override
    public byte[] compress(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out, BUFFER_SIZE)) {
            gzip.write(data);
        } catch (IOException e) {
            throw new SerializationException("Failed to gzip payload", e);
        }
        return out.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(data), BUFFER_SIZE)) {
            return gzip.readAllBytes();
        } catch (IOException e) {
            throw new SerializationException("Failed to gunzip payload (" + data.length + " bytes)", e);
        }
    }
}
