package org.iomclient.manager.util;

import java.io.ByteArrayOutputStream;
import java.util.function.Consumer;
import java.util.function.ToIntFunction;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.iomclient.broker.BrokerException;

/**
 * Drains a bounded-read channel. The reader is called with the same buffer
 * size until it hands back an empty chunk; every non-empty chunk is kept in
 * order. Log, listing and file retrieval all go through the same loop.
 */
public final class StreamPump {

    private static final Logger LOG = LogManager.getLogger(StreamPump.class.getName());

    public static final int DEFAULT_BUFFER_SIZE = 2048;

    /**
     * One bounded read against a remote channel.
     *
     * @param <T> chunk type, {@code byte[]} or {@code String}
     */
    @FunctionalInterface
    public interface ChunkReader<T> {
        T read(int maxSize) throws BrokerException;
    }

    private StreamPump() {
    }

    public static byte[] drain(ChunkReader<byte[]> reader, int bufferSize) throws BrokerException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        pump(reader, bufferSize, chunk -> chunk.length, chunk -> out.write(chunk, 0, chunk.length));
        return out.toByteArray();
    }

    public static String drainText(ChunkReader<String> reader, int bufferSize) throws BrokerException {
        StringBuilder out = new StringBuilder();
        pump(reader, bufferSize, String::length, out::append);
        return out.toString();
    }

    private static <T> void pump(ChunkReader<T> reader, int bufferSize, ToIntFunction<T> length, Consumer<T> sink)
            throws BrokerException {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
        }

        int chunks = 0;
        long total = 0;
        T chunk = reader.read(bufferSize);
        while (chunk != null && length.applyAsInt(chunk) > 0) {
            sink.accept(chunk);
            chunks++;
            total += length.applyAsInt(chunk);
            chunk = reader.read(bufferSize);
        }
        LOG.debug("Drained {} chunks, {} units in total", chunks, total);
    }
}
