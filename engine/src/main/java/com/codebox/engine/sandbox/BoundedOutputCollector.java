package com.codebox.engine.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Drains one child output pipe into memory, keeping at most {@code limit}
 * bytes.
 *
 * When the stream would exceed the limit, the collector keeps the bytes that
 * still fit, marks itself truncated, fires the overflow callback and stops
 * reading. The child then blocks on its full pipe until the executor tears it
 * down. {@link #text()} cuts on a UTF-8 character boundary, so the decoded
 * text is never longer than the limit in bytes.
 */
final class BoundedOutputCollector implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BoundedOutputCollector.class);

    private static final int CHUNK = 8192;

    private final InputStream source;
    private final int limit;
    private final Runnable onOverflow;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private volatile boolean truncated;

    BoundedOutputCollector(InputStream source, int limit, Runnable onOverflow) {
        this.source     = source;
        this.limit      = limit;
        this.onOverflow = onOverflow;
    }

    @Override
    public void run() {
        byte[] chunk = new byte[CHUNK];
        try {
            int n;
            while ((n = source.read(chunk)) != -1) {
                int room = limit - size();
                if (n > room) {
                    append(chunk, Math.max(room, 0));
                    truncated = true;
                    onOverflow.run();
                    return;
                }
                append(chunk, n);
            }
        } catch (IOException e) {
            // The pipe is closed under us when the process tree is torn down.
            log.debug("Output pipe closed: {}", e.getMessage());
        }
    }

    boolean truncated() { return truncated; }

    String text() {
        byte[] bytes;
        synchronized (buffer) {
            bytes = buffer.toByteArray();
        }
        int end = truncated ? utf8Boundary(bytes, bytes.length) : bytes.length;
        return new String(bytes, 0, end, StandardCharsets.UTF_8);
    }

    private int size() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    private void append(byte[] chunk, int n) {
        synchronized (buffer) {
            buffer.write(chunk, 0, n);
        }
    }

    /**
     * Largest length {@code <= length} that does not split a multi-byte UTF-8
     * sequence at the end of the array.
     */
    static int utf8Boundary(byte[] bytes, int length) {
        if (length == 0) return 0;
        int i = length - 1;
        // Walk back over continuation bytes (10xxxxxx) to the lead byte.
        while (i > 0 && (bytes[i] & 0xC0) == 0x80 && length - i < 4) {
            i--;
        }
        int lead = bytes[i] & 0xFF;
        int expected;
        if      (lead < 0x80)           expected = 1;
        else if ((lead & 0xE0) == 0xC0) expected = 2;
        else if ((lead & 0xF0) == 0xE0) expected = 3;
        else if ((lead & 0xF8) == 0xF0) expected = 4;
        else                            expected = 1;   // stray byte, let the decoder replace it
        return (length - i < expected) ? i : length;
    }
}
