package com.codebox.engine.sandbox;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BoundedOutputCollectorTest {

    @Test
    void underLimit_keepsEverything() {
        AtomicInteger overflows = new AtomicInteger();
        BoundedOutputCollector c = collector("hello\n", 64, overflows);

        c.run();

        assertThat(c.text()).isEqualTo("hello\n");
        assertThat(c.truncated()).isFalse();
        assertThat(overflows).hasValue(0);
    }

    @Test
    void exactlyAtLimit_isNotTruncated() {
        AtomicInteger overflows = new AtomicInteger();
        BoundedOutputCollector c = collector("abcd", 4, overflows);

        c.run();

        assertThat(c.text()).isEqualTo("abcd");
        assertThat(c.truncated()).isFalse();
    }

    @Test
    void overLimit_keepsPrefixAndSignalsOnce() {
        AtomicInteger overflows = new AtomicInteger();
        BoundedOutputCollector c = collector("x".repeat(50_000), 1024, overflows);

        c.run();

        assertThat(c.truncated()).isTrue();
        assertThat(c.text()).hasSize(1024);
        assertThat(overflows).hasValue(1);
    }

    @Test
    void truncation_neverSplitsAMultiByteCharacter() {
        // "é" is two bytes; a 5-byte cut would land inside the third one
        BoundedOutputCollector c = collector("ééééé", 5, new AtomicInteger());

        c.run();

        String text = c.text();
        assertThat(text).isEqualTo("éé");
        assertThat(text.getBytes(StandardCharsets.UTF_8).length).isLessThanOrEqualTo(5);
    }

    @Test
    void utf8Boundary_handlesEachSequenceLength() {
        byte[] euro = "€".getBytes(StandardCharsets.UTF_8);         // 3 bytes
        byte[] emoji = "😀".getBytes(StandardCharsets.UTF_8); // 4 bytes

        assertThat(BoundedOutputCollector.utf8Boundary(euro, 3)).isEqualTo(3);
        assertThat(BoundedOutputCollector.utf8Boundary(euro, 2)).isZero();
        assertThat(BoundedOutputCollector.utf8Boundary(emoji, 4)).isEqualTo(4);
        assertThat(BoundedOutputCollector.utf8Boundary(emoji, 3)).isZero();
        assertThat(BoundedOutputCollector.utf8Boundary("ab".getBytes(StandardCharsets.UTF_8), 2)).isEqualTo(2);
    }

    private static BoundedOutputCollector collector(String content, int limit, AtomicInteger overflows) {
        return new BoundedOutputCollector(
                new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)),
                limit, overflows::incrementAndGet);
    }
}
