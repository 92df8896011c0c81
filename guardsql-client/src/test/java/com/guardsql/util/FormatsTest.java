package com.guardsql.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FormatsTest {

    @Test
    void formatsSizesAndDurations() {
        assertEquals("512 B", Formats.size(512));
        assertEquals("1.50 KB", Formats.size(1536));
        assertEquals("1.00 GB", Formats.size(1024L * 1024 * 1024));
        assertEquals("250.00 μs", Formats.duration(Duration.ofNanos(250_000)));
        assertEquals("12.00 ms", Formats.duration(Duration.ofMillis(12)));
        assertEquals("1.50 s", Formats.duration(Duration.ofMillis(1500)));
        assertEquals("2:05", Formats.duration(Duration.ofSeconds(125)));
    }
}
