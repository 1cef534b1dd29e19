package com.shapeml.debug;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class DebugTest {

    @AfterEach
    void reset() {
        Debug.get().setSink(null);
    }

    @Test
    void silent_sink_is_ready_without_setup() {
        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().w("test", "WARNING: nobody listens"));
        assertDoesNotThrow(() -> Debug.get().e("test", "ERROR: nobody listens", new IllegalStateException()));
    }

    @Test
    void null_sink_falls_back_to_silent() {
        Debug.get().setSink(null);
        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().i("test", "ignored"));
    }

    @Test
    void stream_sink_filters_by_level() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        Debug.get().setSink(Debug.streamSink(new PrintStream(buf, true, StandardCharsets.UTF_8), DebugLevel.WARN));
        Debug.get().d("test", "debug line");
        Debug.get().w("test", "WARNING: kept");
        assertEquals("WARNING: kept" + System.lineSeparator(), buf.toString(StandardCharsets.UTF_8));
    }
}
