package org.stianloader.picolock.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class JULLogAdapterTest {

    @Test
    public void testPlaceholders() {
        assertEquals("Loaded 3 locked dependencies from volt.lock", JULLogAdapter.format("Loaded {} locked dependencies from {}", 3, "volt.lock"));
        assertEquals("no placeholders", JULLogAdapter.format("no placeholders"));
        assertEquals("null value", JULLogAdapter.format("{} value", (Object) null));
    }

    @Test
    public void testLeftoverPlaceholdersAndArguments() {
        assertEquals("a {}", JULLogAdapter.format("{} {}", "a"));
        assertEquals("a b c", JULLogAdapter.format("{}", "a", "b", "c"));
    }

    @Test
    public void testTrailingThrowableIsNotFormatted() {
        assertEquals("failed for x", JULLogAdapter.format("failed for {}", "x", new IllegalStateException()));
    }

    @Test
    public void testDefaultLogger() {
        LoggingAdapter previous = LoggingAdapter.getDefaultLogger();
        // slf4j-api is on the test classpath
        assertSame(SLF4JLogAdapter.class, previous.getClass());
        try {
            JULLogAdapter jul = new JULLogAdapter();
            LoggingAdapter.setDefaultLogger(jul);
            assertSame(jul, LoggingAdapter.getDefaultLogger());
            jul.debug(JULLogAdapterTest.class, "debug {}", 1);
            jul.warn(JULLogAdapterTest.class, "warn {}", 2, new Exception("expected"));
        } finally {
            LoggingAdapter.setDefaultLogger(previous);
        }
        assertThrows(NullPointerException.class, () -> LoggingAdapter.setDefaultLogger(null));
    }
}
