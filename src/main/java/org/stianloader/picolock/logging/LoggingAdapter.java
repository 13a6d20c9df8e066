package org.stianloader.picolock.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Logging facade used throughout picolock.
 *
 * <p>picolock is meant to be embedded into package managers which may or may not ship
 * SLF4J. The default instance therefore writes to SLF4J if {@code org.slf4j.LoggerFactory}
 * can be loaded and falls back to {@link java.util.logging.Logger JUL} otherwise.
 * Callers that route their logs elsewhere can install their own adapter through
 * {@link #setDefaultLogger(LoggingAdapter)}.
 *
 * <p>Messages use SLF4J-style "{}" placeholders. Arguments without a matching
 * placeholder are appended to the message. A trailing {@link Throwable} argument
 * should have its stacktrace logged.
 */
public abstract class LoggingAdapter {

    @NotNull
    private static volatile LoggingAdapter defaultLogger;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        LoggingAdapter.defaultLogger = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.defaultLogger;
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.defaultLogger = Objects.requireNonNull(instance, "instance may not be null");
    }

    public abstract void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args);

    public abstract void error(@NotNull Class<?> clazz, @NotNull String message, Object... args);

    public abstract void info(@NotNull Class<?> clazz, @NotNull String message, Object... args);

    public abstract void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args);
}
