package org.stianloader.picolock.logging;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Forwards to the SLF4J logger named after the class that emits the message.
 * SLF4J treats a trailing {@link Throwable} argument as the cause, so it is passed through as-is.
 */
final class SLF4JLogAdapter extends LoggingAdapter {

    private static void log(@NotNull Class<?> clazz, @NotNull Level level, @NotNull String message, Object[] args) {
        Logger logger = LoggerFactory.getLogger(clazz);
        if (!logger.isEnabledForLevel(level)) {
            return;
        }

        switch (level) {
        case ERROR:
            logger.error(message, args);
            break;
        case WARN:
            logger.warn(message, args);
            break;
        case INFO:
            logger.info(message, args);
            break;
        case DEBUG:
            logger.debug(message, args);
            break;
        default:
            logger.trace(message, args);
            break;
        }
    }

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        SLF4JLogAdapter.log(clazz, Level.DEBUG, message, args);
    }

    @Override
    public void error(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        SLF4JLogAdapter.log(clazz, Level.ERROR, message, args);
    }

    @Override
    public void info(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        SLF4JLogAdapter.log(clazz, Level.INFO, message, args);
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        SLF4JLogAdapter.log(clazz, Level.WARN, message, args);
    }
}
