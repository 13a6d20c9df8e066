package org.stianloader.picolock.logging;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

final class JULLogAdapter extends LoggingAdapter {

    /**
     * Substitutes "{}" placeholders from left to right. Surplus arguments are appended,
     * separated by a space, except for a trailing {@link Throwable} which is returned
     * through {@link LogRecord#setThrown(Throwable)} instead.
     */
    @NotNull
    @Contract(pure = true)
    static String format(@NotNull String message, Object @NotNull... args) {
        int argCount = args.length;
        if (argCount != 0 && args[argCount - 1] instanceof Throwable) {
            argCount--;
        }

        StringBuilder builder = new StringBuilder(message.length() + 16 * argCount);
        int cursor = 0;
        int argIndex = 0;
        while (argIndex < argCount) {
            int placeholder = message.indexOf("{}", cursor);
            if (placeholder == -1) {
                break;
            }
            builder.append(message, cursor, placeholder).append(Objects.toString(args[argIndex++]));
            cursor = placeholder + 2;
        }
        builder.append(message, cursor, message.length());

        while (argIndex < argCount) {
            builder.append(' ').append(Objects.toString(args[argIndex++]));
        }

        return builder.toString();
    }

    @Nullable
    private static Throwable trailingThrowable(Object @NotNull... args) {
        if (args.length != 0 && args[args.length - 1] instanceof Throwable) {
            return (Throwable) args[args.length - 1];
        }
        return null;
    }

    private static void log(@NotNull Class<?> clazz, @NotNull Level level, @NotNull String message, Object @NotNull... args) {
        Logger logger = Logger.getLogger(clazz.getName());
        if (!logger.isLoggable(level)) {
            return;
        }
        LogRecord logRecord = new LogRecord(level, JULLogAdapter.format(message, args));
        logRecord.setLoggerName(logger.getName());
        logRecord.setSourceClassName(clazz.getName());
        logRecord.setThrown(JULLogAdapter.trailingThrowable(args));
        logger.log(logRecord);
    }

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.FINE, message, args);
    }

    @Override
    public void error(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.SEVERE, message, args);
    }

    @Override
    public void info(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.INFO, message, args);
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.WARNING, message, args);
    }
}
