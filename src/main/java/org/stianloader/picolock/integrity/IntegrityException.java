package org.stianloader.picolock.integrity;

import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when an integrity string cannot be computed or parsed.
 */
public class IntegrityException extends Exception {

    public enum Kind {
        /**
         * Reading the input into the digest failed.
         */
        HASH_COPY,
        /**
         * A string does not follow the {@code <algorithm>-<digest>} grammar.
         */
        HASH_PARSE;
    }

    private static final long serialVersionUID = 1L;

    @NotNull
    private final Kind kind;

    public IntegrityException(@NotNull Kind kind, @NotNull String message) {
        this(kind, message, null);
    }

    public IntegrityException(@NotNull Kind kind, @NotNull String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind may not be null");
    }

    @NotNull
    @Contract(pure = true)
    public Kind getKind() {
        return this.kind;
    }
}
