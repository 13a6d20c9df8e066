package org.stianloader.picolock;

import java.nio.file.Path;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a {@link LockFile} cannot be read from or written to disk.
 * The {@link #getKind() kind} tells apart unreadable files from unparseable ones.
 */
public class LockFileException extends Exception {

    public enum Kind {
        /**
         * The lock file could not be opened, created, read or written.
         */
        IO,
        /**
         * The lock file was read, but its content is not a valid lock file.
         */
        DECODE,
        /**
         * The in-memory state could not be serialized.
         */
        ENCODE;
    }

    private static final long serialVersionUID = 1L;

    @NotNull
    private final Kind kind;
    @NotNull
    private final transient Path path;

    public LockFileException(@NotNull Kind kind, @NotNull Path path, @NotNull String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind may not be null");
        this.path = Objects.requireNonNull(path, "path may not be null");
    }

    @NotNull
    @Contract(pure = true)
    public Kind getKind() {
        return this.kind;
    }

    @NotNull
    @Contract(pure = true)
    public Path getPath() {
        return this.path;
    }
}
