package org.stianloader.picolock;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picolock.LockFileException.Kind;
import org.stianloader.picolock.internal.LockFileJson;
import org.stianloader.picolock.logging.LoggingAdapter;

import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * The lock file pins the versions of the dependencies of a project. For every requested
 * {@link DependencyId} it stores the resolved version, the tarball it was fetched from and the
 * integrity string of that tarball, allowing later installs to skip resolution altogether and to
 * verify downloaded archives.
 *
 * <p>Typical usage by an install pipeline:
 * <pre>{@code
 * LockFile lockFile = LockFile.loadOrCreate(projectRoot.resolve(LockFile.DEFAULT_FILE_NAME));
 * DependencyId id = new DependencyId("react", "^17.0.0");
 * if (!lockFile.contains(id)) {
 *     byte[] tarball = fetch(...);
 *     String integrity = IntegrityCalculator.calculate(tarball, Algorithm.SHA512);
 *     lockFile.add(id, new DependencyLock("react", "17.0.2", tarballURI, integrity));
 *     lockFile.save();
 * }
 * }</pre>
 *
 * <p>Changes made through {@link #add(DependencyId, DependencyLock)} only affect the in-memory
 * state until {@link #save()} is called. Saving truncates and rewrites the file in place; there is
 * no write-to-temporary-then-rename step, so a crash while saving may leave a partial file behind.
 * No locking happens either: concurrent savers to the same path race and the last writer wins.
 * Callers that install in parallel need to funnel all saves through a single owner.
 */
public final class LockFile {

    public static final String DEFAULT_FILE_NAME = "volt.lock";

    @NotNull
    private final DependenciesMap dependencies;
    @NotNull
    private final Path path;

    /**
     * Creates an empty lock file that will be saved at the given path.
     * The filesystem is not accessed until {@link #save()} is called.
     *
     * @param path The location of the lock file
     */
    public LockFile(@NotNull Path path) {
        // At least one dependency is about to be installed
        this(path, DependenciesMap.withCapacity(1));
    }

    private LockFile(@NotNull Path path, @NotNull DependenciesMap dependencies) {
        this.path = Objects.requireNonNull(path, "path may not be null");
        this.dependencies = dependencies;
    }

    @NotNull
    @Contract(pure = true, value = "null -> fail; !null -> new")
    public static LockFile forProject(@NotNull Path projectRoot) {
        return new LockFile(projectRoot.resolve(LockFile.DEFAULT_FILE_NAME));
    }

    /**
     * Reads the lock file stored at the given path.
     *
     * @param path The location of the lock file
     * @return The loaded lock file, which will be saved to the same path
     * @throws LockFileException With {@link Kind#IO} if the file cannot be opened or read, with
     * {@link Kind#DECODE} if the content is not a valid lock file.
     */
    @NotNull
    public static LockFile load(@NotNull Path path) throws LockFileException {
        InputStream rawIn;
        try {
            rawIn = Files.newInputStream(path);
        } catch (IOException e) {
            throw new LockFileException(Kind.IO, path, "Unable to open lock file " + path.toAbsolutePath(), e);
        }

        DependenciesMap dependencies;
        try (InputStream in = new BufferedInputStream(rawIn)) {
            dependencies = LockFileJson.reader(DependenciesMap.class).readValue(in);
        } catch (JsonProcessingException e) {
            throw new LockFileException(Kind.DECODE, path, "Unable to deserialize lock file " + path.toAbsolutePath(), e);
        } catch (IOException e) {
            throw new LockFileException(Kind.IO, path, "Unable to read lock file " + path.toAbsolutePath(), e);
        }

        if (dependencies == null) {
            throw new LockFileException(Kind.DECODE, path, "Lock file " + path.toAbsolutePath() + " does not contain a JSON object", null);
        }

        LoggingAdapter.getDefaultLogger().debug(LockFile.class, "Loaded {} locked dependencies from {}", dependencies.size(), path);
        return new LockFile(path, dependencies);
    }

    /**
     * Reads the lock file stored at the given path, or creates an empty one if there is no file.
     * A file that exists but cannot be read or decoded is reported instead of being replaced.
     *
     * @param path The location of the lock file
     * @return The loaded or newly created lock file
     * @throws LockFileException If the file exists but {@link #load(Path)} fails
     */
    @NotNull
    public static LockFile loadOrCreate(@NotNull Path path) throws LockFileException {
        if (Files.notExists(path)) {
            LoggingAdapter.getDefaultLogger().debug(LockFile.class, "No lock file at {}, starting with an empty one", path);
            return new LockFile(path);
        }
        return LockFile.load(path);
    }

    /**
     * Inserts or replaces the lock of a dependency. The file on disk is not touched.
     *
     * @param id The requested dependency
     * @param lock The resolved state of the dependency
     * @return The lock that was replaced, or null if there was none
     */
    @Nullable
    @Contract(mutates = "this")
    public DependencyLock add(@NotNull DependencyId id, @NotNull DependencyLock lock) {
        return this.dependencies.put(id, lock);
    }

    @Contract(pure = true)
    public boolean contains(@NotNull DependencyId id) {
        return this.dependencies.containsKey(id);
    }

    @Nullable
    @Contract(pure = true)
    public DependencyLock get(@NotNull DependencyId id) {
        return this.dependencies.get(id);
    }

    /**
     * Obtains a read-only view on the dependencies of this lock file.
     * Iteration order of the view is unspecified; use {@link DependenciesMap#toSortedMap()}
     * for the persisted order.
     *
     * @return The dependencies
     */
    @NotNull
    @Contract(pure = true)
    public Map<@NotNull DependencyId, @NotNull DependencyLock> getDependencies() {
        return this.dependencies.asMap();
    }

    @NotNull
    @Contract(pure = true)
    public Path getPath() {
        return this.path;
    }

    @Contract(pure = true)
    public int size() {
        return this.dependencies.size();
    }

    /**
     * Writes the lock file to {@link #getPath()}, creating or truncating the file.
     * Entries are written sorted by {@link DependencyId}, so equal content always results in
     * identical bytes on disk.
     *
     * @throws LockFileException With {@link Kind#IO} if the file cannot be created or written, with
     * {@link Kind#ENCODE} if serialization fails.
     */
    public void save() throws LockFileException {
        OutputStream rawOut;
        try {
            rawOut = Files.newOutputStream(this.path);
        } catch (IOException e) {
            LoggingAdapter.getDefaultLogger().warn(LockFile.class, "Unable to create lock file {}, {} locked dependencies were not saved", this.path, this.dependencies.size(), e);
            throw new LockFileException(Kind.IO, this.path, "Unable to create lock file " + this.path.toAbsolutePath(), e);
        }

        try (OutputStream out = new BufferedOutputStream(rawOut)) {
            LockFileJson.writer().writeValue(out, this.dependencies);
        } catch (JsonProcessingException e) {
            // The file has already been truncated at this point
            LoggingAdapter.getDefaultLogger().error(LockFile.class, "Unable to serialize lock file {}, the file on disk is likely incomplete", this.path, e);
            throw new LockFileException(Kind.ENCODE, this.path, "Unable to serialize lock file " + this.path.toAbsolutePath(), e);
        } catch (IOException e) {
            LoggingAdapter.getDefaultLogger().warn(LockFile.class, "Unable to write lock file {}, the file on disk is likely incomplete", this.path, e);
            throw new LockFileException(Kind.IO, this.path, "Unable to write lock file " + this.path.toAbsolutePath(), e);
        }

        LoggingAdapter.getDefaultLogger().debug(LockFile.class, "Saved {} locked dependencies to {}", this.dependencies.size(), this.path);
    }
}
