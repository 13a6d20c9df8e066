package org.stianloader.picolock;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The outcome of resolving and downloading a single {@link DependencyId}: the concrete version
 * that was picked, the tarball it was downloaded from and the integrity string of the tarball.
 *
 * <p>Instances are immutable. Resolving a dependency again produces a new record which replaces
 * the old one wholesale through {@link LockFile#add(DependencyId, DependencyLock)}.
 *
 * <p>The integrity string is stored under the JSON field {@code sha1} regardless of the
 * algorithm that produced it, as existing lock files expect that name.
 *
 * @param name The name of the package
 * @param version The concrete version that was resolved. Ranges are not permitted.
 * @param tarball The URI the package archive was downloaded from
 * @param integrity The integrity string of the downloaded archive, see {@link org.stianloader.picolock.integrity.IntegrityCalculator}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"name", "version", "tarball", "sha1"})
public record DependencyLock(@NotNull @JsonProperty("name") String name,
        @NotNull @JsonProperty("version") String version,
        @NotNull @JsonProperty("tarball") String tarball,
        @NotNull @JsonProperty("sha1") String integrity) {

    private static final String RANGE_CHARACTERS = "^~<>=*|";

    @JsonCreator
    public DependencyLock(@NotNull @JsonProperty(value = "name", required = true) String name,
            @NotNull @JsonProperty(value = "version", required = true) String version,
            @NotNull @JsonProperty(value = "tarball", required = true) String tarball,
            @NotNull @JsonProperty(value = "sha1", required = true) String integrity) {
        this.name = Objects.requireNonNull(name, "name may not be null");
        this.version = Objects.requireNonNull(version, "version may not be null");
        this.tarball = Objects.requireNonNull(tarball, "tarball may not be null");
        this.integrity = Objects.requireNonNull(integrity, "integrity may not be null");

        if (name.isEmpty()) {
            throw new IllegalArgumentException("The name of a locked dependency may not be empty.");
        }
        if (!DependencyLock.isConcreteVersion(version)) {
            throw new IllegalArgumentException("\"" + version + "\" is not a concrete version (dependency " + name + ")");
        }
    }

    static boolean isConcreteVersion(@NotNull String version) {
        if (version.isEmpty()) {
            return false;
        }
        for (int i = 0; i < version.length(); i++) {
            char c = version.charAt(i);
            if (Character.isWhitespace(c) || DependencyLock.RANGE_CHARACTERS.indexOf(c) != -1) {
                return false;
            }
        }
        return true;
    }
}
