package org.stianloader.picolock;

import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A {@link DependencyId} names a dependency the way it was requested: by package name and
 * by the (possibly ranged) version requirement, for example {@code react@^17.0.0}.
 * It is the key under which a {@link DependencyLock} is stored in a {@link LockFile}.
 *
 * <p>The identity of a {@link DependencyId} is defined solely through its canonical string
 * {@code name@versionSpec} as returned by {@link #toString()}. {@link #equals(Object)},
 * {@link #hashCode()} and the on-disk representation all derive from that one string.
 * {@link #compareTo(DependencyId)} orders by name first and version requirement second.
 *
 * <p>Package names may start with an '@' (scoped packages such as {@code @babel/core}),
 * but may not contain it anywhere else. Decoding therefore splits at the first '@' that is not
 * the leading character, which makes the canonical string unambiguous even for scoped
 * packages. The version requirement is free to contain further '@' characters, which is the case
 * for aliases like {@code npm:other-package@1.0.0}.
 */
public final class DependencyId implements Comparable<DependencyId> {

    public static final char DELIMITER = '@';

    @NotNull
    private final String canonical;
    @NotNull
    private final String name;
    @NotNull
    private final String versionSpec;

    public DependencyId(@NotNull String name, @NotNull String versionSpec) {
        Objects.requireNonNull(name, "name may not be null");
        Objects.requireNonNull(versionSpec, "versionSpec may not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("The name of a dependency may not be empty.");
        }
        if (name.indexOf(DependencyId.DELIMITER, 1) != -1) {
            throw new IllegalArgumentException("The name \"" + name + "\" contains '" + DependencyId.DELIMITER + "' past its first character.");
        }
        this.name = name;
        this.versionSpec = versionSpec;
        this.canonical = DependencyId.canonicalize(name, versionSpec);
    }

    /**
     * The single place where the canonical string form is derived.
     */
    @NotNull
    @Contract(pure = true)
    private static String canonicalize(@NotNull String name, @NotNull String versionSpec) {
        return name + DependencyId.DELIMITER + versionSpec;
    }

    /**
     * Decodes a canonical string as produced by {@link #toString()}.
     *
     * @param canonical The canonical string, for example {@code @types/node@^18.0.0}
     * @return The decoded {@link DependencyId}
     * @throws IllegalArgumentException If the string does not consist of a name and a version requirement
     */
    @NotNull
    @Contract(pure = true, value = "null -> fail")
    public static DependencyId parse(@NotNull String canonical) {
        Objects.requireNonNull(canonical, "canonical may not be null");
        int delimiter = canonical.indexOf(DependencyId.DELIMITER, 1);
        if (delimiter == -1) {
            throw new IllegalArgumentException("Missing dependency version in \"" + canonical + "\"");
        }
        return new DependencyId(canonical.substring(0, delimiter), canonical.substring(delimiter + 1));
    }

    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    @NotNull
    @Contract(pure = true)
    public String getVersionSpec() {
        return this.versionSpec;
    }

    /**
     * Compares the names first and the version requirements second, both code point by code point,
     * which is the same order as comparing their UTF-8 encoded bytes. Comparing the canonical
     * strings directly would sort {@code react-dom@...} before {@code react@...} as '-' precedes '@'.
     *
     * <p>The ordering is consistent with {@link #equals(Object)}, as the delimiter rules make
     * a canonical string correspond to exactly one pair of name and version requirement.
     */
    @Override
    public int compareTo(@NotNull DependencyId other) {
        int result = DependencyId.compareCodePoints(this.name, other.name);
        if (result != 0) {
            return result;
        }
        return DependencyId.compareCodePoints(this.versionSpec, other.versionSpec);
    }

    /**
     * {@link String#compareTo(String)} compares UTF-16 units and would misplace supplementary characters.
     */
    @Contract(pure = true)
    private static int compareCodePoints(@NotNull String a, @NotNull String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int cpA = a.codePointAt(i);
            int cpB = b.codePointAt(j);
            if (cpA != cpB) {
                return Integer.compare(cpA, cpB);
            }
            i += Character.charCount(cpA);
            j += Character.charCount(cpB);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof DependencyId) {
            return ((DependencyId) obj).canonical.equals(this.canonical);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return this.canonical.hashCode();
    }

    @NotNull
    @Override
    @Contract(pure = true)
    public String toString() {
        return this.canonical;
    }
}
