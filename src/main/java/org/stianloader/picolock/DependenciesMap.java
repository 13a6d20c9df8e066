package org.stianloader.picolock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Association of {@link DependencyId dependency ids} to their {@link DependencyLock locks}.
 *
 * <p>Lookups go through an unordered {@link HashMap}. The serialized form however is always
 * sorted by {@link DependencyId#compareTo(DependencyId)}, meaning that two maps with the same
 * content produce byte-identical output no matter in which order the entries were inserted.
 * Deserialization accepts entries in any order.
 *
 * <p>Only the owning {@link LockFile} may mutate a {@link DependenciesMap}, which is why
 * all mutators are package-private.
 */
public final class DependenciesMap {

    @NotNull
    private final Map<@NotNull DependencyId, @NotNull DependencyLock> entries;

    private DependenciesMap(@NotNull HashMap<@NotNull DependencyId, @NotNull DependencyLock> entries) {
        this.entries = entries;
    }

    @NotNull
    @Contract(pure = true, value = "_ -> new")
    static DependenciesMap withCapacity(int initialCapacity) {
        return new DependenciesMap(new HashMap<>(initialCapacity));
    }

    @NotNull
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static DependenciesMap fromJson(@NotNull Map<String, DependencyLock> json) {
        DependenciesMap map = DependenciesMap.withCapacity(json.size());
        for (Map.Entry<String, DependencyLock> entry : json.entrySet()) {
            map.put(DependencyId.parse(entry.getKey()), entry.getValue());
        }
        return map;
    }

    @Nullable
    DependencyLock put(@NotNull DependencyId id, @NotNull DependencyLock lock) {
        return this.entries.put(Objects.requireNonNull(id, "id may not be null"), Objects.requireNonNull(lock, "lock may not be null"));
    }

    @Nullable
    @Contract(pure = true)
    public DependencyLock get(@NotNull DependencyId id) {
        return this.entries.get(id);
    }

    @Contract(pure = true)
    public boolean containsKey(@NotNull DependencyId id) {
        return this.entries.containsKey(id);
    }

    @Contract(pure = true)
    public int size() {
        return this.entries.size();
    }

    @Contract(pure = true)
    public boolean isEmpty() {
        return this.entries.isEmpty();
    }

    /**
     * Obtains an unmodifiable, unordered view of the entries of this map.
     * The view reflects later changes made by the owning {@link LockFile}.
     *
     * @return A read-only view
     */
    @NotNull
    @Contract(pure = true)
    public Map<@NotNull DependencyId, @NotNull DependencyLock> asMap() {
        return Collections.unmodifiableMap(this.entries);
    }

    /**
     * Projects the entries into their persisted order.
     *
     * @return A fresh map keyed by canonical strings, iterating in ascending {@link DependencyId} order
     */
    @NotNull
    @JsonValue
    @Contract(pure = true, value = "-> new")
    public Map<@NotNull String, @NotNull DependencyLock> toSortedMap() {
        List<DependencyId> ids = new ArrayList<>(this.entries.keySet());
        Collections.sort(ids);
        Map<String, DependencyLock> sorted = new LinkedHashMap<>();
        for (DependencyId id : ids) {
            sorted.put(id.toString(), this.entries.get(id));
        }
        return sorted;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof DependenciesMap) {
            return ((DependenciesMap) obj).entries.equals(this.entries);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return this.entries.hashCode();
    }

    @Override
    public String toString() {
        return "DependenciesMap" + this.toSortedMap();
    }
}
