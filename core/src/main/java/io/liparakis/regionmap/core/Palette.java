package io.liparakis.regionmap.core;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A mapping from compact integer ids to entries, as read from a section.
 * <p>
 * Block palettes assign ids positionally ({@link #append}); fluid palettes
 * store the id of each entry explicitly ({@link #put}). Both kinds are looked
 * up the same way by the packed index arrays.
 * </p>
 * <p>
 * Not thread-safe while being filled. Decoders hand out fully built palettes
 * which are not modified afterwards.
 * </p>
 *
 * @param <T> the type of palette entries
 */
public final class Palette<T> {
    private static final int INITIAL_CAPACITY = 16;

    /** Id to entry. */
    private final Int2ObjectMap<T> idToEntry = new Int2ObjectOpenHashMap<>(INITIAL_CAPACITY);

    /** Entries in stream order. */
    private final List<T> ordered = new ArrayList<>(INITIAL_CAPACITY);

    /**
     * Adds an entry under the next positional id (the current size).
     *
     * @return the id assigned
     */
    public int append(T entry) {
        int id = ordered.size();
        put(id, entry);
        return id;
    }

    /**
     * Adds an entry under an explicit id. A later entry with the same id
     * replaces the earlier one for lookups.
     *
     * @throws IllegalArgumentException if entry is null
     */
    public void put(int id, T entry) {
        if (entry == null) {
            throw new IllegalArgumentException("Cannot add null to Palette");
        }
        idToEntry.put(id, entry);
        ordered.add(entry);
    }

    /**
     * @return the entry for {@code id}, or {@code null} if the id is not present
     */
    public T get(int id) {
        return idToEntry.get(id);
    }

    public boolean contains(int id) {
        return idToEntry.containsKey(id);
    }

    /**
     * @return the number of entries read, including duplicates
     */
    public int size() {
        return ordered.size();
    }

    /**
     * @return entries in the order they were read
     */
    public List<T> entries() {
        return Collections.unmodifiableList(ordered);
    }
}
