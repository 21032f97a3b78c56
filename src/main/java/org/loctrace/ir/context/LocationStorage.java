package org.loctrace.ir.context;

import org.loctrace.ir.location.Location;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * The hash-consing table of one {@link LocationContext}.
 * <p>
 * Every structurally distinct {@link LocationKey} is mapped to exactly one location instance.
 * The check-and-insert step runs inside {@link ConcurrentHashMap#computeIfAbsent}, so concurrent
 * requests for equal content are serialized per key and all callers receive the same instance.
 * Each new instance is assigned the next arena id of the context.
 * <p>
 * The open state is checked again inside the mapping function. {@link LocationContext#close()}
 * switches the state before {@link #release()} clears the tables, and clearing waits for every
 * mapping function still holding its bin, so nothing is added once a context is torn down.
 */
public final class LocationStorage {

    private final LocationContext owner;
    private final Map<LocationKey, Location> uniqued;
    private final Map<Integer, Location> arena;
    private final Map<String, String> strings = new ConcurrentHashMap<>();
    private final AtomicInteger nextId = new AtomicInteger();

    LocationStorage(LocationContext owner, int initialCapacity) {
        this.owner = owner;
        this.uniqued = new ConcurrentHashMap<>(initialCapacity);
        this.arena = new ConcurrentHashMap<>(initialCapacity);
    }

    /**
     * Returns the canonical location for {@code key}, constructing it with {@code factory} if
     * this is the first request for that content.
     *
     * @param key     The structural content of the requested location.
     * @param factory Creates the instance; receives the arena id assigned to it.
     * @param <T>     The location variant identified by {@code key}.
     * @return The canonical instance.
     */
    @SuppressWarnings("unchecked")
    public <T extends Location> T intern(LocationKey key, IntFunction<T> factory) {
        Objects.requireNonNull(key, "key cannot be null.");
        owner.ensureOpen();
        Location existing = uniqued.get(key);
        if (existing == null) {
            existing = uniqued.computeIfAbsent(key, k -> {
                // close() may have run since the check above.
                owner.ensureOpen();
                int id = nextId.getAndIncrement();
                T created = factory.apply(id);
                arena.put(id, created);
                return created;
            });
        }
        return (T) existing;
    }

    /**
     * Returns the context-wide canonical copy of a string used as a filename or name.
     *
     * @param value The string to canonicalize.
     * @return The canonical copy, equal to {@code value}.
     */
    public String internString(String value) {
        owner.ensureOpen();
        return strings.computeIfAbsent(value, v -> {
            owner.ensureOpen();
            return v;
        });
    }

    /**
     * Looks up a location by its arena id.
     *
     * @param id The arena id.
     * @return The location registered under {@code id}, or empty if there is none.
     */
    public Optional<Location> lookup(int id) {
        return Optional.ofNullable(arena.get(id));
    }

    /**
     * @return The number of locations interned so far.
     */
    public int size() {
        return arena.size();
    }

    void release() {
        uniqued.clear();
        arena.clear();
        strings.clear();
    }
}
