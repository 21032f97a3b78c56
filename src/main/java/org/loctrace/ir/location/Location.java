package org.loctrace.ir.location;

import org.loctrace.backend.LocationPrinter;
import org.loctrace.ir.context.LocationContext;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Root of all location values. A location describes where an IR construct originated.
 * <p>
 * Locations are immutable and canonical: they are only created through the static
 * {@code get} builders of the variants, which intern them in the {@link LocationContext}.
 * Within one context, two locations with equal content are the same object, so
 * identity comparison is the equality of locations and {@code equals} is not overridden.
 * Use {@link LocationEquivalence} to compare locations of different contexts.
 */
public abstract class Location {

    private final LocationContext context;
    private final int id;

    Location(LocationContext context, int id) {
        this.context = context;
        this.id = id;
    }

    /**
     * @return The context owning this location.
     */
    public final LocationContext context() {
        return context;
    }

    /**
     * @return The arena id assigned to this location when it was interned.
     */
    public final int id() {
        return id;
    }

    /**
     * @return The variant of this location.
     */
    public abstract LocationKind kind();

    /**
     * Returns the locations directly referenced by this one, in field order.
     * @return An unmodifiable list of child locations.
     */
    public List<Location> children() {
        return List.of();
    }

    /**
     * Visits this location and every nested location in pre-order.
     * A location reachable over several paths is visited once per path.
     *
     * @param visitor Called for every visited location.
     */
    public final void walk(Consumer<Location> visitor) {
        Deque<Location> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Location current = pending.pop();
            visitor.accept(current);
            List<Location> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }

    /**
     * Returns the first location of the given variant in pre-order, starting with this one.
     *
     * @param type The variant class to look for.
     * @param <T>  The variant type.
     * @return The first match, or empty if there is none.
     */
    public final <T extends Location> Optional<T> findInstanceOf(Class<T> type) {
        Deque<Location> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Location current = pending.pop();
            if (type.isInstance(current)) {
                return Optional.of(type.cast(current));
            }
            List<Location> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * @return The textual form of this location.
     */
    @Override
    public String toString() {
        return LocationPrinter.print(this);
    }
}
