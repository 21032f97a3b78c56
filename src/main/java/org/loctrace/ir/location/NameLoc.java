package org.loctrace.ir.location;

import org.loctrace.api.LocationErrorCode;
import org.loctrace.api.LocationException;
import org.loctrace.ir.context.LocationContext;
import org.loctrace.ir.context.LocationKey;

import java.util.List;

/**
 * A name attached to a nested location, e.g. the variable a transformation introduced.
 */
public final class NameLoc extends Location {

    private record Key(String name, Location child) implements LocationKey {}

    private final String name;
    private final Location child;

    private NameLoc(LocationContext context, int id, Key key) {
        super(context, id);
        this.name = key.name();
        this.child = key.child();
    }

    /**
     * Returns a name location whose child is the unknown location.
     */
    public static NameLoc get(LocationContext context, String name) {
        return get(context, name, context.unknown());
    }

    /**
     * Returns a name location, taking the context from {@code child}.
     */
    public static NameLoc get(String name, Location child) {
        if (child == null) {
            throw new LocationException(LocationErrorCode.MISSING_REQUIRED_FIELD,
                    "Required location 'child' is missing.");
        }
        return get(child.context(), name, child);
    }

    /**
     * Returns a name location.
     *
     * @param context The owning context.
     * @param name    The name, must not be null or empty.
     * @param child   The named location, must be owned by {@code context}.
     * @return The canonical location.
     */
    public static NameLoc get(LocationContext context, String name, Location child) {
        if (name == null || name.isEmpty()) {
            throw new LocationException(LocationErrorCode.MISSING_REQUIRED_FIELD,
                    "A name location requires a non-empty name.");
        }
        context.verifyOwned(child, "child");
        Key key = new Key(context.storage().internString(name), child);
        return context.storage().intern(key, id -> new NameLoc(context, id, key));
    }

    public String name() {
        return name;
    }

    public Location child() {
        return child;
    }

    @Override
    public List<Location> children() {
        return List.of(child);
    }

    @Override
    public LocationKind kind() {
        return LocationKind.NAME;
    }
}
