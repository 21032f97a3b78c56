package org.loctrace.ir.location;

import org.loctrace.ir.context.LocationContext;
import org.loctrace.ir.context.LocationKey;

/**
 * The location of a construct whose provenance is not known. There is exactly one instance
 * per context; it is printed as {@code ?}.
 */
public final class UnknownLoc extends Location {

    private enum Key implements LocationKey {
        INSTANCE
    }

    private UnknownLoc(LocationContext context, int id) {
        super(context, id);
    }

    /**
     * Returns the unknown location of a context.
     *
     * @param context The owning context.
     * @return The per-context singleton.
     */
    public static UnknownLoc get(LocationContext context) {
        return context.storage().intern(Key.INSTANCE, id -> new UnknownLoc(context, id));
    }

    @Override
    public LocationKind kind() {
        return LocationKind.UNKNOWN;
    }
}
