package org.loctrace.ir.location;

import org.loctrace.api.LocationErrorCode;
import org.loctrace.api.LocationException;
import org.loctrace.ir.context.LocationContext;
import org.loctrace.ir.context.LocationKey;
import org.loctrace.typeid.TypeTag;

import java.util.List;
import java.util.Optional;

/**
 * A location that refers to an object outside the IR, e.g. a node of a frontend AST.
 * <p>
 * The referenced object belongs to the caller. It is compared by reference and never inspected,
 * so the same logical value backed by a different object yields a different location. The object
 * is stored together with the {@link TypeTag} of the type it was registered with and can only be
 * read back as exactly that type. Only the fallback location has a textual form.
 */
public final class OpaqueLoc extends Location {

    private record Key(Reference underlying, TypeTag typeTag, Location fallback) implements LocationKey {}

    /**
     * Wraps the caller's object so that keys compare it by identity.
     */
    private static final class Reference {
        private final Object target;

        private Reference(Object target) {
            this.target = target;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Reference other && other.target == target;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(target);
        }
    }

    private final Object underlying;
    private final TypeTag typeTag;
    private final Location fallback;

    private OpaqueLoc(LocationContext context, int id, Key key) {
        super(context, id);
        this.underlying = key.underlying().target;
        this.typeTag = key.typeTag();
        this.fallback = key.fallback();
    }

    /**
     * Returns an opaque location whose fallback is the unknown location.
     */
    public static <T> OpaqueLoc get(LocationContext context, T underlying, Class<T> type) {
        return get(context, underlying, type, context.unknown());
    }

    /**
     * Returns an opaque location, taking the context from {@code fallback}.
     */
    public static <T> OpaqueLoc get(T underlying, Class<T> type, Location fallback) {
        if (fallback == null) {
            throw new LocationException(LocationErrorCode.MISSING_REQUIRED_FIELD,
                    "Required location 'fallback' is missing.");
        }
        return get(fallback.context(), underlying, type, fallback);
    }

    /**
     * Returns an opaque location.
     *
     * @param context    The owning context.
     * @param underlying The referenced object, owned by the caller.
     * @param type       The type the object is registered as; its tag is derived automatically.
     *                   Primitive classes are rejected with {@link LocationErrorCode#TYPE_TAG_MISMATCH}.
     * @param fallback   The location used wherever the object cannot be interpreted.
     * @param <T>        The registered type.
     * @return The canonical location.
     */
    public static <T> OpaqueLoc get(LocationContext context, T underlying, Class<T> type, Location fallback) {
        if (underlying == null) {
            throw new LocationException(LocationErrorCode.MISSING_REQUIRED_FIELD,
                    "An opaque location requires an underlying object.");
        }
        if (type == null) {
            throw new LocationException(LocationErrorCode.MISSING_REQUIRED_FIELD,
                    "An opaque location requires the type of its underlying object.");
        }
        if (type.isPrimitive()) {
            // Objects are always boxed, so a primitive tag could never be read back.
            throw new LocationException(LocationErrorCode.TYPE_TAG_MISMATCH,
                    "Opaque locations cannot be registered as primitive type " + type.getName()
                            + "; use its wrapper class.");
        }
        context.verifyOwned(fallback, "fallback");
        Key key = new Key(new Reference(underlying), TypeTag.of(type), fallback);
        return context.storage().intern(key, id -> new OpaqueLoc(context, id, key));
    }

    /**
     * Returns the underlying object if {@code location} is an opaque location registered with
     * exactly {@code type}.
     *
     * @return The object, or null if the location is not opaque or has another type.
     */
    public static <U> U getUnderlyingLocationOrNull(Location location, Class<U> type) {
        if (location instanceof OpaqueLoc opaque) {
            return opaque.underlying(type).orElse(null);
        }
        return null;
    }

    /**
     * Returns the underlying object of an opaque location whose type is already known.
     *
     * @throws LocationException with {@link LocationErrorCode#TYPE_TAG_MISMATCH} if the location is
     *         not opaque or was registered with another type.
     */
    public static <U> U getUnderlyingLocation(Location location, Class<U> type) {
        if (!(location instanceof OpaqueLoc opaque)) {
            throw new LocationException(LocationErrorCode.TYPE_TAG_MISMATCH,
                    "Expected an opaque location of type " + type.getName() + " but got " + location + ".");
        }
        return opaque.underlying(type).orElseThrow(() -> new LocationException(LocationErrorCode.TYPE_TAG_MISMATCH,
                "Opaque location holds " + opaque.typeTag.typeName() + ", not " + type.getName() + "."));
    }

    /**
     * Reads the underlying object back.
     *
     * @param type The expected type; must be exactly the registered type.
     * @param <U>  The expected type.
     * @return The object, or empty if {@code type} is not the registered type.
     */
    public <U> Optional<U> underlying(Class<U> type) {
        if (!typeTag.isTagOf(type)) {
            return Optional.empty();
        }
        return Optional.of(type.cast(underlying));
    }

    Object underlyingReference() {
        return underlying;
    }

    public TypeTag typeTag() {
        return typeTag;
    }

    public Location fallback() {
        return fallback;
    }

    @Override
    public List<Location> children() {
        return List.of(fallback);
    }

    @Override
    public LocationKind kind() {
        return LocationKind.OPAQUE;
    }
}
