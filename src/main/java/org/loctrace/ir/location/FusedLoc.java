package org.loctrace.ir.location;

import org.loctrace.api.LocationErrorCode;
import org.loctrace.api.LocationException;
import org.loctrace.ir.attr.Attribute;
import org.loctrace.ir.context.LocationContext;
import org.loctrace.ir.context.LocationKey;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Several locations merged into one, e.g. after two operations were combined.
 * <p>
 * The order of the locations is kept as given. The optional metadata takes part in the
 * identity of the location but not in {@link #contains(Location)}.
 */
public final class FusedLoc extends Location {

    private record Key(List<Location> locations, Attribute metadata) implements LocationKey {}

    private final List<Location> locations;
    private final Attribute metadata;

    private FusedLoc(LocationContext context, int id, Key key) {
        super(context, id);
        this.locations = key.locations();
        this.metadata = key.metadata();
    }

    /**
     * Returns a fused location without metadata.
     */
    public static FusedLoc get(LocationContext context, List<? extends Location> locations) {
        return get(context, locations, null);
    }

    /**
     * Returns a fused location with exactly the given locations, in order. Duplicates and
     * an empty list are kept as they are.
     *
     * @param context   The owning context.
     * @param locations The fused locations.
     * @param metadata  Optional metadata, may be null.
     * @return The canonical location.
     */
    public static FusedLoc get(LocationContext context, List<? extends Location> locations, Attribute metadata) {
        if (locations == null) {
            throw new LocationException(LocationErrorCode.MISSING_REQUIRED_FIELD,
                    "A fused location requires a list of locations.");
        }
        for (int i = 0; i < locations.size(); i++) {
            context.verifyOwned(locations.get(i), "locations[" + i + "]");
        }
        Key key = new Key(List.copyOf(locations), metadata);
        return context.storage().intern(key, id -> new FusedLoc(context, id, key));
    }

    /**
     * Fuses locations with simplification. Nested fused locations carrying the same metadata
     * are flattened, unknown locations and repeated locations are dropped (the first occurrence
     * stays). Without metadata, an empty result is the unknown location and a single remaining
     * location is returned as is.
     *
     * @param context   The owning context.
     * @param locations The locations to fuse.
     * @param metadata  Optional metadata, may be null.
     * @return The simplified location.
     */
    public static Location fuse(LocationContext context, List<? extends Location> locations, Attribute metadata) {
        if (locations == null) {
            throw new LocationException(LocationErrorCode.MISSING_REQUIRED_FIELD,
                    "A fused location requires a list of locations.");
        }
        Set<Location> unique = new LinkedHashSet<>();
        for (int i = 0; i < locations.size(); i++) {
            Location location = context.verifyOwned(locations.get(i), "locations[" + i + "]");
            if (location instanceof FusedLoc fused && Objects.equals(fused.metadata, metadata)) {
                for (Location inner : fused.locations) {
                    if (!(inner instanceof UnknownLoc)) {
                        unique.add(inner);
                    }
                }
            } else if (!(location instanceof UnknownLoc)) {
                unique.add(location);
            }
        }
        if (metadata == null) {
            if (unique.isEmpty()) {
                return context.unknown();
            }
            if (unique.size() == 1) {
                return unique.iterator().next();
            }
        }
        return get(context, new ArrayList<>(unique), metadata);
    }

    /**
     * @return The fused locations in their original order.
     */
    public List<Location> locations() {
        return locations;
    }

    /**
     * @return The metadata, or empty if the location has none.
     */
    public Optional<Attribute> metadata() {
        return Optional.ofNullable(metadata);
    }

    /**
     * Checks whether {@code location} is one of the fused locations.
     *
     * @param location The location to look for.
     * @return {@code true} if it is directly contained.
     */
    public boolean contains(Location location) {
        for (Location candidate : locations) {
            if (candidate == location) {
                return true;
            }
        }
        return false;
    }

    @Override
    public List<Location> children() {
        return locations;
    }

    @Override
    public LocationKind kind() {
        return LocationKind.FUSED;
    }
}
