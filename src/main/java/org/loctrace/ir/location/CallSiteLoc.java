package org.loctrace.ir.location;

import org.loctrace.api.LocationErrorCode;
import org.loctrace.api.LocationException;
import org.loctrace.ir.context.LocationContext;
import org.loctrace.ir.context.LocationKey;

import java.util.List;

/**
 * One link of a call chain: the location of the callee together with the location of the
 * call that reached it. Longer chains nest in the caller position, so a chain of N frames is
 * represented by N-1 call site locations.
 */
public final class CallSiteLoc extends Location {

    private record Key(Location callee, Location caller) implements LocationKey {}

    private final Location callee;
    private final Location caller;

    private CallSiteLoc(LocationContext context, int id, Key key) {
        super(context, id);
        this.callee = key.callee();
        this.caller = key.caller();
    }

    /**
     * Returns a call site location, taking the context from {@code callee}.
     */
    public static CallSiteLoc get(Location callee, Location caller) {
        if (callee == null) {
            throw new LocationException(LocationErrorCode.MISSING_REQUIRED_FIELD,
                    "Required location 'callee' is missing.");
        }
        return get(callee.context(), callee, caller);
    }

    /**
     * Returns a call site location.
     *
     * @param context The owning context.
     * @param callee  The location inside the called code.
     * @param caller  The location of the call.
     * @return The canonical location.
     */
    public static CallSiteLoc get(LocationContext context, Location callee, Location caller) {
        context.verifyOwned(callee, "callee");
        context.verifyOwned(caller, "caller");
        Key key = new Key(callee, caller);
        return context.storage().intern(key, id -> new CallSiteLoc(context, id, key));
    }

    /**
     * Builds a call chain from a flat list of frames.
     * <p>
     * The first frame is the innermost callee and every following frame is the caller of the
     * frame before it; the last frame is the outermost caller. The two last frames are combined
     * first, then the chain grows towards the front, so {@code [A, B, C]} yields
     * {@code callsite(A at callsite(B at C))}. A single frame is returned unchanged.
     *
     * @param context The owning context.
     * @param frames  The frames, innermost callee first.
     * @return The nested chain, or the only frame.
     * @throws LocationException with {@link LocationErrorCode#MISSING_REQUIRED_FIELD} if there
     *         are no frames.
     */
    public static Location fromFrames(LocationContext context, List<? extends Location> frames) {
        if (frames == null || frames.isEmpty()) {
            throw new LocationException(LocationErrorCode.MISSING_REQUIRED_FIELD,
                    "A call chain requires at least one frame.");
        }
        Location chain = context.verifyOwned(frames.get(frames.size() - 1), "frames[" + (frames.size() - 1) + "]");
        for (int i = frames.size() - 2; i >= 0; i--) {
            Location frame = context.verifyOwned(frames.get(i), "frames[" + i + "]");
            chain = get(context, frame, chain);
        }
        return chain;
    }

    public Location callee() {
        return callee;
    }

    public Location caller() {
        return caller;
    }

    @Override
    public List<Location> children() {
        return List.of(callee, caller);
    }

    @Override
    public LocationKind kind() {
        return LocationKind.CALL_SITE;
    }
}
