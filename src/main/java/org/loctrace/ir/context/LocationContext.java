package org.loctrace.ir.context;

import com.typesafe.config.Config;
import org.loctrace.api.LocationErrorCode;
import org.loctrace.api.LocationException;
import org.loctrace.config.LocationContextOptions;
import org.loctrace.ir.location.Location;
import org.loctrace.ir.location.UnknownLoc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The scope that owns all interned locations of one compilation.
 * <p>
 * A context owns exactly one {@link LocationStorage}. Locations from different contexts are
 * never shared, even for identical content, and composite builders reject children owned by
 * another context. Closing the context releases the storage; any further request fails with
 * {@link LocationErrorCode#CONTEXT_TORN_DOWN}.
 * <p>
 * All methods are safe to call from multiple threads.
 */
public final class LocationContext implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(LocationContext.class);
    private static final AtomicLong NEXT_CONTEXT_ID = new AtomicLong();

    private final long id;
    private final LocationContextOptions options;
    private final LocationStorage storage;
    private final AtomicReference<ContextState> state = new AtomicReference<>(ContextState.OPEN);
    private volatile UnknownLoc unknown;

    /**
     * Creates a context with the options from {@code reference.conf}.
     */
    public LocationContext() {
        this(LocationContextOptions.defaults());
    }

    /**
     * Creates a context with explicit options.
     * @param options The context options.
     */
    public LocationContext(LocationContextOptions options) {
        this.id = NEXT_CONTEXT_ID.incrementAndGet();
        this.options = options;
        this.storage = new LocationStorage(this, options.initialCapacity());
        LOG.debug("Created location context #{} with {}", id, options);
    }

    /**
     * Creates a context from a resolved configuration.
     * @param config The configuration, see {@link LocationContextOptions#fromConfig(Config)}.
     * @return A new open context.
     */
    public static LocationContext fromConfig(Config config) {
        return new LocationContext(LocationContextOptions.fromConfig(config));
    }

    /**
     * @return The interning table of this context.
     */
    public LocationStorage storage() {
        return storage;
    }

    /**
     * Returns the unknown location of this context, creating it on first use.
     * @return The per-context singleton unknown location.
     */
    public UnknownLoc unknown() {
        UnknownLoc result = unknown;
        if (result == null) {
            result = UnknownLoc.get(this);
            unknown = result;
        }
        return result;
    }

    /**
     * Checks that a required child location is present and owned by this context.
     *
     * @param location  The child location.
     * @param fieldName The name of the field, for the error message.
     * @return {@code location}.
     * @throws LocationException with {@link LocationErrorCode#MISSING_REQUIRED_FIELD} if the
     *         location is null, or {@link LocationErrorCode#CONTEXT_MISMATCH} if it belongs to
     *         another context.
     */
    public <T extends Location> T verifyOwned(T location, String fieldName) {
        if (location == null) {
            throw new LocationException(LocationErrorCode.MISSING_REQUIRED_FIELD,
                    "Required location '" + fieldName + "' is missing.");
        }
        if (location.context() != this) {
            throw new LocationException(LocationErrorCode.CONTEXT_MISMATCH,
                    "Location '" + fieldName + "' belongs to context #" + location.context().id()
                            + " but was used in context #" + id + ".");
        }
        return location;
    }

    void ensureOpen() {
        if (state.get() == ContextState.TORN_DOWN) {
            throw new LocationException(LocationErrorCode.CONTEXT_TORN_DOWN,
                    "Location context #" + id + " has been closed.");
        }
    }

    /**
     * @return The process-unique id of this context.
     */
    public long id() {
        return id;
    }

    /**
     * @return The current lifecycle state.
     */
    public ContextState state() {
        return state.get();
    }

    /**
     * @return The options this context was created with.
     */
    public LocationContextOptions options() {
        return options;
    }

    /**
     * Tears the context down and releases all interned locations. Calling it again has no effect.
     */
    @Override
    public void close() {
        if (!state.compareAndSet(ContextState.OPEN, ContextState.TORN_DOWN)) {
            return;
        }
        int count = storage.size();
        storage.release();
        unknown = null;
        if (options.logStatisticsOnClose()) {
            LOG.info("Closed location context #{} ({} interned locations released)", id, count);
        } else {
            LOG.debug("Closed location context #{} ({} interned locations released)", id, count);
        }
    }

    @Override
    public String toString() {
        return "LocationContext{#" + id + ", " + state.get() + '}';
    }
}
