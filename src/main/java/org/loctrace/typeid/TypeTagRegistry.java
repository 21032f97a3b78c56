package org.loctrace.typeid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A central, process-wide registry mapping Java types to {@link TypeTag} tokens.
 * <p>
 * This class is implemented as a thread-safe singleton. Entries are never removed, so a token
 * handed out once stays valid for the lifetime of the process.
 */
public final class TypeTagRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(TypeTagRegistry.class);
    private static final TypeTagRegistry INSTANCE = new TypeTagRegistry();

    private final Map<Class<?>, TypeTag> tagsByType = new ConcurrentHashMap<>();
    private final AtomicInteger nextId = new AtomicInteger();

    private TypeTagRegistry() {
        // Private constructor to prevent instantiation.
    }

    /**
     * Returns the singleton instance of the registry.
     * @return The singleton instance.
     */
    public static TypeTagRegistry getInstance() {
        return INSTANCE;
    }

    /**
     * Returns the token of the given type. The first call for a type registers it; concurrent
     * first calls all observe the same token.
     *
     * @param type The type to look up.
     * @return The unique token of {@code type}.
     */
    public TypeTag tagFor(Class<?> type) {
        Objects.requireNonNull(type, "type cannot be null.");
        return tagsByType.computeIfAbsent(type, t -> {
            TypeTag tag = new TypeTag(nextId.getAndIncrement(), t);
            LOG.debug("Registered {}", tag);
            return tag;
        });
    }

    /**
     * @return The number of types registered so far.
     */
    public int size() {
        return tagsByType.size();
    }
}
