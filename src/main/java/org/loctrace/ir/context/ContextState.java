package org.loctrace.ir.context;

/**
 * Lifecycle state of a {@link LocationContext}. The only transition is
 * {@link #OPEN} to {@link #TORN_DOWN}, and it happens once.
 */
public enum ContextState {
    /** The context accepts new locations. */
    OPEN,
    /** The context was closed; its storage has been released. */
    TORN_DOWN
}
