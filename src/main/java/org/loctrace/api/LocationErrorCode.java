package org.loctrace.api;

/**
 * Defines unique, testable error codes for all errors that can occur while building,
 * interning or decoding location values.
 * This decouples the test logic from the message texts.
 */
public enum LocationErrorCode {
    // region Builder Errors
    /** A builder was invoked without a required child, name, filename or frame. */
    MISSING_REQUIRED_FIELD,
    /** A builder was given a child location owned by a different context. */
    CONTEXT_MISMATCH,
    /** A line/column range is malformed (negative value, end before start, ...). */
    INVALID_RANGE,
    // endregion

    // region Opaque Reference Errors
    /** The underlying reference of an opaque location was requested with the wrong type. */
    TYPE_TAG_MISMATCH,
    // endregion

    // region Context Errors
    /** A location was requested from a context that has already been closed. */
    CONTEXT_TORN_DOWN
    // endregion
}
