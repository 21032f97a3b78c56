package org.loctrace.ir.location;

/**
 * The closed set of location shapes.
 */
public enum LocationKind {
    /** No provenance is known. */
    UNKNOWN,
    /** A file position or line/column range. */
    FILE_LINE_COL_RANGE,
    /** A name attached to a nested location. */
    NAME,
    /** One link of a call or inlining chain. */
    CALL_SITE,
    /** Several locations merged into one. */
    FUSED,
    /** A reference to a data structure outside the IR. */
    OPAQUE
}
