package org.loctrace.api;

/**
 * Thrown when a location value cannot be constructed or decoded.
 * <p>
 * Every instance carries a {@link LocationErrorCode} so callers and tests can react to the
 * kind of failure without parsing the message.
 */
public class LocationException extends RuntimeException {

    private final LocationErrorCode errorCode;

    /**
     * Constructs a new location exception.
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public LocationException(LocationErrorCode errorCode, String message) {
        super(String.format("[%s] %s", errorCode, message));
        this.errorCode = errorCode;
    }

    /**
     * Returns the error code of this exception.
     * @return The error code.
     */
    public LocationErrorCode getErrorCode() {
        return errorCode;
    }
}
