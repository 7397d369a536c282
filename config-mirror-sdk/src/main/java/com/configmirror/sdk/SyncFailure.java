package com.configmirror.sdk;

/**
 * Represents a failed attempt to synchronize configuration or ID list data with the server.
 * <p>
 * These are never thrown to application code that reads from the client. They are passed to the
 * configured {@link com.configmirror.sdk.subsystems.ErrorReporter}, and the client keeps serving
 * the last data it received.
 */
public class SyncFailure extends ConfigMirrorException {

    /**
     * Enumerated type defining the possible values of {@link SyncFailure#getFailureType()}.
     */
    public enum FailureType {
        /**
         * A response body could not be parsed.
         */
        INVALID_RESPONSE_BODY,

        /**
         * A network request failed before a response was received.
         */
        NETWORK_FAILURE,

        /**
         * This indicates the SyncFailure is an instance of {@link InvalidResponseCodeFailure}.
         */
        UNEXPECTED_RESPONSE_CODE,

        /**
         * The content fetched for an ID list was not in the expected format, so the list was
         * discarded.
         */
        CORRUPT_ID_LIST,

        /**
         * Some other issue occurred.
         */
        UNKNOWN_ERROR
    }

    private final FailureType failureType;

    /**
     * @param message the message
     * @param failureType the failure type
     */
    public SyncFailure(String message, FailureType failureType) {
        super(message);
        this.failureType = failureType;
    }

    /**
     * @param message the message
     * @param cause the cause of the failure
     * @param failureType the failure type
     */
    public SyncFailure(String message, Throwable cause, FailureType failureType) {
        super(message, cause);
        this.failureType = failureType;
    }

    /**
     * @return the failure type
     */
    public FailureType getFailureType() {
        return failureType;
    }
}
