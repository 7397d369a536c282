package com.configmirror.sdk;

/**
 * A {@link SyncFailure} in which the server answered with an unexpected HTTP status.
 */
public class InvalidResponseCodeFailure extends SyncFailure {

    private final int responseCode;

    private final boolean retryable;

    /**
     * @param message the message
     * @param responseCode the response code
     * @param retryable whether or not retrying may resolve the issue
     */
    public InvalidResponseCodeFailure(String message, int responseCode, boolean retryable) {
        super(message, FailureType.UNEXPECTED_RESPONSE_CODE);
        this.responseCode = responseCode;
        this.retryable = retryable;
    }

    /**
     * @return true if retrying may resolve the issue
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * @return the response code
     */
    public int getResponseCode() {
        return responseCode;
    }
}
