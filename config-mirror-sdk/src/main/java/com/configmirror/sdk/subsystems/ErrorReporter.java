package com.configmirror.sdk.subsystems;

/**
 * Receives every failure that the SDK recovers from on its own.
 * <p>
 * Synchronization failures never reach code that reads from the client; the client keeps serving
 * its last known data and hands the failure to this interface instead. The default implementation
 * logs it. Applications can supply their own to forward failures to an error-tracking service.
 * <p>
 * Implementations may be called concurrently from several SDK worker threads and must not block.
 *
 * @see com.configmirror.sdk.MirrorConfig.Builder#errorReporter(ErrorReporter)
 */
public interface ErrorReporter {
    /**
     * Reports a failure.
     *
     * @param error the failure; usually a {@link com.configmirror.sdk.SyncFailure}
     */
    void reportException(Throwable error);
}
