package com.configmirror.sdk;

/**
 * Describes where the configuration currently held by the client came from.
 */
public enum InitReason {
    /**
     * No configuration has been received yet.
     */
    UNINITIALIZED,

    /**
     * The configuration was seeded from bootstrap values supplied by the application and has not
     * yet been confirmed by the server.
     */
    BOOTSTRAP,

    /**
     * The configuration was received from the server.
     */
    NETWORK
}
