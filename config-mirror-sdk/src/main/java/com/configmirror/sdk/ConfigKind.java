package com.configmirror.sdk;

/**
 * The three independent kinds of {@link DataModel.ConfigSpec} held by the client.
 */
public enum ConfigKind {
    /**
     * A boolean-outcome feature gate.
     */
    GATE,

    /**
     * A dynamic config.
     */
    DYNAMIC_CONFIG,

    /**
     * A layer config.
     */
    LAYER
}
