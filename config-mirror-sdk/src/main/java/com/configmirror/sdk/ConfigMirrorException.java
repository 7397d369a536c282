package com.configmirror.sdk;

/**
 * Base class for checked exceptions raised by the Config Mirror SDK.
 */
public class ConfigMirrorException extends Exception {

    /**
     * @param message for the exception
     */
    public ConfigMirrorException(String message) {
        super(message);
    }

    ConfigMirrorException(String message, Throwable cause) {
        super(message, cause);
    }
}
