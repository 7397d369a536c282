package com.configmirror.sdk;

/**
 * Constants related to the SDK package
 */
public class SdkPackageConsts {

    /**
     * Name of the SDK, as reported in request metadata.
     */
    public static final String SDK_NAME = "config-mirror-java";

    /**
     * Version of the SDK, as reported in request metadata and the user agent.
     */
    public static final String SDK_VERSION = "1.0.0";

    /**
     * Name that will be used for identifying this SDK when using a network client.  An example would be the
     * user agent in HTTP.
     */
    public static final String SDK_CLIENT_NAME = "ConfigMirrorJava";

    /**
     * Name the logger will use to identify this SDK.
     */
    public static final String DEFAULT_LOGGER_NAME = "ConfigMirror";
}
