/**
 * Main package for the Config Mirror SDK, containing the client and configuration classes.
 * <p>
 * You will most often use {@link com.configmirror.sdk.ConfigMirrorClient} (the SDK client) and
 * {@link com.configmirror.sdk.MirrorConfig} (configuration options for the client).
 */
package com.configmirror.sdk;
