package com.configmirror.sdk;

import java.util.UUID;

/**
 * Identifies this SDK instance in the body of every request to the API endpoints.
 */
final class SdkMetadata {
    private final String sdkType;
    private final String sdkVersion;
    private final String sessionID;

    SdkMetadata(String sdkType, String sdkVersion, String sessionID) {
        this.sdkType = sdkType;
        this.sdkVersion = sdkVersion;
        this.sessionID = sessionID;
    }

    static SdkMetadata forNewSession() {
        return new SdkMetadata(SdkPackageConsts.SDK_NAME, SdkPackageConsts.SDK_VERSION,
                UUID.randomUUID().toString());
    }

    String getSdkType() {
        return sdkType;
    }

    String getSdkVersion() {
        return sdkVersion;
    }

    String getSessionID() {
        return sessionID;
    }
}
