/**
 * This package contains integration tools for configuring the Config Mirror SDK.
 */
package com.configmirror.sdk.integrations;
