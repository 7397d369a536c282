/**
 * Interfaces for implementation of Config Mirror SDK components.
 * <p>
 * Most applications will not need to refer to these types. They are used as interfaces for the
 * built-in SDK components, and as parameters within those interfaces.
 */
package com.configmirror.sdk.subsystems;
