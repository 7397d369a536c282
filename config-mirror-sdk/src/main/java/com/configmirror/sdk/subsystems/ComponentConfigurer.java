package com.configmirror.sdk.subsystems;

/**
 * The common interface for SDK component factories and configuration builders. Applications
 * should not need to implement this interface.
 *
 * @param <T> the type of SDK component or configuration object being constructed
 */
public interface ComponentConfigurer<T> {
    /**
     * Called internally by the SDK to create an implementation instance. Applications should not
     * need to call this method.
     *
     * @param clientContext provides configuration properties and other components from the SDK client
     * @return the component or configuration object
     */
    T build(ClientContext clientContext);
}
