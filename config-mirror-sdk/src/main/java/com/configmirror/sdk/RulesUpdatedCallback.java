package com.configmirror.sdk;

/**
 * Observer that is told whenever a config sync commits new data.
 * <p>
 * It is not called for polls that returned no updates, nor for bootstrap values. A typical use
 * is to persist {@code rules} somewhere so that a later process can pass it to
 * {@link MirrorConfig.Builder#bootstrapValues(String)}.
 *
 * @see MirrorConfig.Builder#rulesUpdatedCallback(RulesUpdatedCallback)
 */
public interface RulesUpdatedCallback {
    /**
     * Called on a polling thread after new config data has been committed.
     *
     * @param rules the JSON snapshot exactly as received from the server
     * @param time the server timestamp of the snapshot
     */
    void onRulesUpdated(String rules, long time);
}
