package com.configmirror.sdk.subsystems;

import com.configmirror.sdk.Components;

/**
 * The component that keeps the client's data up to date in the background.
 *
 * @see Components#pollingDataSource()
 */
public interface DataSource {
    /**
     * Starts the data source. The callback is called once background updates are scheduled.
     *
     * @param resultCallback called when the data source has started
     */
    void start(Callback<Boolean> resultCallback);

    /**
     * Requests that the data source stop. Work that is already in progress may still complete,
     * but no new updates will be started.
     *
     * @param completionCallback called once the stop request has been recorded
     */
    void stop(Callback<Void> completionCallback);
}
