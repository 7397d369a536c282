package com.configmirror.sdk.integrations;

import com.configmirror.sdk.Components;
import com.configmirror.sdk.MirrorConfig;
import com.configmirror.sdk.subsystems.ComponentConfigurer;
import com.configmirror.sdk.subsystems.DataSource;

/**
 * Contains methods for configuring the polling data source.
 * <p>
 * The client runs two independent polling loops: one that re-downloads the full config snapshot,
 * and one that refreshes the catalog of ID lists and fetches any new list content. Each loop
 * waits for its interval, checks whether the client has been closed, and then syncs.
 * <p>
 * Create a builder with {@link Components#pollingDataSource()}, set any custom options, and pass
 * it to {@link MirrorConfig.Builder#dataSource(ComponentConfigurer)}:
 * <pre><code>
 *     MirrorConfig config = new MirrorConfig.Builder()
 *         .dataSource(Components.pollingDataSource().configSyncIntervalMillis(30_000))
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling
 * {@link Components#pollingDataSource()}.
 */
public abstract class PollingDataSourceBuilder implements ComponentConfigurer<DataSource> {
    /**
     * The default value for {@link #configSyncIntervalMillis(int)}: 10 seconds.
     */
    public static final int DEFAULT_CONFIG_SYNC_INTERVAL_MILLIS = 10_000;

    /**
     * The default value for {@link #idListSyncIntervalMillis(int)}: 1 minute.
     */
    public static final int DEFAULT_ID_LIST_SYNC_INTERVAL_MILLIS = 60_000;

    /**
     * The config snapshot polling interval in millis
     */
    protected int configSyncIntervalMillis = DEFAULT_CONFIG_SYNC_INTERVAL_MILLIS;

    /**
     * The ID list polling interval in millis
     */
    protected int idListSyncIntervalMillis = DEFAULT_ID_LIST_SYNC_INTERVAL_MILLIS;

    /**
     * Sets the interval between config snapshot downloads.
     * <p>
     * The default value is {@link #DEFAULT_CONFIG_SYNC_INTERVAL_MILLIS}. Zero or negative values
     * restore the default.
     *
     * @param configSyncIntervalMillis the interval in milliseconds
     * @return the builder
     */
    public PollingDataSourceBuilder configSyncIntervalMillis(int configSyncIntervalMillis) {
        this.configSyncIntervalMillis = configSyncIntervalMillis <= 0 ?
                DEFAULT_CONFIG_SYNC_INTERVAL_MILLIS : configSyncIntervalMillis;
        return this;
    }

    /**
     * Sets the interval between ID list catalog refreshes.
     * <p>
     * The default value is {@link #DEFAULT_ID_LIST_SYNC_INTERVAL_MILLIS}. Zero or negative values
     * restore the default.
     *
     * @param idListSyncIntervalMillis the interval in milliseconds
     * @return the builder
     */
    public PollingDataSourceBuilder idListSyncIntervalMillis(int idListSyncIntervalMillis) {
        this.idListSyncIntervalMillis = idListSyncIntervalMillis <= 0 ?
                DEFAULT_ID_LIST_SYNC_INTERVAL_MILLIS : idListSyncIntervalMillis;
        return this;
    }
}
