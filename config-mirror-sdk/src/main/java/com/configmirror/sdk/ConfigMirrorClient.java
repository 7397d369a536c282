package com.configmirror.sdk;

import com.configmirror.sdk.DataModel.ConfigSpec;
import com.configmirror.sdk.subsystems.Callback;
import com.configmirror.sdk.subsystems.ClientContext;
import com.configmirror.sdk.subsystems.DataSource;
import com.configmirror.sdk.subsystems.ErrorReporter;
import com.launchdarkly.logging.LDLogger;

import java.io.Closeable;
import java.io.IOException;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client for keeping a local replica of the server's config data: feature gates, dynamic configs,
 * layer configs, and ID lists.
 * <p>
 * {@link #init(MirrorConfig)} does not return until the first sync attempt has finished, whether
 * or not it succeeded. After that, the client polls in the background until {@link #close()} is
 * called. Lookups never block on the network and never throw because of a sync failure; they
 * return whatever was last committed.
 */
public class ConfigMirrorClient implements Closeable {
    private final LDLogger logger;
    private final ConfigSpecStore configSpecStore = new ConfigSpecStore();
    private final IdListRegistry idListRegistry = new IdListRegistry();
    private final SpecsFetcher fetcher;
    private final TaskExecutor taskExecutor;
    private final DataSource dataSource;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a client, performs the initial sync, and starts polling.
     *
     * @param config the client configuration
     * @return the client
     * @throws ConfigMirrorException if the configuration is missing required values
     */
    public static ConfigMirrorClient init(MirrorConfig config) throws ConfigMirrorException {
        if (config == null) {
            throw new ConfigMirrorException("Client configuration cannot be null");
        }
        if (config.getServerKey() == null) {
            throw new ConfigMirrorException("Server key cannot be null");
        }
        if (config.serviceEndpoints.getApiBaseUri() == null) {
            throw new ConfigMirrorException("An API base URI must be set with MirrorConfig.Builder.serviceEndpoints()");
        }
        ClientContext baseContext = ClientContextImpl.baseFromConfig(config, makeLogger(config));
        SpecsFetcher fetcher = new HttpSpecsFetcher(baseContext, SdkMetadata.forNewSession());
        TaskExecutor taskExecutor = new DefaultTaskExecutor(config.getIdListFetchConcurrency());
        return new ConfigMirrorClient(baseContext, fetcher, taskExecutor);
    }

    // visible for testing
    ConfigMirrorClient(MirrorConfig config, SpecsFetcher fetcher, TaskExecutor taskExecutor) {
        this(ClientContextImpl.baseFromConfig(config, makeLogger(config)), fetcher, taskExecutor);
    }

    private ConfigMirrorClient(ClientContext baseContext, SpecsFetcher fetcher, TaskExecutor taskExecutor) {
        MirrorConfig config = baseContext.getConfig();
        this.logger = baseContext.getBaseLogger();
        this.fetcher = fetcher;
        this.taskExecutor = taskExecutor;
        logger.info("Creating config mirror client. Version: {}", SdkPackageConsts.SDK_VERSION);

        ErrorReporter errorReporter = config.getErrorReporter() != null ? config.getErrorReporter() :
                new ComponentsImpl.LoggingErrorReporter(logger);
        ConfigSpecSynchronizer configSpecSynchronizer = new ConfigSpecSynchronizer(fetcher, configSpecStore,
                config.getRulesUpdatedCallback(), errorReporter, logger);
        IdListSynchronizer idListSynchronizer = new IdListSynchronizer(fetcher, idListRegistry, taskExecutor,
                errorReporter, logger.subLogger("IdLists"));

        String bootstrapValues = config.getBootstrapValues();
        if (bootstrapValues != null && !bootstrapValues.isEmpty()) {
            configSpecSynchronizer.applyBootstrap(bootstrapValues);
        }
        configSpecSynchronizer.fullResync();
        configSpecStore.markInitialSync();
        idListSynchronizer.reconcileCatalog();
        logger.info("Initial sync finished; init reason is {}", configSpecStore.getInitReason());

        ClientContextImpl contextImpl = new ClientContextImpl(baseContext, configSpecSynchronizer,
                idListSynchronizer, errorReporter, taskExecutor);
        this.dataSource = config.dataSource.build(contextImpl);
        dataSource.start(new Callback<Boolean>() {
            @Override
            public void onSuccess(Boolean result) {
                logger.debug("Polling started");
            }

            @Override
            public void onError(Throwable error) {
                SdkUtil.logExceptionAtErrorLevel(logger, error, "Polling could not be started");
            }
        });
    }

    private static LDLogger makeLogger(MirrorConfig config) {
        return LDLogger.withAdapter(config.getLogAdapter(), config.getLoggerName());
    }

    /**
     * Looks up a feature gate.
     *
     * @param name the gate name
     * @return the gate, or null if there is no gate with that name
     */
    public ConfigSpec getGate(String name) {
        return configSpecStore.getGate(name);
    }

    /**
     * Looks up a dynamic config.
     *
     * @param name the config name
     * @return the config, or null if there is no dynamic config with that name
     */
    public ConfigSpec getDynamicConfig(String name) {
        return configSpecStore.getDynamicConfig(name);
    }

    /**
     * Looks up a layer config.
     *
     * @param name the layer name
     * @return the layer, or null if there is no layer with that name
     */
    public ConfigSpec getLayerConfig(String name) {
        return configSpecStore.getLayerConfig(name);
    }

    /**
     * Returns the names of every config of one kind in the current snapshot.
     *
     * @param kind the kind of config
     * @return an unmodifiable set of names
     */
    public Set<String> getConfigNames(ConfigKind kind) {
        return configSpecStore.getNames(kind);
    }

    /**
     * Looks up an ID list. The returned object is live: later incremental fetches of the same
     * generation show up in it.
     *
     * @param name the list name
     * @return the list, or null if the client has no list with that name
     */
    public IdList getIdList(String name) {
        return idListRegistry.get(name);
    }

    /**
     * @return the names of all ID lists the client currently holds
     */
    public Set<String> getIdListNames() {
        return idListRegistry.names();
    }

    /**
     * Tests whether an identifier is a member of an ID list.
     *
     * @param listName the list name
     * @param id the identifier
     * @return true if the list exists and contains the identifier
     */
    public boolean isInIdList(String listName, String id) {
        IdList list = idListRegistry.get(listName);
        return list != null && list.contains(id);
    }

    /**
     * @return where the current config data came from
     */
    public InitReason getInitReason() {
        return configSpecStore.getInitReason();
    }

    /**
     * @return the server time of the last committed config snapshot, or 0 if there is none
     */
    public long getLastSyncTime() {
        return configSpecStore.getLastSyncTime();
    }

    /**
     * @return the last sync time as it was right after the initial sync in {@link #init(MirrorConfig)}
     */
    public long getInitialSyncTime() {
        return configSpecStore.getInitialSyncTime();
    }

    /**
     * Stops polling and releases network resources. A sync that is already running is allowed to
     * finish. Lookups keep working on the last committed data.
     *
     * @throws IOException if the HTTP client could not be shut down
     */
    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Closing config mirror client");
        dataSource.stop(SdkUtil.noOpCallback());
        taskExecutor.close();
        fetcher.close();
    }
}
