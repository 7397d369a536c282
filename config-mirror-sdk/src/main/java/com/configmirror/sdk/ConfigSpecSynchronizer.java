package com.configmirror.sdk;

import com.configmirror.sdk.subsystems.ErrorReporter;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.sdk.json.SerializationException;

/**
 * Downloads config snapshots and commits them to the {@link ConfigSpecStore}.
 * <p>
 * Failures never propagate out of this class. A failed download or an unparseable response is
 * passed to the {@link ErrorReporter} and the store keeps its previous contents.
 */
final class ConfigSpecSynchronizer {
    private final SpecsFetcher fetcher;
    private final ConfigSpecStore store;
    private final RulesUpdatedCallback rulesUpdatedCallback;
    private final ErrorReporter errorReporter;
    private final LDLogger logger;

    ConfigSpecSynchronizer(
            SpecsFetcher fetcher,
            ConfigSpecStore store,
            RulesUpdatedCallback rulesUpdatedCallback,
            ErrorReporter errorReporter,
            LDLogger logger
    ) {
        this.fetcher = fetcher;
        this.store = store;
        this.rulesUpdatedCallback = rulesUpdatedCallback;
        this.errorReporter = errorReporter;
        this.logger = logger;
    }

    /**
     * Seeds the store from application-supplied JSON in the same format as a server snapshot.
     *
     * @param json the bootstrap values
     * @return true if the values were committed
     */
    boolean applyBootstrap(String json) {
        ConfigSpecsResponse snapshot;
        try {
            snapshot = ConfigSpecsResponse.fromJson(json);
        } catch (SerializationException e) {
            SdkUtil.logExceptionAtWarnLevel(logger, e, "Bootstrap values could not be parsed and were ignored");
            errorReporter.reportException(new SyncFailure("Invalid bootstrap values", e,
                    SyncFailure.FailureType.INVALID_RESPONSE_BODY));
            return false;
        }
        boolean committed = store.applyBootstrap(snapshot);
        if (committed) {
            logger.info("Initialized config from bootstrap values with time {}", snapshot.getTime());
        } else {
            logger.warn("Bootstrap values had has_updates=false and were ignored");
        }
        return committed;
    }

    /**
     * Requests everything that changed since the last committed sync and commits it if the server
     * reports updates.
     *
     * @return true if a new snapshot was committed
     */
    boolean fullResync() {
        long sinceTime = store.getLastSyncTime();
        String json;
        try {
            json = fetcher.fetchConfigSpecs(sinceTime);
        } catch (SyncFailure e) {
            errorReporter.reportException(e);
            return false;
        }

        ConfigSpecsResponse snapshot;
        try {
            snapshot = ConfigSpecsResponse.fromJson(json);
        } catch (SerializationException e) {
            errorReporter.reportException(new SyncFailure("Invalid JSON received from config specs endpoint", e,
                    SyncFailure.FailureType.INVALID_RESPONSE_BODY));
            return false;
        }

        if (!store.applySnapshot(snapshot)) {
            logger.debug("No config updates since {}", sinceTime);
            return false;
        }
        logger.debug("Committed config snapshot with time {}", snapshot.getTime());
        notifyRulesUpdated(json, snapshot.getTime());
        return true;
    }

    private void notifyRulesUpdated(String rules, long time) {
        if (rulesUpdatedCallback == null) {
            return;
        }
        try {
            rulesUpdatedCallback.onRulesUpdated(rules, time);
        } catch (RuntimeException e) {
            errorReporter.reportException(e);
        }
    }
}
