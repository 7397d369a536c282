package com.configmirror.sdk;

import com.configmirror.sdk.subsystems.Callback;
import com.configmirror.sdk.subsystems.DataSource;
import com.configmirror.sdk.subsystems.ErrorReporter;
import com.launchdarkly.logging.LDLogger;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * DataSource implementation that runs the two polling loops: config snapshots, and the ID list
 * catalog.
 * <p>
 * The client does the initial sync itself before starting this data source, so the first run of
 * each loop happens one interval after {@link #start(Callback)}. Stopping does not interrupt a run
 * that is in progress; it lets that run finish and commit, and prevents any further runs.
 */
final class PollingDataSource implements DataSource {
    private final ConfigSpecSynchronizer configSpecSynchronizer;
    private final IdListSynchronizer idListSynchronizer;
    final long configSyncIntervalMillis; // visible for testing
    final long idListSyncIntervalMillis; // visible for testing
    private final TaskExecutor taskExecutor;
    private final ErrorReporter errorReporter;
    private final LDLogger logger;
    private final AtomicBoolean shutDown = new AtomicBoolean(false);
    final AtomicReference<ScheduledFuture<?>> configSyncTask = new AtomicReference<>(); // visible for testing
    final AtomicReference<ScheduledFuture<?>> idListSyncTask = new AtomicReference<>(); // visible for testing

    /**
     * @param configSpecSynchronizer   used for each config snapshot poll
     * @param idListSynchronizer       used for each ID list catalog poll
     * @param configSyncIntervalMillis interval in millis between config snapshot polls
     * @param idListSyncIntervalMillis interval in millis between ID list catalog polls
     * @param taskExecutor             that will be used to schedule the polling tasks
     * @param errorReporter            receives unexpected exceptions from a poll
     * @param logger                   for logging
     */
    PollingDataSource(
            ConfigSpecSynchronizer configSpecSynchronizer,
            IdListSynchronizer idListSynchronizer,
            long configSyncIntervalMillis,
            long idListSyncIntervalMillis,
            TaskExecutor taskExecutor,
            ErrorReporter errorReporter,
            LDLogger logger
    ) {
        this.configSpecSynchronizer = configSpecSynchronizer;
        this.idListSynchronizer = idListSynchronizer;
        this.configSyncIntervalMillis = configSyncIntervalMillis;
        this.idListSyncIntervalMillis = idListSyncIntervalMillis;
        this.taskExecutor = taskExecutor;
        this.errorReporter = errorReporter;
        this.logger = logger;
    }

    @Override
    public void start(final Callback<Boolean> resultCallback) {
        if (shutDown.get()) {
            resultCallback.onError(new IllegalStateException("data source has already been stopped"));
            return;
        }
        logger.debug("Scheduling config sync every {}ms and ID list sync every {}ms",
                configSyncIntervalMillis, idListSyncIntervalMillis);
        configSyncTask.set(taskExecutor.startRepeatingTask(
                () -> poll(configSpecSynchronizer::fullResync),
                configSyncIntervalMillis, configSyncIntervalMillis));
        idListSyncTask.set(taskExecutor.startRepeatingTask(
                () -> poll(idListSynchronizer::reconcileCatalog),
                idListSyncIntervalMillis, idListSyncIntervalMillis));
        resultCallback.onSuccess(true);
    }

    @Override
    public void stop(Callback<Void> completionCallback) {
        shutDown.set(true);
        cancel(configSyncTask);
        cancel(idListSyncTask);
        completionCallback.onSuccess(null);
    }

    boolean isShutDown() {
        return shutDown.get();
    }

    private void poll(Runnable sync) {
        if (shutDown.get()) {
            return;
        }
        try {
            sync.run();
        } catch (RuntimeException e) {
            // an exception escaping here would silently end the repeating task
            SdkUtil.logExceptionAtErrorLevel(logger, e, "Unexpected exception in polling task");
            errorReporter.reportException(e);
        }
    }

    private static void cancel(AtomicReference<ScheduledFuture<?>> taskRef) {
        ScheduledFuture<?> task = taskRef.getAndSet(null);
        if (task != null) {
            task.cancel(false);
        }
    }
}
