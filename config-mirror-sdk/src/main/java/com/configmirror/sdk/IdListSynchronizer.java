package com.configmirror.sdk;

import com.configmirror.sdk.subsystems.ErrorReporter;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.sdk.json.SerializationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Keeps the {@link IdListRegistry} in line with the server's ID list catalog.
 * <p>
 * List content is an append-only log of lines such as {@code +id} and {@code -id}. For each list,
 * the client remembers how many bytes it has consumed and asks only for the bytes after that with
 * an HTTP range request. When the server starts a new file for a list, the local list is replaced
 * with an empty one and consumed again from byte zero.
 */
final class IdListSynchronizer {
    private final SpecsFetcher fetcher;
    private final IdListRegistry registry;
    private final TaskExecutor taskExecutor;
    private final ErrorReporter errorReporter;
    private final LDLogger logger;

    IdListSynchronizer(
            SpecsFetcher fetcher,
            IdListRegistry registry,
            TaskExecutor taskExecutor,
            ErrorReporter errorReporter,
            LDLogger logger
    ) {
        this.fetcher = fetcher;
        this.registry = registry;
        this.taskExecutor = taskExecutor;
        this.errorReporter = errorReporter;
        this.logger = logger;
    }

    /**
     * Fetches the catalog, brings every listed ID list up to date, and removes lists that are no
     * longer in the catalog. Returns after all content fetches have finished.
     */
    void reconcileCatalog() {
        Map<String, IdListMetadata> catalog;
        try {
            catalog = IdListMetadata.parseCatalog(fetcher.fetchIdLists());
        } catch (SyncFailure e) {
            errorReporter.reportException(e);
            return;
        } catch (SerializationException e) {
            errorReporter.reportException(new SyncFailure("Invalid JSON received from ID list catalog endpoint", e,
                    SyncFailure.FailureType.INVALID_RESPONSE_BODY));
            return;
        }

        List<Future<?>> fetches = new ArrayList<>();
        for (Map.Entry<String, IdListMetadata> entry: catalog.entrySet()) {
            String name = entry.getKey();
            IdList previous = registry.getOrCreatePlaceholder(name);
            IdList target = prepare(name, entry.getValue(), previous);
            if (target == null) {
                continue;
            }
            try {
                fetches.add(taskExecutor.submitWorkerTask(() -> fetchContent(target)));
            } catch (RejectedExecutionException e) {
                // the new generation would never be filled; put the old one back
                if (target != previous) {
                    registry.replaceIfSame(name, target, previous);
                }
                logger.debug("ID list fetches were not started because the client is closing");
                break;
            }
        }
        awaitAll(fetches);

        List<String> removed = registry.retainOnly(catalog.keySet());
        if (!removed.isEmpty()) {
            logger.debug("Removed ID lists no longer in catalog: {}", removed);
        }
    }

    /**
     * Applies one catalog entry to the registry.
     *
     * @return the list whose content should be fetched, or null if nothing needs fetching
     */
    private IdList prepare(String name, IdListMetadata meta, IdList local) {
        if (meta == null || isEmpty(meta.getUrl()) || isEmpty(meta.getFileId())) {
            logger.debug("Skipping ID list \"{}\": catalog entry has no url or file ID", name);
            return null;
        }
        if (meta.getCreationTime() < local.getCreationTime()) {
            logger.debug("Skipping ID list \"{}\": catalog entry is older than the local copy", name);
            return null;
        }
        if (!meta.getFileId().equals(local.getFileId())) {
            local = new IdList(name, meta.getCreationTime(), meta.getUrl(), meta.getFileId());
            registry.put(name, local);
            logger.debug("ID list \"{}\" has new file {}; starting from empty", name, meta.getFileId());
        }
        if (meta.getSize() <= local.getSize()) {
            return null;
        }
        return local;
    }

    private void fetchContent(IdList list) {
        RangeResponse response;
        try {
            response = fetcher.fetchRange(list.getUrl(), list.getSize());
        } catch (SyncFailure e) {
            errorReporter.reportException(e);
            return;
        }

        if (response.getContentLength() <= 0) {
            discard(list, "response had no usable Content-Length");
            return;
        }
        String content = response.getContent();
        if (content.length() <= 1 || (content.charAt(0) != '+' && content.charAt(0) != '-')) {
            discard(list, "content does not start with an add or remove line");
            return;
        }

        for (String line: content.replace("\r\n", "\n").split("\n")) {
            line = line.trim();
            if (line.length() <= 1) {
                continue;
            }
            String id = line.substring(1);
            switch (line.charAt(0)) {
                case '+':
                    list.add(id);
                    break;
                case '-':
                    list.remove(id);
                    break;
                default:
                    break;
            }
        }
        long size = list.addSize(response.getContentLength());
        logger.debug("ID list \"{}\" now has {} bytes", list.getName(), size);
    }

    private void discard(IdList list, String reason) {
        registry.removeIfSame(list.getName(), list);
        errorReporter.reportException(new SyncFailure("Discarded ID list \"" + list.getName() + "\": " + reason,
                SyncFailure.FailureType.CORRUPT_ID_LIST));
    }

    private void awaitAll(List<Future<?>> fetches) {
        for (Future<?> fetch: fetches) {
            try {
                fetch.get();
            } catch (ExecutionException e) {
                errorReporter.reportException(e.getCause() == null ? e : e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
