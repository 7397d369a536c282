package com.configmirror.sdk;

import java.io.Closeable;

/**
 * The requests the client makes to the server. All methods block the calling thread and are
 * only called from SDK worker threads.
 */
interface SpecsFetcher extends Closeable {
    /**
     * Downloads the config snapshot.
     *
     * @param sinceTime the time of the last committed snapshot; the server may answer with only
     *                  what changed since then, or with {@code has_updates: false}
     * @return the raw JSON response
     * @throws SyncFailure if the request failed
     */
    String fetchConfigSpecs(long sinceTime) throws SyncFailure;

    /**
     * Downloads the catalog of ID lists.
     *
     * @return the raw JSON response, a map of list name to list metadata
     * @throws SyncFailure if the request failed
     */
    String fetchIdLists() throws SyncFailure;

    /**
     * Fetches ID list content from {@code offset} to the end of the resource.
     *
     * @param url the list's content URL, as given in the catalog
     * @param offset the number of bytes already ingested
     * @return the content and its declared length
     * @throws SyncFailure if the request failed
     */
    RangeResponse fetchRange(String url, long offset) throws SyncFailure;
}
