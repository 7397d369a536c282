package com.configmirror.sdk;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One generation of a named ID list: the set of IDs ingested so far, and how many bytes of the
 * list's content that represents.
 * <p>
 * A generation is identified by its file ID. When the server starts a new file for the list, the
 * client replaces the whole {@code IdList} object with a new empty one rather than editing this
 * one, so the creation time, URL and file ID here never change. The membership set and the size
 * are updated in place by concurrent fetch tasks.
 */
public final class IdList {
    private final String name;
    private final long creationTime;
    private final String url;
    private final String fileId;
    private final AtomicLong size = new AtomicLong();
    private final Set<String> ids = ConcurrentHashMap.newKeySet();

    IdList(String name, long creationTime, String url, String fileId) {
        this.name = name;
        this.creationTime = creationTime;
        this.url = url;
        this.fileId = fileId;
    }

    /**
     * Creates the placeholder used for a list the client has not seen before. It has no file ID,
     * so the first valid catalog entry for the list always starts a new generation.
     */
    static IdList placeholder(String name) {
        return new IdList(name, 0, null, null);
    }

    /**
     * @return the list name
     */
    public String getName() {
        return name;
    }

    /**
     * @return the number of bytes of list content ingested in this generation
     */
    public long getSize() {
        return size.get();
    }

    /**
     * @return the server's creation time for this generation
     */
    public long getCreationTime() {
        return creationTime;
    }

    /**
     * @return the URL the content is fetched from, or null for a placeholder
     */
    public String getUrl() {
        return url;
    }

    /**
     * @return the server's identifier for this generation of the content, or null for a placeholder
     */
    public String getFileId() {
        return fileId;
    }

    /**
     * @param id an identifier
     * @return true if the identifier is currently in the list
     */
    public boolean contains(String id) {
        return id != null && ids.contains(id);
    }

    /**
     * @return the number of identifiers currently in the list
     */
    public int count() {
        return ids.size();
    }

    /**
     * @return a read-only view of the identifiers; it reflects later updates
     */
    public Set<String> getIds() {
        return Collections.unmodifiableSet(ids);
    }

    void add(String id) {
        ids.add(id);
    }

    void remove(String id) {
        ids.remove(id);
    }

    long addSize(long bytes) {
        return size.addAndGet(bytes);
    }
}
