package com.configmirror.sdk;

import static com.launchdarkly.sdk.internal.GsonHelpers.gsonInstance;

import com.google.gson.annotations.SerializedName;
import com.google.gson.reflect.TypeToken;
import com.launchdarkly.sdk.json.SerializationException;

import java.lang.reflect.Type;
import java.util.Map;

/**
 * One entry of the ID list catalog returned by the server.
 */
final class IdListMetadata {
    static final Type CATALOG_TYPE = new TypeToken<Map<String, IdListMetadata>>() {}.getType();

    private final String name;
    private final long size;
    private final long creationTime;
    private final String url;
    @SerializedName("fileID")
    private final String fileId;

    IdListMetadata(String name, long size, long creationTime, String url, String fileId) {
        this.name = name;
        this.size = size;
        this.creationTime = creationTime;
        this.url = url;
        this.fileId = fileId;
    }

    String getName() {
        return name;
    }

    long getSize() {
        return size;
    }

    long getCreationTime() {
        return creationTime;
    }

    String getUrl() {
        return url;
    }

    String getFileId() {
        return fileId;
    }

    /**
     * Parses the catalog. A JSON {@code null} or anything that is not an object is treated as
     * malformed; an empty object is a valid catalog with no lists.
     */
    static Map<String, IdListMetadata> parseCatalog(String json) throws SerializationException {
        Map<String, IdListMetadata> catalog;
        try {
            catalog = gsonInstance().fromJson(json, CATALOG_TYPE);
        } catch (Exception e) { // Gson throws various kinds of parsing exceptions that have no common base class
            throw new SerializationException(e);
        }
        if (catalog == null) {
            throw new SerializationException(new IllegalArgumentException("empty ID list catalog"));
        }
        return catalog;
    }
}
