package com.configmirror.sdk;

import static com.launchdarkly.sdk.internal.GsonHelpers.gsonInstance;

import com.google.gson.annotations.SerializedName;
import com.configmirror.sdk.DataModel.ConfigSpec;
import com.launchdarkly.sdk.json.SerializationException;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The snapshot returned by the config specs endpoint, and the format of bootstrap values.
 * <p>
 * When {@link #hasUpdates()} is false the server is saying nothing changed since the time we
 * sent, and the rest of the response must be ignored.
 */
final class ConfigSpecsResponse {
    @SerializedName("has_updates")
    private final boolean hasUpdates;
    private final long time;
    @SerializedName("feature_gates")
    private final List<ConfigSpec> featureGates;
    @SerializedName("dynamic_configs")
    private final List<ConfigSpec> dynamicConfigs;
    @SerializedName("layer_configs")
    private final List<ConfigSpec> layerConfigs;
    @SerializedName("id_lists")
    private final Map<String, Boolean> idLists;

    ConfigSpecsResponse(
            boolean hasUpdates,
            long time,
            List<ConfigSpec> featureGates,
            List<ConfigSpec> dynamicConfigs,
            List<ConfigSpec> layerConfigs,
            Map<String, Boolean> idLists
    ) {
        this.hasUpdates = hasUpdates;
        this.time = time;
        this.featureGates = featureGates;
        this.dynamicConfigs = dynamicConfigs;
        this.layerConfigs = layerConfigs;
        this.idLists = idLists;
    }

    boolean hasUpdates() {
        return hasUpdates;
    }

    long getTime() {
        return time;
    }

    List<ConfigSpec> getFeatureGates() {
        return featureGates == null ? Collections.emptyList() : featureGates;
    }

    List<ConfigSpec> getDynamicConfigs() {
        return dynamicConfigs == null ? Collections.emptyList() : dynamicConfigs;
    }

    List<ConfigSpec> getLayerConfigs() {
        return layerConfigs == null ? Collections.emptyList() : layerConfigs;
    }

    Map<String, Boolean> getIdLists() {
        return idLists == null ? Collections.emptyMap() : idLists;
    }

    static ConfigSpecsResponse fromJson(String json) throws SerializationException {
        ConfigSpecsResponse response;
        try {
            response = gsonInstance().fromJson(json, ConfigSpecsResponse.class);
        } catch (Exception e) { // Gson throws various kinds of parsing exceptions that have no common base class
            throw new SerializationException(e);
        }
        if (response == null) {
            throw new SerializationException(new IllegalArgumentException("empty config specs response"));
        }
        return response;
    }
}
