package com.configmirror.sdk;

import com.configmirror.sdk.DataModel.ConfigSpec;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable set of config data: the gates, dynamic configs and layer configs of one snapshot,
 * keyed by name.
 */
final class SpecData {
    static final SpecData EMPTY = new SpecData(new HashMap<>(), new HashMap<>(), new HashMap<>());

    private final Map<String, ConfigSpec> gates;
    private final Map<String, ConfigSpec> dynamicConfigs;
    private final Map<String, ConfigSpec> layerConfigs;

    private SpecData(
            Map<String, ConfigSpec> gates,
            Map<String, ConfigSpec> dynamicConfigs,
            Map<String, ConfigSpec> layerConfigs
    ) {
        this.gates = gates;
        this.dynamicConfigs = dynamicConfigs;
        this.layerConfigs = layerConfigs;
    }

    static SpecData fromResponse(ConfigSpecsResponse response) {
        return new SpecData(
                byName(response.getFeatureGates()),
                byName(response.getDynamicConfigs()),
                byName(response.getLayerConfigs())
        );
    }

    private static Map<String, ConfigSpec> byName(List<ConfigSpec> specs) {
        Map<String, ConfigSpec> map = new HashMap<>();
        for (ConfigSpec spec: specs) {
            if (spec != null && spec.getName() != null) {
                map.put(spec.getName(), spec);
            }
        }
        return map;
    }

    ConfigSpec get(ConfigKind kind, String name) {
        return mapFor(kind).get(name);
    }

    Set<String> names(ConfigKind kind) {
        return Collections.unmodifiableSet(mapFor(kind).keySet());
    }

    private Map<String, ConfigSpec> mapFor(ConfigKind kind) {
        switch (kind) {
            case GATE:
                return gates;
            case DYNAMIC_CONFIG:
                return dynamicConfigs;
            case LAYER:
                return layerConfigs;
            default:
                throw new IllegalArgumentException("unknown config kind: " + kind);
        }
    }
}
