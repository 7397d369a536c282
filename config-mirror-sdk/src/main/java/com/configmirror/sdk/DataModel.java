package com.configmirror.sdk;

import static com.launchdarkly.sdk.internal.GsonHelpers.gsonInstance;

import com.launchdarkly.sdk.LDValue;
import com.launchdarkly.sdk.json.SerializationException;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Contains the data model for configuration received from the server.
 * <p>
 * The SDK does not interpret these objects: rule logic, hashing and targeting belong to the
 * evaluation engine. They are stored and served by name exactly as they were received. Payload
 * fields such as {@link ConfigSpec#getDefaultValue()} are kept as opaque {@link LDValue} trees.
 * <p>
 * Instances are created by Gson, so any property missing from the JSON shows up as a null field;
 * the getters normalize those to empty values.
 */
public abstract class DataModel {
    private DataModel() {}

    /**
     * A named configuration unit: a feature gate, a dynamic config, or a layer config.
     */
    public static final class ConfigSpec {
        private final String name;
        private final String type;
        private final String salt;
        private final boolean enabled;
        private final List<ConfigRule> rules;
        private final LDValue defaultValue;
        private final String idType;
        private final List<String> explicitParameters;

        ConfigSpec(
                String name,
                String type,
                String salt,
                boolean enabled,
                List<ConfigRule> rules,
                LDValue defaultValue,
                String idType,
                List<String> explicitParameters
        ) {
            this.name = name;
            this.type = type;
            this.salt = salt;
            this.enabled = enabled;
            this.rules = rules;
            this.defaultValue = defaultValue;
            this.idType = idType;
            this.explicitParameters = explicitParameters;
        }

        /**
         * @return the unique name of this config within its kind
         */
        public String getName() {
            return name;
        }

        /**
         * @return the server's type tag, such as "feature_gate" or "dynamic_config"
         */
        public String getType() {
            return type;
        }

        /**
         * @return the hashing salt, consumed by the evaluation engine
         */
        public String getSalt() {
            return salt;
        }

        /**
         * @return true if the config is enabled
         */
        public boolean isEnabled() {
            return enabled;
        }

        /**
         * @return the ordered evaluation rules; never null
         */
        public List<ConfigRule> getRules() {
            return rules == null ? Collections.emptyList() : Collections.unmodifiableList(rules);
        }

        /**
         * @return the fallback value; {@link LDValue#ofNull()} if none was given
         */
        public LDValue getDefaultValue() {
            return LDValue.normalize(defaultValue);
        }

        /**
         * @return the identifier type this config is evaluated against
         */
        public String getIdType() {
            return idType;
        }

        /**
         * @return the explicit parameter names (layers only); never null
         */
        public List<String> getExplicitParameters() {
            return explicitParameters == null ? Collections.emptyList() :
                    Collections.unmodifiableList(explicitParameters);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof ConfigSpec)) {
                return false;
            }
            ConfigSpec other = (ConfigSpec) o;
            return enabled == other.enabled &&
                    Objects.equals(name, other.name) &&
                    Objects.equals(type, other.type) &&
                    Objects.equals(salt, other.salt) &&
                    getRules().equals(other.getRules()) &&
                    getDefaultValue().equals(other.getDefaultValue()) &&
                    Objects.equals(idType, other.idType) &&
                    getExplicitParameters().equals(other.getExplicitParameters());
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, type, salt, enabled, idType);
        }

        @Override
        public String toString() {
            return toJson();
        }

        /**
         * Deserializes a config from JSON.
         *
         * @param json the JSON representation
         * @return the config
         * @throws SerializationException if the JSON is malformed
         */
        public static ConfigSpec fromJson(String json) throws SerializationException {
            try {
                return gsonInstance().fromJson(json, ConfigSpec.class);
            } catch (Exception e) { // Gson throws various kinds of parsing exceptions that have no common base class
                throw new SerializationException(e);
            }
        }

        /**
         * @return the JSON representation of this config
         */
        public String toJson() {
            return gsonInstance().toJson(this);
        }
    }

    /**
     * One ordered rule of a {@link ConfigSpec}.
     */
    public static final class ConfigRule {
        private final String name;
        private final String id;
        private final String salt;
        private final double passPercentage;
        private final List<ConfigCondition> conditions;
        private final LDValue returnValue;
        private final String idType;
        private final String configDelegate;

        ConfigRule(
                String name,
                String id,
                String salt,
                double passPercentage,
                List<ConfigCondition> conditions,
                LDValue returnValue,
                String idType,
                String configDelegate
        ) {
            this.name = name;
            this.id = id;
            this.salt = salt;
            this.passPercentage = passPercentage;
            this.conditions = conditions;
            this.returnValue = returnValue;
            this.idType = idType;
            this.configDelegate = configDelegate;
        }

        public String getName() {
            return name;
        }

        public String getId() {
            return id;
        }

        public String getSalt() {
            return salt;
        }

        public double getPassPercentage() {
            return passPercentage;
        }

        public List<ConfigCondition> getConditions() {
            return conditions == null ? Collections.emptyList() : Collections.unmodifiableList(conditions);
        }

        public LDValue getReturnValue() {
            return LDValue.normalize(returnValue);
        }

        public String getIdType() {
            return idType;
        }

        /**
         * @return the name of the config this rule delegates to, or null
         */
        public String getConfigDelegate() {
            return configDelegate == null || configDelegate.isEmpty() ? null : configDelegate;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof ConfigRule)) {
                return false;
            }
            ConfigRule other = (ConfigRule) o;
            return Double.compare(passPercentage, other.passPercentage) == 0 &&
                    Objects.equals(name, other.name) &&
                    Objects.equals(id, other.id) &&
                    Objects.equals(salt, other.salt) &&
                    getConditions().equals(other.getConditions()) &&
                    getReturnValue().equals(other.getReturnValue()) &&
                    Objects.equals(idType, other.idType) &&
                    Objects.equals(getConfigDelegate(), other.getConfigDelegate());
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, id, salt, passPercentage, idType);
        }
    }

    /**
     * One condition of a {@link ConfigRule}.
     */
    public static final class ConfigCondition {
        private final String type;
        private final String operator;
        private final String field;
        private final LDValue targetValue;
        private final Map<String, LDValue> additionalValues;
        private final String idType;

        ConfigCondition(
                String type,
                String operator,
                String field,
                LDValue targetValue,
                Map<String, LDValue> additionalValues,
                String idType
        ) {
            this.type = type;
            this.operator = operator;
            this.field = field;
            this.targetValue = targetValue;
            this.additionalValues = additionalValues;
            this.idType = idType;
        }

        public String getType() {
            return type;
        }

        public String getOperator() {
            return operator;
        }

        public String getField() {
            return field;
        }

        public LDValue getTargetValue() {
            return LDValue.normalize(targetValue);
        }

        public Map<String, LDValue> getAdditionalValues() {
            return additionalValues == null ? Collections.emptyMap() :
                    Collections.unmodifiableMap(additionalValues);
        }

        public String getIdType() {
            return idType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof ConfigCondition)) {
                return false;
            }
            ConfigCondition other = (ConfigCondition) o;
            return Objects.equals(type, other.type) &&
                    Objects.equals(operator, other.operator) &&
                    Objects.equals(field, other.field) &&
                    getTargetValue().equals(other.getTargetValue()) &&
                    getAdditionalValues().equals(other.getAdditionalValues()) &&
                    Objects.equals(idType, other.idType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, operator, field, idType);
        }
    }
}
