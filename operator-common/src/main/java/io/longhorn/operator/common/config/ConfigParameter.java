/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.common.config;

import io.longhorn.operator.common.InvalidConfigurationException;

import java.util.HashMap;
import java.util.Map;

/**
 * Models a configuration parameter, identified by a unique key, which is either required or has a default value.
 * Optional parameters without a default value implicitly have a null default.
 * The key is also the name of the environment variable from which the value is read.
 *
 * @param key           Configuration parameter name/key
 * @param <T>           Type of the parsed value
 * @param type          Parser of the value
 * @param defaultValue  Default value of the configuration parameter
 * @param required      If the value is required or not
 * @param map           Map that will contain all the configuration parameters
 */
public record ConfigParameter<T>(String key, ConfigParameterParser<T> type, String defaultValue, boolean required, Map<String, ConfigParameter<?>> map) {
    /**
     * Creates a required parameter
     *
     * @param key           Configuration parameter name/key
     * @param type          Parser of the value
     * @param map           Configuration map the parameter registers itself in
     */
    public ConfigParameter(String key, ConfigParameterParser<T> type, Map<String, ConfigParameter<?>> map) {
        this(key, type, null, true, map);
        map.put(key(), this);
    }

    /**
     * Creates an optional parameter
     *
     * @param key           Configuration parameter name/key
     * @param type          Parser of the value
     * @param defaultValue  Default value of the configuration parameter
     * @param map           Configuration map the parameter registers itself in
     */
    public ConfigParameter(String key, ConfigParameterParser<T> type, String defaultValue, Map<String, ConfigParameter<?>> map) {
        this(key, type, defaultValue, false, map);
        map.put(key(), this);
    }

    /**
     * Parses the user supplied values and fills in the defaults of the values which were not supplied. Null or
     * empty values count as not supplied.
     *
     * @param envVarMap          Map containing values entered by user. It must contain only known keys.
     * @param configParameterMap Map containing all the configuration parameters
     *
     * @return  Map with the parsed values
     */
    public static Map<String, Object> define(Map<String, String> envVarMap, Map<String, ConfigParameter<?>> configParameterMap) {
        Map<String, Object> generatedMap = new HashMap<>(configParameterMap.size());

        for (String key : envVarMap.keySet()) {
            if (!configParameterMap.containsKey(key)) {
                throw new InvalidConfigurationException("Unknown configuration parameter " + key);
            }
        }

        for (ConfigParameter<?> parameter : configParameterMap.values()) {
            generatedMap.put(parameter.key(), get(envVarMap, parameter));
        }

        return generatedMap;
    }

    private static <T> T get(Map<String, String> map, ConfigParameter<T> parameter) {
        String value = map.get(parameter.key());

        if (value == null || value.isEmpty()) {
            value = parameter.defaultValue();
        }

        if (value != null) {
            try {
                return parameter.type().parse(value);
            } catch (InvalidConfigurationException e) {
                throw new InvalidConfigurationException("Invalid value of " + parameter.key() + ": " + e.getMessage(), e);
            }
        } else if (parameter.required()) {
            throw new InvalidConfigurationException("Config value: " + parameter.key() + " is mandatory");
        } else {
            return null;
        }
    }
}
