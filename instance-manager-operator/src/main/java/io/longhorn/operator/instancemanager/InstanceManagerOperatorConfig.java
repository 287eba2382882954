/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager;

import io.longhorn.operator.common.config.ConfigParameter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static io.longhorn.operator.common.config.ConfigParameterParser.INTEGER;
import static io.longhorn.operator.common.config.ConfigParameterParser.LONG;
import static io.longhorn.operator.common.config.ConfigParameterParser.NON_EMPTY_STRING;
import static io.longhorn.operator.common.config.ConfigParameterParser.PORT;
import static io.longhorn.operator.common.config.ConfigParameterParser.nonNegative;
import static io.longhorn.operator.common.config.ConfigParameterParser.strictlyPositive;

/**
 * Instance Manager Operator configuration
 */
public class InstanceManagerOperatorConfig {
    private static final Map<String, ConfigParameter<?>> CONFIG_VALUES = new HashMap<>();

    /**
     * Namespace with the instance managers and their pods
     */
    public static final ConfigParameter<String> NAMESPACE = new ConfigParameter<>("LONGHORN_NAMESPACE", NON_EMPTY_STRING, CONFIG_VALUES);
    /**
     * Identity of this controller. It is the name of the node the controller runs on.
     */
    public static final ConfigParameter<String> CONTROLLER_ID = new ConfigParameter<>("LONGHORN_CONTROLLER_ID", NON_EMPTY_STRING, CONFIG_VALUES);
    /**
     * Number of controller loops reconciling in parallel
     */
    public static final ConfigParameter<Integer> CONTROLLER_THREAD_POOL_SIZE = new ConfigParameter<>("LONGHORN_CONTROLLER_THREAD_POOL_SIZE", strictlyPositive(INTEGER), "2", CONFIG_VALUES);
    public static final ConfigParameter<Integer> WORK_QUEUE_SIZE = new ConfigParameter<>("LONGHORN_WORK_QUEUE_SIZE", strictlyPositive(INTEGER), "1024", CONFIG_VALUES);
    /**
     * How many milliseconds between the periodic reconciliations of all instance managers
     */
    public static final ConfigParameter<Long> RECONCILIATION_INTERVAL_MS = new ConfigParameter<>("LONGHORN_FULL_RECONCILIATION_INTERVAL_MS", strictlyPositive(LONG), "120000", CONFIG_VALUES);
    /**
     * How many times a failing reconciliation is retried before the instance manager is dropped from the queue
     */
    public static final ConfigParameter<Integer> MAX_RETRIES = new ConfigParameter<>("LONGHORN_MAX_RETRIES", nonNegative(INTEGER), "3", CONFIG_VALUES);
    public static final ConfigParameter<Long> WATCH_RECONNECT_INTERVAL_MS = new ConfigParameter<>("LONGHORN_WATCH_RECONNECT_INTERVAL_MS", strictlyPositive(LONG), "1000", CONFIG_VALUES);
    public static final ConfigParameter<Long> UPDATE_RETRY_INTERVAL_MS = new ConfigParameter<>("LONGHORN_UPDATE_RETRY_INTERVAL_MS", strictlyPositive(LONG), "1000", CONFIG_VALUES);
    /**
     * Port on which the instance manager daemons serve their management API
     */
    public static final ConfigParameter<Integer> MANAGER_PORT = new ConfigParameter<>("LONGHORN_MANAGER_PORT", PORT, "8500", CONFIG_VALUES);
    public static final ConfigParameter<Integer> HEALTH_CHECK_PORT = new ConfigParameter<>("LONGHORN_HEALTH_CHECK_PORT", PORT, "8081", CONFIG_VALUES);

    private final Map<String, Object> map;

    private InstanceManagerOperatorConfig(Map<String, Object> map) {
        this.map = map;
    }

    /**
     * Loads the configuration from a map. Keys which are not configuration parameters are ignored.
     *
     * @param map   Map with the configuration, usually the environment variables
     *
     * @return  Instance Manager Operator configuration
     */
    public static InstanceManagerOperatorConfig buildFromMap(Map<String, String> map) {
        Map<String, String> envMap = new HashMap<>(map);
        envMap.keySet().retainAll(InstanceManagerOperatorConfig.keyNames());

        Map<String, Object> generatedMap = ConfigParameter.define(envMap, CONFIG_VALUES);

        return new InstanceManagerOperatorConfig(generatedMap);
    }

    /**
     * @return  Set of the names of all configuration parameters
     */
    public static Set<String> keyNames() {
        return Collections.unmodifiableSet(CONFIG_VALUES.keySet());
    }

    /**
     * Gets the value of a configuration parameter
     *
     * @param value     The configuration parameter
     * @param <T>       Type of the value
     *
     * @return  The parsed value
     */
    @SuppressWarnings("unchecked")
    public <T> T get(ConfigParameter<T> value) {
        return (T) this.map.get(value.key());
    }

    public String getNamespace() {
        return get(NAMESPACE);
    }

    public String getControllerId() {
        return get(CONTROLLER_ID);
    }

    public int getControllerThreadPoolSize() {
        return get(CONTROLLER_THREAD_POOL_SIZE);
    }

    public int getWorkQueueSize() {
        return get(WORK_QUEUE_SIZE);
    }

    public long getReconciliationIntervalMs() {
        return get(RECONCILIATION_INTERVAL_MS);
    }

    public int getMaxRetries() {
        return get(MAX_RETRIES);
    }

    public long getWatchReconnectIntervalMs() {
        return get(WATCH_RECONNECT_INTERVAL_MS);
    }

    public long getUpdateRetryIntervalMs() {
        return get(UPDATE_RETRY_INTERVAL_MS);
    }

    public int getManagerPort() {
        return get(MANAGER_PORT);
    }

    public int getHealthCheckPort() {
        return get(HEALTH_CHECK_PORT);
    }

    @Override
    public String toString() {
        return "InstanceManagerOperatorConfig(" +
                "namespace=" + getNamespace() +
                ",controllerId=" + getControllerId() +
                ",controllerThreadPoolSize=" + getControllerThreadPoolSize() +
                ",workQueueSize=" + getWorkQueueSize() +
                ",reconciliationIntervalMs=" + getReconciliationIntervalMs() +
                ",maxRetries=" + getMaxRetries() +
                ",watchReconnectIntervalMs=" + getWatchReconnectIntervalMs() +
                ",updateRetryIntervalMs=" + getUpdateRetryIntervalMs() +
                ",managerPort=" + getManagerPort() +
                ",healthCheckPort=" + getHealthCheckPort() +
                ")";
    }
}
