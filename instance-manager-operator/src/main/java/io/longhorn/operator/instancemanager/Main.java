/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.longhorn.operator.common.MetricsProvider;
import io.longhorn.operator.common.MicrometerMetricsProvider;
import io.longhorn.operator.common.OperatorKubernetesClientBuilder;
import io.longhorn.operator.common.Util;
import io.longhorn.operator.common.http.HealthCheckAndMetricsServer;
import io.longhorn.operator.instancemanager.process.HttpProcessManagerClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The main class of the Longhorn Instance Manager Operator
 */
public class Main {
    private static final Logger LOGGER = LogManager.getLogger(Main.class);

    /**
     * Main method which starts the webserver with healthchecks and metrics and the InstanceManagerController which is
     * responsible for handling the instance managers of this node
     *
     * @param args  Startup arguments
     */
    public static void main(String[] args) {
        String version = Main.class.getPackage().getImplementationVersion();
        LOGGER.info("InstanceManagerOperator {} is starting", version);

        // Log environment information
        Util.printEnvInfo("LONGHORN_");

        InstanceManagerOperatorConfig config = InstanceManagerOperatorConfig.buildFromMap(System.getenv());
        LOGGER.info("InstanceManagerOperator configuration is {}", config);

        KubernetesClient client = new OperatorKubernetesClientBuilder("longhorn-instance-manager-operator", version).build(config.getNamespace());
        MetricsProvider metricsProvider = createMetricsProvider();

        InstanceManagerController controller = new InstanceManagerController(
                config,
                client,
                HttpProcessManagerClient.factory(config.getManagerPort()),
                metricsProvider
        );

        HealthCheckAndMetricsServer healthCheckAndMetricsServer = new HealthCheckAndMetricsServer(config.getHealthCheckPort(), controller, controller, metricsProvider);

        healthCheckAndMetricsServer.start();
        controller.start();

        LOGGER.info("Registering shutdown hook");
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Requesting controller to stop");
            controller.stop();

            LOGGER.info("Requesting health check and metrics server to stop");
            healthCheckAndMetricsServer.stop();

            LOGGER.info("Requesting Kubernetes client to stop");
            client.close();

            LOGGER.info("Shutdown complete");
        }));
    }

    /**
     * Creates the MetricsProvider instance based on a PrometheusMeterRegistry and binds the JVM metrics to it
     *
     * @return  MetricsProvider instance
     */
    private static MetricsProvider createMetricsProvider()  {
        MeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new ClassLoaderMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        return new MicrometerMetricsProvider(registry);
    }
}
