/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.longhorn.api.Crds;
import io.longhorn.api.model.InstanceManager;
import io.longhorn.operator.common.InformerUtils;
import io.longhorn.operator.common.MetricsProvider;
import io.longhorn.operator.common.ReconciliationLogger;
import io.longhorn.operator.common.Util;
import io.longhorn.operator.common.controller.AbstractControllerLoop;
import io.longhorn.operator.common.controller.ControllerQueue;
import io.longhorn.operator.common.controller.ReconciliationLockManager;
import io.longhorn.operator.common.controller.SimplifiedReconciliation;
import io.longhorn.operator.common.http.Liveness;
import io.longhorn.operator.common.http.Readiness;
import io.longhorn.operator.instancemanager.model.InstanceManagerPods;
import io.longhorn.operator.instancemanager.process.ProcessManagerClientFactory;
import io.longhorn.operator.instancemanager.process.ProcessWatchRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Instance manager controller is responsible for queueing the reconciliations of the instance managers. It does so
 * by watching the instance managers and their pods and by triggering periodic reconciliations. The actual processing
 * is done by the controller loops. The controller also owns the process watches of the instance managers running on
 * its node.
 */
public class InstanceManagerController implements Liveness, Readiness {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(InstanceManagerController.class);
    private static final String RESOURCE_KIND = InstanceManager.RESOURCE_KIND;
    private static final long DEFAULT_RESYNC_PERIOD_MS = 5 * 60 * 1_000L; // 5 minutes by default
    /*test*/ static final long RETRY_DELAY_MS = 500L;

    private final InstanceManagerMetricsHolder metrics;
    private final ControllerQueue workQueue;
    private final List<InstanceManagerControllerLoop> threadPool;
    private final ProcessWatchRegistry watchRegistry;

    private final String watchedNamespace;
    private final long reconcileIntervalMs;

    private final SharedIndexInformer<InstanceManager> instanceManagerInformer;
    private final SharedIndexInformer<Pod> podInformer;

    private final ScheduledExecutorService scheduledExecutor;

    /**
     * Creates the instance manager controller for a single namespace
     *
     * @param config            Instance Manager Operator configuration
     * @param client            Kubernetes client
     * @param clientFactory     Factory for the clients of the management daemons
     * @param metricsProvider   Metrics provider for handling metrics
     */
    public InstanceManagerController(
            InstanceManagerOperatorConfig config,
            KubernetesClient client,
            ProcessManagerClientFactory clientFactory,
            MetricsProvider metricsProvider) {

        this.watchedNamespace = config.getNamespace();
        this.reconcileIntervalMs = config.getReconciliationIntervalMs();

        // Set up the metrics holder
        this.metrics = new InstanceManagerMetricsHolder(RESOURCE_KIND, metricsProvider);

        // Creates the scheduled executor service used for periodical reconciliations, retries and progress warnings
        this.scheduledExecutor = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "InstanceManagerControllerScheduledExecutor"));

        // Set up the work queue
        this.workQueue = new ControllerQueue(config.getWorkQueueSize(), config.getMaxRetries(), RETRY_DELAY_MS, this.metrics, scheduledExecutor);

        // Informers are used to get events about instance managers and their pods
        this.instanceManagerInformer = Crds.instanceManagerOperation(client).inNamespace(watchedNamespace).runnableInformer(DEFAULT_RESYNC_PERIOD_MS);
        this.podInformer = client.pods().inNamespace(watchedNamespace).runnableInformer(DEFAULT_RESYNC_PERIOD_MS);

        // The reconciliation logic
        InstanceManagerStore store = new InstanceManagerStore(client, watchedNamespace);
        this.watchRegistry = new ProcessWatchRegistry(metrics.activeProcessWatches(watchedNamespace));
        PodLifecycleDriver podLifecycleDriver = new PodLifecycleDriver(store, watchRegistry, clientFactory, config.getControllerId(),
                config.getManagerPort(), config.getWatchReconnectIntervalMs(), config.getUpdateRetryIntervalMs());
        InstanceManagerReconciler reconciler = new InstanceManagerReconciler(store, new OwnershipResolver(store, config.getControllerId()), podLifecycleDriver, watchRegistry);

        // Create the reconciliation lock manager
        ReconciliationLockManager lockManager = new ReconciliationLockManager();

        // Create a thread pool for the reconciliation loops and add the reconciliation loops
        this.threadPool = new ArrayList<>(config.getControllerThreadPoolSize());
        for (int i = 0; i < config.getControllerThreadPoolSize(); i++)  {
            threadPool.add(new InstanceManagerControllerLoop(RESOURCE_KIND + "-ControllerLoop-" + i, workQueue, lockManager, scheduledExecutor, reconciler, metrics));
        }
    }

    /**
     * Enqueues an instance manager based on an event from the InstanceManager informer
     *
     * @param instanceManager   Instance manager which triggered the event
     * @param action            Type of the event
     */
    private void enqueueInstanceManager(InstanceManager instanceManager, String action) {
        LOGGER.debugOp("{} {} in namespace {} was {}", RESOURCE_KIND, instanceManager.getMetadata().getName(), instanceManager.getMetadata().getNamespace(), action);
        workQueue.enqueue(new SimplifiedReconciliation(RESOURCE_KIND, instanceManager.getMetadata().getNamespace(), instanceManager.getMetadata().getName()));
    }

    /**
     * Enqueues the instance manager of a pod. The pod has the same name as its instance manager.
     *
     * @param pod       Pod which triggered the event
     * @param action    Type of the event
     */
    private void enqueueInstanceManagerPod(Pod pod, String action) {
        if (!InstanceManagerPods.isInstanceManagerPod(pod)) {
            return;
        }

        String namespace = pod.getMetadata().getNamespace();
        String name = pod.getMetadata().getName();
        LOGGER.debugOp("Pod {} in namespace {} was {}", name, namespace, action);

        if (instanceManagerInformer.getIndexer().getByKey(namespace + "/" + name) == null) {
            LOGGER.warnOp("Can't find instance manager for pod {}, may be deleted", name);
            return;
        }

        workQueue.enqueue(new SimplifiedReconciliation(RESOURCE_KIND, namespace, name));
    }

    /**
     * Indicates that the informers have been synced and are up-to-date.
     *
     * @return  True when all informers are synced. False otherwise.
     */
    protected boolean isSynced() {
        return instanceManagerInformer.hasSynced() && podInformer.hasSynced();
    }

    /**
     * Stops the controller, its controller loop threads and the process watches
     */
    protected void stop() {
        LOGGER.infoOp("Stopping scheduled executor service");
        scheduledExecutor.shutdownNow(); // We do not wait for termination

        LOGGER.infoOp("Stopping Instance Manager Controller loops");
        threadPool.forEach(t -> {
            try {
                t.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.warnOp("Interrupted while stopping a controller loop");
            }
        });

        LOGGER.infoOp("Stopping process watches");
        watchRegistry.stopAll();

        // The informers are stopped last, because the controller loops and the watches might still be using them
        InformerUtils.stopAll(5_000L, instanceManagerInformer, podInformer);
    }

    /**
     * Starts the controller: its informers, its loop threads etc.
     */
    protected void start() {
        this.instanceManagerInformer.addEventHandler(new InstanceManagerEventHandler());
        this.instanceManagerInformer.exceptionHandler((isStarted, throwable) -> InformerUtils.loggingExceptionHandler(RESOURCE_KIND, isStarted, throwable));

        this.podInformer.addEventHandler(new PodEventHandler());
        this.podInformer.exceptionHandler((isStarted, throwable) -> InformerUtils.loggingExceptionHandler("Pod", isStarted, throwable));

        LOGGER.infoOp("Starting the InstanceManager informer");
        instanceManagerInformer.start();

        LOGGER.infoOp("Starting the Pod informer");
        podInformer.start();

        while (!isSynced())   {
            LOGGER.infoOp("Waiting for the informers to sync");
            if (!Util.sleep(1_000)) {
                LOGGER.warnOp("Interrupted while waiting for the informers to sync");
                return;
            }
        }

        // Start the controller loop threads => they should be started only after the informers are synced
        LOGGER.infoOp("Starting Instance Manager Controller loops");
        threadPool.forEach(AbstractControllerLoop::start);

        // Configure the periodic reconciliation
        schedulePeriodicReconciliations();
    }

    /**
     * Indicates whether the controller is ready or not. It is considered ready, when all controllers are running.
     *
     * @return  True when the controller is ready, false otherwise
     */
    @Override
    public boolean isReady()    {
        boolean ready = true;

        for (InstanceManagerControllerLoop t : threadPool) {
            ready &= t.isRunning();
        }

        return ready;
    }

    /**
     * Indicates whether the controller is alive or not. It is considered alive when all controller loop threads and
     * informers are alive.
     *
     * @return  True when the controller is alive, false otherwise
     */
    @Override
    public boolean isAlive()    {
        boolean alive = true;

        for (InstanceManagerControllerLoop t : threadPool) {
            alive &= t.isAlive();
        }

        alive &= instanceManagerInformer.isRunning();
        alive &= podInformer.isRunning();

        return alive;
    }

    /**
     * @return  The registry with the process watches of this controller
     */
    /*test*/ ProcessWatchRegistry watchRegistry() {
        return watchRegistry;
    }

    /**
     * Schedules the periodic reconciliation triggers
     */
    private void schedulePeriodicReconciliations()  {
        scheduledExecutor.scheduleAtFixedRate(new PeriodicReconciliation(), reconcileIntervalMs, reconcileIntervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Internal timer task which enqueues all instance managers known to the informer
     */
    class PeriodicReconciliation implements Runnable  {
        @Override
        public void run() {
            LOGGER.infoOp("Triggering periodic reconciliation of {} resources for namespace {}", RESOURCE_KIND, watchedNamespace);
            metrics.periodicReconciliationsCounter(watchedNamespace).increment();

            for (InstanceManager instanceManager : instanceManagerInformer.getIndexer().list()) {
                workQueue.enqueue(new SimplifiedReconciliation(RESOURCE_KIND, instanceManager.getMetadata().getNamespace(), instanceManager.getMetadata().getName(), "timer"));
            }
        }
    }

    /**
     * Event handler used in the InstanceManager informer
     */
    private class InstanceManagerEventHandler implements ResourceEventHandler<InstanceManager> {
        @Override
        public void onAdd(InstanceManager instanceManager) {
            metrics.resourceCounter(watchedNamespace).incrementAndGet();
            enqueueInstanceManager(instanceManager, "ADDED");
        }

        @Override
        public void onUpdate(InstanceManager oldInstanceManager, InstanceManager newInstanceManager) {
            enqueueInstanceManager(newInstanceManager, "MODIFIED");
        }

        @Override
        public void onDelete(InstanceManager instanceManager, boolean deletedFinalStateUnknown) {
            metrics.resourceCounter(watchedNamespace).decrementAndGet();
            enqueueInstanceManager(instanceManager, "DELETED");
        }
    }

    /**
     * Event handler used in the Pod informer. Only pods running an instance manager daemon are considered.
     */
    private class PodEventHandler implements ResourceEventHandler<Pod> {
        @Override
        public void onAdd(Pod pod) {
            enqueueInstanceManagerPod(pod, "ADDED");
        }

        @Override
        public void onUpdate(Pod oldPod, Pod newPod) {
            enqueueInstanceManagerPod(newPod, "MODIFIED");
        }

        @Override
        public void onDelete(Pod pod, boolean deletedFinalStateUnknown) {
            enqueueInstanceManagerPod(pod, "DELETED");
        }
    }
}
