package com.qqsuccubus.autoscale.controller;

import com.qqsuccubus.autoscale.controller.config.AutoscalerConfig;
import com.qqsuccubus.autoscale.controller.http.HttpServer;
import com.qqsuccubus.autoscale.controller.k8s.ILeaderElection;
import com.qqsuccubus.autoscale.controller.k8s.KubernetesOrchestratorClient;
import com.qqsuccubus.autoscale.controller.k8s.LeaderElectionService;
import com.qqsuccubus.autoscale.controller.metrics.PrometheusMetricsExporter;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.DisposableServer;

public class AutoscalerApp {
    private static final Logger log = LoggerFactory.getLogger(AutoscalerApp.class);

    public static void main(String[] args) {
        AutoscalerConfig config = AutoscalerConfig.fromEnv();

        log.info("Starting Replica Autoscaler {}", config.getNodeId());
        log.info("  Thresholds: {}..{}%", config.getPercentageMin(), config.getPercentageMax());
        log.info("  Intervals: refresh={}, evaluation={}", config.getRefreshInterval(), config.getEvaluationInterval());
        log.info("  Metrics source: {}", config.getMetricsSource());
        log.info("  Namespace: {}", config.getKubernetesNamespace());
        log.info("  Event bus: {}", config.isEventBusEnabled() ? config.getEventBusBootstrap() : "disabled");
        log.info("  History store: {}", config.getHistoryStore());
        log.info("  Leader Election: {}", config.isEnableLeaderElection());
        if (config.isDryRun()) {
            log.warn("  DRY-RUN enabled: decisions are recorded but never applied");
        }

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());

        KubernetesClient kubernetesClient = KubernetesOrchestratorClient.createClient(config);
        KubernetesOrchestratorClient orchestrator = new KubernetesOrchestratorClient(kubernetesClient, config);

        LeaderElectionService leaderElectionService = null;
        ILeaderElection leaderElection = ILeaderElection.ALWAYS;
        if (config.isEnableLeaderElection()) {
            String leaseNamespace = config.isAllNamespaces() ? "default" : config.getKubernetesNamespace();
            leaderElectionService = new LeaderElectionService(kubernetesClient, leaseNamespace, config.getNodeId());
            leaderElectionService.start();
            leaderElection = leaderElectionService;
        }

        AutoscalerContext context = AutoscalerContext.create(
            config, orchestrator, leaderElection, metricsExporter.getRegistry());

        HttpServer httpServer = new HttpServer(config, context, metricsExporter);
        DisposableServer disposableServer = httpServer.start();

        context.start();

        log.info("Replica Autoscaler is ready");

        handleShutDown(context, httpServer, leaderElectionService, metricsExporter);

        disposableServer.onDispose().block();
    }

    private static void handleShutDown(
        AutoscalerContext context,
        HttpServer httpServer,
        LeaderElectionService leaderElectionService,
        PrometheusMetricsExporter metricsExporter
    ) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            // Finish the running tick while still holding the lease
            context.getEngine().stop();

            if (leaderElectionService != null) {
                leaderElectionService.stop();
            }

            context.close();

            httpServer.stop();

            metricsExporter.close();

            log.info("Shutdown complete");
        }));
    }
}
