package in.alphamine.bootstrap;

import in.alphamine.application.service.BatchSimulationOrchestrator;
import in.alphamine.application.service.BoundedWorkerPool;
import in.alphamine.application.service.MiningService;
import in.alphamine.application.service.RunReports;
import in.alphamine.application.service.SubmissionService;
import in.alphamine.config.AppConfig;
import in.alphamine.config.BrainClientConfig;
import in.alphamine.domain.simulation.Alpha;
import in.alphamine.domain.simulation.SimulationRequest;
import in.alphamine.domain.simulation.SimulationSettings;
import in.alphamine.domain.simulation.SubmissionCriteria;
import in.alphamine.infrastructure.brain.ResilientBrainClient;
import in.alphamine.infrastructure.brain.common.RetryPolicy;
import in.alphamine.infrastructure.brain.common.Sleeper;
import in.alphamine.infrastructure.brain.job.JobPoller;
import in.alphamine.infrastructure.brain.job.PollingProfile;
import in.alphamine.infrastructure.brain.metrics.PrometheusMetricsHandler;
import in.alphamine.infrastructure.brain.metrics.PrometheusSimulationMetrics;
import in.alphamine.infrastructure.persistence.JsonReportStore;
import in.alphamine.service.analysis.ResultAggregator;
import in.alphamine.service.validation.ExpressionValidator;
import in.alphamine.service.variation.ParameterVariationEngine;
import in.alphamine.service.variation.VariationOptions;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point. Configuration comes from the environment.
 *
 * Run modes:
 * - MINE: vary the numeric parameters of BASE_EXPRESSION and simulate every variant
 * - SIMULATE: simulate EXPRESSIONS in every region of REGIONS
 * - SUBMIT: find qualifying unsubmitted alphas and submit them
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== alphamine starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        BrainClientConfig brainConfig = BrainClientConfig.fromEnv();
        AppConfig appConfig = AppConfig.fromEnv();
        StartupConfigValidator.validate(brainConfig, appConfig);

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        CollectorRegistry registry = new CollectorRegistry();
        PrometheusSimulationMetrics metrics = new PrometheusSimulationMetrics(registry);
        Undertow metricsServer = null;
        if (appConfig.metricsEnabled()) {
            metricsServer = Undertow.builder()
                .addHttpListener(appConfig.metricsPort(), "0.0.0.0")
                .setHandler(Handlers.path().addPrefixPath("/metrics", new PrometheusMetricsHandler(registry)))
                .build();
            metricsServer.start();
            log.info("✓ Metrics on http://localhost:{}/metrics", appConfig.metricsPort());
        }

        // ═══════════════════════════════════════════════════════════════
        // Platform client
        // ═══════════════════════════════════════════════════════════════
        ResilientBrainClient client = new ResilientBrainClient(
            brainConfig, RetryPolicy.fromConfig(brainConfig), metrics, Sleeper.SYSTEM);
        client.authenticate();
        JobPoller poller = new JobPoller(client, metrics, Sleeper.SYSTEM);

        JsonReportStore reports = new JsonReportStore(Path.of(appConfig.outputDir()));
        ExpressionValidator validator = new ExpressionValidator();
        ResultAggregator aggregator = new ResultAggregator();

        try (BoundedWorkerPool pool = new BoundedWorkerPool("brain-worker")) {
            BatchSimulationOrchestrator orchestrator = new BatchSimulationOrchestrator(
                client, poller, validator, pool, PollingProfile.forSimulation(), metrics);

            switch (appConfig.runMode()) {
                case "MINE" -> {
                    MiningService mining = new MiningService(new ParameterVariationEngine(), orchestrator, aggregator);
                    VariationOptions options = VariationOptions.DEFAULT
                        .withRange(appConfig.variationRange())
                        .withMaxVariations(appConfig.maxVariations());
                    SimulationSettings settings = SimulationSettings.DEFAULT
                        .withRegion(appConfig.region())
                        .withUniverse(appConfig.universe());
                    MiningService.MiningReport report = mining.mine(appConfig.baseExpression(), settings, options,
                        SubmissionCriteria.defaults(), appConfig.maxConcurrentSimulations());
                    reports.save("mining_results", RunReports.mining(report));
                }
                case "SIMULATE" -> {
                    SimulationSettings settings = SimulationSettings.DEFAULT.withUniverse(appConfig.universe());
                    List<SimulationRequest> requests = appConfig.expressions().stream()
                        .map(expression -> new SimulationRequest(expression, settings))
                        .toList();
                    reports.save("simulation_results", RunReports.regions(
                        orchestrator.simulateMultipleRegions(requests, appConfig.regions(),
                            appConfig.maxConcurrentSimulations())));
                }
                case "SUBMIT" -> {
                    SubmissionService submissions = new SubmissionService(client, poller, pool);
                    SubmissionCriteria criteria = SubmissionCriteria.defaults();
                    List<Alpha> candidates = submissions.findCandidates(criteria, 100, 30);
                    reports.save("submission_results", RunReports.submissions(
                        submissions.submitAll(candidates, criteria, appConfig.maxConcurrentSubmissions())));
                }
                default -> throw new IllegalStateException("Unknown run mode " + appConfig.runMode());
            }
        } finally {
            if (metricsServer != null) {
                metricsServer.stop();
            }
        }

        log.info("=== alphamine finished ===");
    }

    private App() {}
}
