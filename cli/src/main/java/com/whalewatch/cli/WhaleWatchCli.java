package com.whalewatch.cli;

import com.whalewatch.core.SightingAnalyzer;
import com.whalewatch.core.config.EstimatorConfig;
import com.whalewatch.core.config.EstimatorConfigLoader;
import com.whalewatch.core.error.InvalidConfigurationException;
import com.whalewatch.core.source.CsvSightingSource;
import com.whalewatch.core.source.InMemorySightingSource;
import com.whalewatch.core.source.SightingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Main entry point of the Whale Watch console.
 *
 * <h3>Start-up</h3>
 *
 * <pre>
 *   CliConfig (environment)
 *     → EstimatorConfig (YAML)
 *     → load sightings and history once into memory
 *     → InteractiveSession on stdin/stdout
 *     → optional JSON report
 * </pre>
 *
 * <p>
 * Exit status is {@code 0} after a session, {@code 2} for unusable
 * configuration and {@code 1} when the data cannot be loaded.
 * </p>
 *
 * @since 1.0.0
 */
public final class WhaleWatchCli {

    private static final Logger LOG = LoggerFactory.getLogger(WhaleWatchCli.class);

    private WhaleWatchCli() {
        // entry-point class: not instantiable
    }

    public static void main(String[] args) {
        int status = run(System.getenv(),
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Resolve the CLI settings from {@code env}, then run one session.
     *
     * @return process exit status
     */
    static int run(Map<String, String> env, BufferedReader in, PrintStream out) {
        CliConfig config;
        try {
            config = CliConfig.fromEnvironment(env);
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid CLI configuration: {}", e.getMessage());
            out.println("Invalid configuration: " + e.getMessage());
            return 2;
        }
        return run(config, in, out);
    }

    /**
     * Run one session.
     *
     * @return process exit status
     */
    static int run(CliConfig config, BufferedReader in, PrintStream out) {
        LOG.info("Starting Whale Watch with config: {}", config);

        EstimatorConfig estimatorConfig;
        try {
            estimatorConfig = EstimatorConfigLoader.load(config.getConfigPath());
        } catch (InvalidConfigurationException e) {
            LOG.error("Invalid estimator configuration: {}", e.getMessage());
            out.println("Invalid configuration: " + e.getMessage());
            return 2;
        }

        SightingAnalyzer analyzer;
        try {
            SightingSource sightings = InMemorySightingSource.snapshotOf(
                    CsvSightingSource.fromFile(config.getSightingsPath()));
            SightingSource history = config.hasSeparateHistory()
                    ? InMemorySightingSource.snapshotOf(CsvSightingSource.fromFile(config.getHistoryPath()))
                    : sightings;
            analyzer = new SightingAnalyzer(sightings, history, estimatorConfig);
        } catch (RuntimeException e) {
            LOG.error("Unable to load sightings: {}", e.getMessage(), e);
            out.println("Unable to load sightings: " + e.getMessage());
            return 1;
        }

        SessionReport report = new InteractiveSession(analyzer, in, out).run();
        config.getReportPath().ifPresent(path -> new ReportWriter().write(report, path));
        return 0;
    }
}
