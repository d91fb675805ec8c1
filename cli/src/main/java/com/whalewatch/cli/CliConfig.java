package com.whalewatch.cli;

import java.io.Serializable;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed, immutable settings for the interactive shell.
 *
 * <p>
 * Values are resolved from environment variables. Use
 * {@link #fromEnvironment()} at start-up, or the {@link Builder} in tests.
 * The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><td>{@value #ENV_SIGHTINGS_PATH}</td><td>cleaned sightings file
 * (required)</td></tr>
 * <tr><td>{@value #ENV_HISTORY_PATH}</td><td>full history file for waiting
 * times; defaults to the sightings file</td></tr>
 * <tr><td>{@value #ENV_CONFIG_PATH}</td><td>estimator YAML file</td></tr>
 * <tr><td>{@value #ENV_REPORT_PATH}</td><td>where to write the JSON session
 * report</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class CliConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ENV_SIGHTINGS_PATH = "WHALEWATCH_SIGHTINGS_PATH";
    public static final String ENV_HISTORY_PATH = "WHALEWATCH_HISTORY_PATH";
    public static final String ENV_CONFIG_PATH = "WHALEWATCH_CONFIG_PATH";
    public static final String ENV_REPORT_PATH = "WHALEWATCH_REPORT_PATH";

    private final String sightingsPath;
    private final String historyPath;
    private final String configPath;
    private final String reportPath;

    private CliConfig(Builder b) {
        this.sightingsPath = b.sightingsPath;
        this.historyPath = b.historyPath;
        this.configPath = b.configPath;
        this.reportPath = b.reportPath;
    }

    /**
     * Build a {@link CliConfig} from environment variables.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if the sightings path is missing
     */
    public static CliConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link CliConfig} from the given variables.
     *
     * @param env variable name to value
     * @return validated configuration
     * @throws IllegalArgumentException if the sightings path is missing
     */
    public static CliConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        return new Builder()
                .sightingsPath(env(env, ENV_SIGHTINGS_PATH, ""))
                .historyPath(env(env, ENV_HISTORY_PATH, ""))
                .configPath(env(env, ENV_CONFIG_PATH, ""))
                .reportPath(env(env, ENV_REPORT_PATH, ""))
                .build();
    }

    public Path getSightingsPath() {
        return Path.of(sightingsPath);
    }

    /** @return the history file, or the sightings file when none is set */
    public Path getHistoryPath() {
        return historyPath.isBlank() ? getSightingsPath() : Path.of(historyPath);
    }

    public boolean hasSeparateHistory() {
        return !historyPath.isBlank();
    }

    /** @return estimator config path, empty string when unset */
    public String getConfigPath() {
        return configPath;
    }

    public Optional<Path> getReportPath() {
        return reportPath.isBlank() ? Optional.empty() : Optional.of(Path.of(reportPath));
    }

    /**
     * Fluent builder for {@link CliConfig}.
     */
    public static class Builder {
        private String sightingsPath = "";
        private String historyPath = "";
        private String configPath = "";
        private String reportPath = "";

        public Builder sightingsPath(String v) {
            this.sightingsPath = v;
            return this;
        }

        public Builder historyPath(String v) {
            this.historyPath = v;
            return this;
        }

        public Builder configPath(String v) {
            this.configPath = v;
            return this;
        }

        public Builder reportPath(String v) {
            this.reportPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link CliConfig}
         * @throws IllegalArgumentException if the sightings path is blank
         */
        public CliConfig build() {
            if (sightingsPath == null || sightingsPath.isBlank()) {
                throw new IllegalArgumentException(
                        "sightingsPath must not be null or blank; set " + ENV_SIGHTINGS_PATH);
            }
            historyPath = historyPath == null ? "" : historyPath;
            configPath = configPath == null ? "" : configPath;
            reportPath = reportPath == null ? "" : reportPath;
            return new CliConfig(this);
        }
    }

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "CliConfig{" +
                "sightingsPath='" + sightingsPath + '\'' +
                ", historyPath='" + historyPath + '\'' +
                ", configPath='" + configPath + '\'' +
                ", reportPath='" + reportPath + '\'' +
                '}';
    }
}
