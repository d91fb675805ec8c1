package com.whalewatch.core.config;

import com.whalewatch.core.error.InvalidConfigurationException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Top-level POJO for the estimator YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key optional, defaults shown):
 * </p>
 *
 * <pre>
 * grid:
 *   scale: 100
 * bootstrap:
 *   dailyRange: 1.0
 *   pointRadius: 0.01
 *   trials: 100000
 *   seed: 42
 * classifier:
 *   dailyRange: 1.0
 *   categories: [J, K, L]
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every section.
 * </p>
 *
 * @since 1.0.0
 */
public class EstimatorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private GridSettings grid = new GridSettings();
    private BootstrapSettings bootstrap = new BootstrapSettings();
    private ClassifierSettings classifier = new ClassifierSettings();

    /** @return configuration with every default applied */
    public static EstimatorConfig defaults() {
        return new EstimatorConfig();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate all sections, collecting every problem before failing.
     *
     * @throws InvalidConfigurationException if any value is illegal
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (grid == null) {
            errors.add("'grid' section must not be null");
        } else if (!(grid.getScale() > 0)) {
            errors.add("grid.scale must be > 0, got: " + grid.getScale());
        }

        if (bootstrap == null) {
            errors.add("'bootstrap' section must not be null");
        } else {
            if (!(bootstrap.getDailyRange() > 0)) {
                errors.add("bootstrap.dailyRange must be > 0, got: " + bootstrap.getDailyRange());
            }
            if (!(bootstrap.getPointRadius() > 0)) {
                errors.add("bootstrap.pointRadius must be > 0, got: " + bootstrap.getPointRadius());
            }
            if (bootstrap.getTrials() < 1) {
                errors.add("bootstrap.trials must be >= 1, got: " + bootstrap.getTrials());
            }
        }

        if (classifier == null) {
            errors.add("'classifier' section must not be null");
        } else {
            if (!(classifier.getDailyRange() > 0)) {
                errors.add("classifier.dailyRange must be > 0, got: " + classifier.getDailyRange());
            }
            List<String> categories = classifier.getCategories();
            if (categories.isEmpty()) {
                errors.add("classifier.categories must not be empty");
            } else if (categories.stream().anyMatch(c -> c == null || c.isBlank())) {
                errors.add("classifier.categories must not contain blank entries");
            } else if (new LinkedHashSet<>(categories).size() != categories.size()) {
                errors.add("classifier.categories must not contain duplicates: " + categories);
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException(
                    "Estimator configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public GridSettings getGrid() {
        return grid;
    }

    public void setGrid(GridSettings grid) {
        this.grid = grid;
    }

    public BootstrapSettings getBootstrap() {
        return bootstrap;
    }

    public void setBootstrap(BootstrapSettings bootstrap) {
        this.bootstrap = bootstrap;
    }

    public ClassifierSettings getClassifier() {
        return classifier;
    }

    public void setClassifier(ClassifierSettings classifier) {
        this.classifier = classifier;
    }

    @Override
    public String toString() {
        return "EstimatorConfig{grid=" + grid + ", bootstrap=" + bootstrap
                + ", classifier=" + classifier + '}';
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /** Density grid settings. */
    public static class GridSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        /** Bins per degree; 100 gives cells of roughly 1.1 km. */
        private double scale = 100;

        public double getScale() {
            return scale;
        }

        public void setScale(double scale) {
            this.scale = scale;
        }

        @Override
        public String toString() {
            return "GridSettings{scale=" + scale + '}';
        }
    }

    /** Area-bootstrap settings. */
    public static class BootstrapSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        /** Half-width in degrees of the area a whale can cover in a day. */
        private double dailyRange = 1.0;

        /** Half-width in degrees of the square each sighting is inflated to. */
        private double pointRadius = 0.01;

        private int trials = 100_000;

        /** Optional seed; {@code null} means a freshly seeded generator. */
        private Long seed;

        public double getDailyRange() {
            return dailyRange;
        }

        public void setDailyRange(double dailyRange) {
            this.dailyRange = dailyRange;
        }

        public double getPointRadius() {
            return pointRadius;
        }

        public void setPointRadius(double pointRadius) {
            this.pointRadius = pointRadius;
        }

        public int getTrials() {
            return trials;
        }

        public void setTrials(int trials) {
            this.trials = trials;
        }

        public Long getSeed() {
            return seed;
        }

        public void setSeed(Long seed) {
            this.seed = seed;
        }

        @Override
        public String toString() {
            return "BootstrapSettings{" +
                    "dailyRange=" + dailyRange +
                    ", pointRadius=" + pointRadius +
                    ", trials=" + trials +
                    ", seed=" + seed +
                    '}';
        }
    }

    /** Pod classifier settings. */
    public static class ClassifierSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        private double dailyRange = 1.0;

        private List<String> categories = new ArrayList<>(List.of("J", "K", "L"));

        public double getDailyRange() {
            return dailyRange;
        }

        public void setDailyRange(double dailyRange) {
            this.dailyRange = dailyRange;
        }

        /** @return unmodifiable list of category codes in enumeration order */
        public List<String> getCategories() {
            return Collections.unmodifiableList(categories);
        }

        public void setCategories(List<String> categories) {
            this.categories = categories != null ? new ArrayList<>(categories) : new ArrayList<>();
        }

        @Override
        public String toString() {
            return "ClassifierSettings{dailyRange=" + dailyRange + ", categories=" + categories + '}';
        }
    }
}
