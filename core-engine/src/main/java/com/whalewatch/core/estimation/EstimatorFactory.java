package com.whalewatch.core.estimation;

import com.whalewatch.core.config.EstimatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Creates estimators from the sections of an {@link EstimatorConfig}.
 *
 * <p>
 * Whole-config validation belongs to the caller, typically once at start-up
 * via {@link EstimatorConfig#validate()}. Each estimator constructor still
 * rejects parameters it cannot work with.
 * </p>
 *
 * @since 1.0.0
 */
public final class EstimatorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(EstimatorFactory.class);

    private EstimatorFactory() {
        // utility class: not instantiable
    }

    public static DensityGridEstimator densityGrid(EstimatorConfig.GridSettings settings) {
        Objects.requireNonNull(settings, "GridSettings must not be null");
        return new DensityGridEstimator(settings.getScale());
    }

    public static AreaBootstrapEstimator areaBootstrap(EstimatorConfig.BootstrapSettings settings) {
        Objects.requireNonNull(settings, "BootstrapSettings must not be null");
        if (settings.getSeed() != null) {
            LOG.info("Area bootstrap seeded with {}; results are repeatable", settings.getSeed());
        }
        return new AreaBootstrapEstimator(
                settings.getDailyRange(),
                settings.getPointRadius(),
                settings.getTrials(),
                settings.getSeed());
    }

    public static PodClassifier podClassifier(EstimatorConfig.ClassifierSettings settings) {
        Objects.requireNonNull(settings, "ClassifierSettings must not be null");
        return new PodClassifier(settings.getCategories(), settings.getDailyRange());
    }

    public static InterArrivalTimeEstimator interArrival() {
        return new InterArrivalTimeEstimator();
    }
}
