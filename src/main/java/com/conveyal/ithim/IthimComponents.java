package com.conveyal.ithim;

import com.conveyal.ithim.burden.BurdenAggregator;
import com.conveyal.ithim.burden.ModelComparator;
import com.conveyal.ithim.exposure.ExposureScenario;
import com.conveyal.ithim.exposure.MetExposureSimulator;
import com.conveyal.ithim.exposure.QuantileResolver;
import com.conveyal.ithim.exposure.StratumRandomSource;
import com.conveyal.ithim.model.ScenarioParameters;
import com.conveyal.ithim.risk.AttributableFractionEngine;
import com.conveyal.ithim.risk.DoseResponseModel;

/**
 * Manually wires up the components of the model from a single configuration, in dependency order. Each component
 * holds final references to the other components it needs, so outside code should only need this class to create
 * scenarios and reach the comparator.
 */
public class IthimComponents {

    public final IthimConfig config;
    public final QuantileResolver quantileResolver;
    /** Owns a thread pool, call shutdown when finished. */
    public final MetExposureSimulator simulator;
    public final DoseResponseModel doseResponseModel;
    public final AttributableFractionEngine attributableFractionEngine;
    public final BurdenAggregator burdenAggregator;
    public final ModelComparator comparator;
    public final StratumRandomSource randomSource;

    public IthimComponents (IthimConfig config) {
        this.config = config;
        this.quantileResolver = new QuantileResolver(config);
        this.simulator = new MetExposureSimulator(config);
        this.doseResponseModel = new DoseResponseModel(config);
        this.attributableFractionEngine = new AttributableFractionEngine();
        this.burdenAggregator = new BurdenAggregator();
        this.comparator = new ModelComparator(doseResponseModel, attributableFractionEngine, burdenAggregator);
        this.randomSource = StratumRandomSource.seeded(config.randomSeed());
    }

    /** Compute the exposure of one scenario. The same seed is used for every scenario. */
    public ExposureScenario scenario (ScenarioParameters parameters) {
        return ExposureScenario.create(parameters, quantileResolver, simulator, randomSource);
    }

    public void shutdown () {
        simulator.shutdown();
    }

}
