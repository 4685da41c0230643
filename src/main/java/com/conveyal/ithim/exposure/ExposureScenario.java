package com.conveyal.ithim.exposure;

import com.conveyal.ithim.model.QuantileMatrix;
import com.conveyal.ithim.model.ScenarioParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The physical activity exposure of one scenario: its parameters together with the derived mean exposures and
 * exposure quantiles. A baseline and an alternative scenario are compared by the ModelComparator.
 * Instances are immutable and each stage is computed from the previous one when the scenario is created.
 */
public final class ExposureScenario {

    private static final Logger LOG = LoggerFactory.getLogger(ExposureScenario.class);

    public final ScenarioParameters parameters;

    public final ExposureMeans means;

    public final ExposureQuantiles quantiles;

    private ExposureScenario (ScenarioParameters parameters, ExposureMeans means, ExposureQuantiles quantiles) {
        this.parameters = parameters;
        this.means = means;
        this.quantiles = quantiles;
    }

    /** Run the exposure stages of the pipeline: means, then time quantiles and simulated total MET quantiles. */
    public static ExposureScenario create (ScenarioParameters parameters, QuantileResolver quantileResolver,
                                           MetExposureSimulator simulator, StratumRandomSource randomSource) {
        ExposureMeans means = ExposureMeansModel.computeMeans(parameters);
        LOG.debug("Mean active transport time by stratum: {}", means.meanActiveTransportTime);
        QuantileMatrix activeTransportTime = quantileResolver.resolve(
                means.meanActiveTransportTime, means.sdActiveTransportTime, parameters.cv, parameters.quantiles);
        QuantileMatrix totalMet = simulator.simulate(
                means, parameters.cv, parameters.cvNonTravel, parameters.quantiles, randomSource);
        return new ExposureScenario(parameters, means, ExposureQuantiles.of(means, activeTransportTime, totalMet));
    }

}
