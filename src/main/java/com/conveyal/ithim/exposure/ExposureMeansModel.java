package com.conveyal.ithim.exposure;

import com.conveyal.ithim.NumericDomainException;
import com.conveyal.ithim.model.ScenarioParameters;
import com.conveyal.ithim.model.StratumMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts population-wide mean exposures and relative weights by stratum into mean exposures for each stratum.
 * The same rule is applied independently to walking time, cycling time and non-travel activity.
 */
public abstract class ExposureMeansModel {

    private static final Logger LOG = LoggerFactory.getLogger(ExposureMeansModel.class);

    public static ExposureMeans computeMeans (ScenarioParameters parameters) {
        StratumMatrix walk = stratumMeans(parameters, parameters.meanWalkTime, parameters.walkWeights, "walking");
        StratumMatrix cycle = stratumMeans(parameters, parameters.meanCycleTime, parameters.cycleWeights, "cycling");
        StratumMatrix nonTravel = stratumMeans(parameters, parameters.meanNonTravel, parameters.nonTravelWeights,
                "non-travel activity");
        return new ExposureMeans(walk, cycle, nonTravel, parameters.cv);
    }

    /**
     * Scale relative weights to means. In OVERALL mode the weights are first divided by their population-weighted
     * average, so the population-weighted average of the resulting means equals the supplied population mean.
     * In REFERENT mode the population mean is that of a referent stratum with weight one.
     */
    static StratumMatrix stratumMeans (ScenarioParameters parameters, double populationMean, StratumMatrix weights,
                                       String activity) {
        switch (parameters.meanType) {
            case OVERALL:
                double alpha = weights.weightedSum(parameters.populationShare);
                if (alpha == 0) {
                    if (populationMean == 0) {
                        return StratumMatrix.filled(0);
                    }
                    throw new NumericDomainException("Population-weighted " + activity +
                            " weight is zero, cannot distribute a non-zero mean of " + populationMean);
                }
                LOG.debug("Population-weighted average {} weight is {}", activity, alpha);
                return weights.map(weight -> populationMean / alpha * weight);
            case REFERENT:
                return weights.map(weight -> populationMean * weight);
            default:
                throw new AssertionError("This enum value is not covered by a conditional branch: " + parameters.meanType);
        }
    }

}
