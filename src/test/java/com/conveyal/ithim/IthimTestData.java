package com.conveyal.ithim;

import com.conveyal.ithim.exposure.MeanType;
import com.conveyal.ithim.model.BurdenType;
import com.conveyal.ithim.model.Disease;
import com.conveyal.ithim.model.GbdTable;
import com.conveyal.ithim.model.QuantileSet;
import com.conveyal.ithim.model.ScenarioParameters;
import com.conveyal.ithim.model.Sex;
import com.conveyal.ithim.model.StratumMatrix;

import java.util.Properties;

/** Shared inputs for tests that run the model end to end. */
public abstract class IthimTestData {

    /** Roughly the shape of a real population, older age classes smaller. Sums to one. */
    public static final StratumMatrix POPULATION_SHARE = StratumMatrix.of(
            new double[] { 0.04, 0.08, 0.08, 0.08, 0.07, 0.07, 0.05, 0.03 },
            new double[] { 0.04, 0.08, 0.08, 0.08, 0.07, 0.07, 0.05, 0.03 }
    );

    public static final StratumMatrix WALK_WEIGHTS = StratumMatrix.of(
            new double[] { 0.8, 1.1, 1.0, 1.0, 0.9, 0.9, 0.8, 0.6 },
            new double[] { 0.8, 1.0, 1.0, 1.0, 0.9, 0.9, 0.7, 0.5 }
    );

    public static final StratumMatrix CYCLE_WEIGHTS = StratumMatrix.of(
            new double[] { 1.0, 2.0, 1.8, 1.5, 1.2, 0.8, 0.3, 0.0 },
            new double[] { 0.6, 1.2, 1.0, 0.9, 0.6, 0.4, 0.1, 0.0 }
    );

    /** Age classes are numbered from 1, so value(stratum) scales with age. */
    public static GbdTable gbd (Disease... diseases) {
        GbdTable.Builder builder = GbdTable.builder();
        for (Disease disease : diseases) {
            for (BurdenType burdenType : BurdenType.values()) {
                double base = 10 * (burdenType.ordinal() + 1) * (disease.ordinal() + 1);
                builder.put(disease, burdenType, StratumMatrix.fromFunction(stratum ->
                        base * stratum.ageClass + (stratum.sex == Sex.F ? 1 : 0)));
            }
        }
        return builder.build();
    }

    public static GbdTable fullGbd () {
        return gbd(Disease.values());
    }

    public static ScenarioParameters.Builder parameters (double meanCycleTime) {
        return ScenarioParameters.builder()
                .populationShare(POPULATION_SHARE)
                .walkWeights(WALK_WEIGHTS)
                .cycleWeights(CYCLE_WEIGHTS)
                .nonTravelWeights(StratumMatrix.filled(1))
                .meanWalkTime(60)
                .meanCycleTime(meanCycleTime)
                .meanNonTravel(2)
                .cv(1)
                .cvNonTravel(1)
                .meanType(MeanType.OVERALL)
                .quantiles(QuantileSet.QUINTILE_MIDPOINTS)
                .gbd(fullGbd());
    }

    /** Defaults with a smaller sample so tests run quickly. */
    public static IthimConfig config (int sampleSize, int threads, long seed) {
        Properties properties = new Properties();
        properties.setProperty("sample-size", Integer.toString(sampleSize));
        properties.setProperty("simulation-threads", Integer.toString(threads));
        properties.setProperty("random-seed", Long.toString(seed));
        return IthimConfig.fromProperties(properties);
    }

}
