package com.conveyal.ithim.burden;

import com.conveyal.ithim.model.QuantileMatrix;
import com.conveyal.ithim.model.Sex;
import com.conveyal.ithim.model.Stratum;
import com.conveyal.ithim.model.StratumMatrix;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class BurdenAggregatorTest {

    private static final double EPSILON = 1e-9;

    private final BurdenAggregator aggregator = new BurdenAggregator();

    private final QuantileMatrix shape = QuantileMatrix.fromFunction(5, (stratum, q) -> 1 - 0.1 * q);

    private final StratumMatrix observed = StratumMatrix.fromFunction(stratum -> 100 * stratum.ageClass);

    /** Spreading burden over quantiles and summing it back leaves the total unchanged. */
    @Test
    public void testBaselineBurdenPreservesTotal () {
        StratumMatrix baseline = aggregator.baselineBurden(observed, shape);
        for (Stratum stratum : Stratum.ALL) {
            assertEquals(observed.get(stratum), baseline.get(stratum), EPSILON);
        }
    }

    @Test
    public void testScenarioBurdenScaledByAttributableFraction () {
        StratumMatrix af = StratumMatrix.fromFunction(stratum -> stratum.sex == Sex.M ? 0.1 : -0.05);
        StratumMatrix scenario = aggregator.scenarioBurden(observed, af, shape);
        assertEquals(300 * 0.9, scenario.get(3, Sex.M), EPSILON);
        assertEquals(300 * 1.05, scenario.get(3, Sex.F), EPSILON);
    }

}
