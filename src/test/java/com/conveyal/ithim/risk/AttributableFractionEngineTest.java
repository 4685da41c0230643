package com.conveyal.ithim.risk;

import com.conveyal.ithim.model.AttributableFractions;
import com.conveyal.ithim.model.Disease;
import com.conveyal.ithim.model.QuantileMatrix;
import com.conveyal.ithim.model.RelativeRiskTable;
import com.conveyal.ithim.model.Stratum;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class AttributableFractionEngineTest {

    private static final double EPSILON = 1e-12;

    private final AttributableFractionEngine engine = new AttributableFractionEngine();

    private static RelativeRiskTable table (double... rr) {
        QuantileMatrix matrix = QuantileMatrix.fromFunction(rr.length, (stratum, q) -> rr[q]);
        return new RelativeRiskTable(ImmutableMap.of(Disease.CVD, matrix));
    }

    @Test
    public void testFirstNormalizedQuantileIsOne () {
        RelativeRiskTable normalized = engine.normalizeDiseaseBurden(table(0.9, 0.8, 0.6));
        for (Stratum stratum : Stratum.ALL) {
            assertEquals(1, normalized.get(Disease.CVD).get(stratum, 0));
            assertEquals(0.6 / 0.9, normalized.get(Disease.CVD).get(stratum, 2), EPSILON);
        }
    }

    @Test
    public void testIdenticalTablesGiveZero () {
        RelativeRiskTable rr = table(0.95, 0.9, 0.7);
        AttributableFractions af = engine.attributableFractions(rr, rr);
        AttributableFractions alternative =
                engine.alternativeAttributableFractions(engine.normalizeDiseaseBurden(rr), engine.normalizeDiseaseBurden(rr));
        for (Stratum stratum : Stratum.ALL) {
            assertEquals(0, af.get(Disease.CVD).get(stratum));
            assertEquals(0, alternative.get(Disease.CVD).get(stratum));
        }
    }

    @Test
    public void testAttributableFraction () {
        RelativeRiskTable baseline = table(1.0, 0.9, 0.8);
        RelativeRiskTable scenario = table(0.9, 0.8, 0.7);
        AttributableFractions af = engine.attributableFractions(scenario, baseline);
        assertEquals(1 - 2.4 / 2.7, af.get(Disease.CVD).get(Stratum.ALL.get(0)), EPSILON);
        RelativeRiskTable ratio = engine.normalizedToBaseline(baseline, scenario);
        assertEquals(1.0 / 0.9, ratio.get(Disease.CVD).get(Stratum.ALL.get(3), 0), EPSILON);
    }

    @Test
    public void testAlternativeAttributableFraction () {
        RelativeRiskTable scenario = table(1.0, 0.5);
        RelativeRiskTable baseline = table(1.0, 0.8);
        AttributableFractions alternative = engine.alternativeAttributableFractions(scenario, baseline);
        assertEquals((1.5 - 1.8) / 1.5, alternative.get(Disease.CVD).get(Stratum.ALL.get(5)), EPSILON);
    }

}
