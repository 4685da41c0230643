package com.conveyal.ithim.burden;

import com.conveyal.ithim.model.AttributableFractions;
import com.conveyal.ithim.model.BurdenDeltas;
import com.conveyal.ithim.model.BurdenType;
import com.conveyal.ithim.model.Disease;
import com.conveyal.ithim.model.GbdTable;
import com.conveyal.ithim.model.QuantileMatrix;
import com.conveyal.ithim.model.RelativeRiskTable;
import com.conveyal.ithim.model.StratumMatrix;

import java.util.EnumMap;
import java.util.Map;

/**
 * Distributes the observed burden of each disease across exposure quantiles in proportion to the shape of relative
 * risk, scales it by the attributable fraction on the scenario side, and sums it back up by stratum.
 */
public class BurdenAggregator {

    /**
     * Burden per stratum under the scenario: the observed burden times (1 - AF), spread over quantiles following
     * the normalized scenario relative risk and summed.
     */
    public StratumMatrix scenarioBurden (StratumMatrix observed, StratumMatrix attributableFraction,
                                        QuantileMatrix normalizedShape) {
        StratumMatrix perUnitShape = observed
                .combine(attributableFraction, (burden, af) -> burden * (1 - af))
                .combine(normalizedShape.rowSums(), (burden, denominator) -> burden / denominator);
        return normalizedShape.scaleRows(perUnitShape).rowSums();
    }

    /** Burden per stratum under the baseline, spread and summed the same way but without any attributable fraction. */
    public StratumMatrix baselineBurden (StratumMatrix observed, QuantileMatrix normalizedShape) {
        StratumMatrix perUnitShape = observed.combine(normalizedShape.rowSums(), (burden, denominator) -> burden / denominator);
        return normalizedShape.scaleRows(perUnitShape).rowSums();
    }

    /** Scenario minus baseline burden for every disease in the attributable fraction table, for one burden type. */
    public BurdenDeltas deltas (BurdenType burdenType, GbdTable gbd, AttributableFractions attributableFractions,
                                RelativeRiskTable normalizedScenario, RelativeRiskTable normalizedBaseline) {
        Map<Disease, StratumMatrix> deltas = new EnumMap<>(Disease.class);
        for (Disease disease : attributableFractions.diseases()) {
            StratumMatrix observed = gbd.burden(disease, burdenType);
            StratumMatrix scenario = scenarioBurden(observed, attributableFractions.get(disease),
                    normalizedScenario.get(disease));
            StratumMatrix baseline = baselineBurden(observed, normalizedBaseline.get(disease));
            deltas.put(disease, scenario.combine(baseline, (s, b) -> s - b));
        }
        return new BurdenDeltas(burdenType, deltas);
    }

}
