package com.conveyal.ithim.burden;

import com.conveyal.ithim.model.AttributableFractions;
import com.conveyal.ithim.model.BurdenDeltas;
import com.conveyal.ithim.model.BurdenType;
import com.conveyal.ithim.model.Disease;
import com.conveyal.ithim.model.RelativeRiskTable;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.collect.Maps;

import java.util.Map;
import java.util.Set;

/**
 * Everything computed when comparing a scenario against a baseline, from relative risks through to the change in
 * each type of burden. Serialized as JSON by the command line tool.
 */
public class ComparisonReport {

    public final RelativeRiskTable rrBaseline;

    public final RelativeRiskTable rrScenario;

    /** Baseline relative risk over scenario relative risk. */
    public final RelativeRiskTable rrNormalizedToBaseline;

    public final AttributableFractions attributableFractions;

    /** Computed with the alternative formula for comparison only. The deltas do not depend on it. */
    public final AttributableFractions alternativeAttributableFractions;

    public final RelativeRiskTable normalizedDiseaseBurden;

    public final RelativeRiskTable normalizedDiseaseBurdenBaseline;

    public final Map<BurdenType, BurdenDeltas> deltas;

    public ComparisonReport (RelativeRiskTable rrBaseline, RelativeRiskTable rrScenario,
                             RelativeRiskTable rrNormalizedToBaseline, AttributableFractions attributableFractions,
                             AttributableFractions alternativeAttributableFractions,
                             RelativeRiskTable normalizedDiseaseBurden,
                             RelativeRiskTable normalizedDiseaseBurdenBaseline,
                             Map<BurdenType, BurdenDeltas> deltas) {
        this.rrBaseline = rrBaseline;
        this.rrScenario = rrScenario;
        this.rrNormalizedToBaseline = rrNormalizedToBaseline;
        this.attributableFractions = attributableFractions;
        this.alternativeAttributableFractions = alternativeAttributableFractions;
        this.normalizedDiseaseBurden = normalizedDiseaseBurden;
        this.normalizedDiseaseBurdenBaseline = normalizedDiseaseBurdenBaseline;
        this.deltas = Maps.immutableEnumMap(deltas);
    }

    @JsonIgnore
    public Set<Disease> diseases () {
        return attributableFractions.diseases();
    }

    public BurdenDeltas deltas (BurdenType burdenType) {
        return deltas.get(burdenType);
    }

}
