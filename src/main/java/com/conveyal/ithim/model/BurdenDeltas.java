package com.conveyal.ithim.model;

import java.util.Map;

/**
 * For each disease, the scenario burden minus the baseline burden in each stratum, for a single burden type.
 * Negative values are health benefits.
 */
public final class BurdenDeltas extends DiseaseTable<StratumMatrix> {

    public final BurdenType burdenType;

    public BurdenDeltas (BurdenType burdenType, Map<Disease, StratumMatrix> values) {
        super(values);
        this.burdenType = burdenType;
    }

    /** Sum over all strata for one disease, age class 1 included. */
    public double total (Disease disease) {
        return get(disease).sum();
    }

    /** Sum over all strata and all diseases in this table. */
    public double total () {
        double total = 0;
        for (Disease disease : diseases()) {
            total += total(disease);
        }
        return total;
    }

}
