package com.conveyal.ithim.model;

import java.util.Map;

/** For each disease, the fraction of burden in each stratum removed by moving from baseline to scenario exposure. */
public final class AttributableFractions extends DiseaseTable<StratumMatrix> {

    public AttributableFractions (Map<Disease, StratumMatrix> values) {
        super(values);
    }

}
