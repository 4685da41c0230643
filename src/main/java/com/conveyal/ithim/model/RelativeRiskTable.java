package com.conveyal.ithim.model;

import java.util.Map;

/** For each disease, relative risk by stratum and exposure quantile compared with zero exposure. */
public final class RelativeRiskTable extends DiseaseTable<QuantileMatrix> {

    public RelativeRiskTable (Map<Disease, QuantileMatrix> values) {
        super(values);
    }

}
