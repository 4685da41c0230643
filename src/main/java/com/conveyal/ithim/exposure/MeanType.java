package com.conveyal.ithim.exposure;

import com.conveyal.ithim.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How population-wide mean exposures are distributed across strata using the relative weight matrices.
 */
public enum MeanType {
    /**
     * The population mean is the population-weighted average over strata, so each stratum mean is the population
     * mean times its weight, divided by the population-weighted average weight.
     */
    OVERALL("overall"),
    /** The population mean is the mean of the referent stratum, whose weight is one. Weights are not renormalized. */
    REFERENT("referent");

    public final String label;

    MeanType (String label) {
        this.label = label;
    }

    @JsonValue
    public String label () {
        return label;
    }

    @JsonCreator
    public static MeanType fromName (String name) {
        for (MeanType meanType : values()) {
            if (meanType.label.equalsIgnoreCase(name)) {
                return meanType;
            }
        }
        throw new ConfigurationException("Unrecognized mean type '" + name + "', expected overall or referent.");
    }
}
