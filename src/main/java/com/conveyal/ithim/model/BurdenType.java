package com.conveyal.ithim.model;

import com.conveyal.ithim.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonValue;

/** Measures of disease burden supplied by the Global Burden of Disease table. */
public enum BurdenType {
    /** Number of deaths. */
    DEATHS("deaths"),
    /** Years of life lost. */
    YLL("yll"),
    /** Years lived with disability. */
    YLD("yld"),
    /** Disability-adjusted life years, YLL plus YLD. */
    DALY("daly");

    public static final BurdenType DEFAULT = DALY;

    public final String label;

    BurdenType (String label) {
        this.label = label;
    }

    @JsonValue
    public String label () {
        return label;
    }

    public static BurdenType fromName (String name) {
        String trimmed = name == null ? null : name.trim();
        for (BurdenType type : values()) {
            if (type.label.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        throw new ConfigurationException("Unrecognized burden type: " + name);
    }

}
