package com.conveyal.ithim.model;

import com.conveyal.ithim.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The diseases whose burden responds to physical activity in this model. Road traffic injuries (RTIs) appear in
 * burden of disease tables but belong to the injury pathway, so they have no member here. Cardiovascular subtypes
 * (stroke, hypertensive heart disease) are not broken out of CVD.
 */
public enum Disease {
    BREAST_CANCER("BreastCancer"),
    COLON_CANCER("ColonCancer"),
    CVD("CVD"),
    DEMENTIA("Dementia"),
    DEPRESSION("Depression"),
    DIABETES("Diabetes");

    /** Name of the road traffic injury rows in burden tables, which are not part of the physical activity pathway. */
    public static final String INJURY_LABEL = "RTIs";

    /** Value of the disease filter meaning the sum over all diseases. */
    public static final String ALL = "all";

    /** The name used in burden of disease tables and query parameters. */
    public final String label;

    Disease (String label) {
        this.label = label;
    }

    @JsonValue
    public String label () {
        return label;
    }

    /** Look up a disease by its table label or enum constant name, ignoring case. */
    public static Disease fromName (String name) {
        Disease disease = forLabel(name);
        if (disease == null) {
            throw new ConfigurationException("Unrecognized disease: " + name);
        }
        return disease;
    }

    /** Like fromName but returns null for unknown names instead of throwing. */
    public static Disease forLabel (String name) {
        String trimmed = name == null ? null : name.trim();
        for (Disease disease : values()) {
            if (disease.label.equalsIgnoreCase(trimmed) || disease.name().equalsIgnoreCase(trimmed)) {
                return disease;
            }
        }
        return null;
    }

}
