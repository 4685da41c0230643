package com.conveyal.ithim.risk;

import com.conveyal.ithim.NumericDomainException;

/**
 * A point taken from the epidemiological literature: the relative risk of a disease observed at a given level of
 * physical activity, compared with no activity. Exposure is in MET-hours per week.
 */
public final class DoseResponseAnchor {

    public final double exposure;

    public final double relativeRisk;

    public DoseResponseAnchor (double exposure, double relativeRisk) {
        if (!(exposure > 0) || Double.isInfinite(exposure)) {
            throw new NumericDomainException("Anchor exposure must be positive and finite, found " + exposure);
        }
        if (!(relativeRisk > 0) || Double.isInfinite(relativeRisk)) {
            throw new NumericDomainException("Anchor relative risk must be positive and finite, found " + relativeRisk);
        }
        this.exposure = exposure;
        this.relativeRisk = relativeRisk;
    }

    @Override
    public String toString () {
        return String.format("RR %s at %s MET-h/week", relativeRisk, exposure);
    }

}
