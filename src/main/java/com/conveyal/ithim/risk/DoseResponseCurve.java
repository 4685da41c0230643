package com.conveyal.ithim.risk;

import com.conveyal.ithim.model.Disease;
import com.conveyal.ithim.model.QuantileMatrix;
import com.conveyal.ithim.model.Stratum;
import com.conveyal.ithim.model.StratumMatrix;
import org.apache.commons.math3.util.FastMath;

/**
 * Relative risk of one disease as a continuous function of physical activity, in each stratum.
 *
 * The curve has the form RR(x) = RR1^(x^k), where x is exposure in MET-hours per week and RR1 is the relative risk
 * at one MET-hour per week. RR1 is recovered from a literature anchor (E, RR) by inverting the same form:
 * RR1 = RR^((1/E)^k). Evaluating the curve at the anchor exposure therefore gives back the anchor relative risk.
 * With k below one, each additional MET-hour brings a smaller reduction in risk.
 */
public final class DoseResponseCurve {

    public final Disease disease;

    /** The extrapolation exponent k. */
    public final double exponent;

    /** Relative risk at one MET-hour per week, by stratum. */
    public final StratumMatrix perUnitRelativeRisk;

    private DoseResponseCurve (Disease disease, double exponent, StratumMatrix perUnitRelativeRisk) {
        this.disease = disease;
        this.exponent = exponent;
        this.perUnitRelativeRisk = perUnitRelativeRisk;
    }

    public static DoseResponseCurve fromAnchors (Disease disease, DoseResponseAnchors anchors, double exponent) {
        StratumMatrix perUnit = StratumMatrix.fromFunction(stratum -> {
            DoseResponseAnchor anchor = anchors.get(stratum);
            return FastMath.pow(anchor.relativeRisk, FastMath.pow(1 / anchor.exposure, exponent));
        });
        return new DoseResponseCurve(disease, exponent, perUnit);
    }

    /** Relative risk compared with zero exposure, for the given exposure in the given stratum. */
    public double relativeRisk (Stratum stratum, double exposure) {
        return FastMath.pow(perUnitRelativeRisk.get(stratum), FastMath.pow(exposure, exponent));
    }

    /** Evaluate the curve independently at every stratum and quantile of an exposure matrix. */
    public QuantileMatrix relativeRisks (QuantileMatrix exposure) {
        return QuantileMatrix.fromFunction(exposure.nQuantiles,
                (stratum, q) -> relativeRisk(stratum, exposure.get(stratum, q)));
    }

}
