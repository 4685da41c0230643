package com.conveyal.ithim.risk;

import com.conveyal.ithim.model.Disease;
import com.conveyal.ithim.model.QuantileMatrix;
import com.conveyal.ithim.model.RelativeRiskTable;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Converts total physical activity into relative risk of each modelled disease. One DoseResponseCurve is built per
 * disease from its literature anchors and the configured extrapolation exponent.
 */
public class DoseResponseModel {

    private static final Logger LOG = LoggerFactory.getLogger(DoseResponseModel.class);

    public interface Config {
        double extrapolationExponent ();
    }

    private final Map<Disease, DoseResponseCurve> curves;

    public DoseResponseModel (Config config) {
        this(config, defaultAnchors());
    }

    public DoseResponseModel (Config config, Map<Disease, DoseResponseAnchors> anchors) {
        double exponent = config.extrapolationExponent();
        checkArgument(exponent > 0, "Extrapolation exponent must be positive.");
        Map<Disease, DoseResponseCurve> curves = new EnumMap<>(Disease.class);
        anchors.forEach((disease, diseaseAnchors) ->
                curves.put(disease, DoseResponseCurve.fromAnchors(disease, diseaseAnchors, exponent)));
        this.curves = Maps.immutableEnumMap(curves);
        LOG.info("Dose-response curves for {} with extrapolation exponent {}.", this.curves.keySet(), exponent);
    }

    /**
     * Literature relative risks for each disease. Exposures are MET-hours per week. Breast cancer is not modelled for
     * men, which is expressed as a relative risk of one at any exposure.
     */
    public static Map<Disease, DoseResponseAnchors> defaultAnchors () {
        Map<Disease, DoseResponseAnchors> anchors = new EnumMap<>(Disease.class);
        anchors.put(Disease.BREAST_CANCER, DoseResponseAnchors.bySex(
                new DoseResponseAnchor(1, 1),
                new DoseResponseAnchor(4.5, 0.944)));
        anchors.put(Disease.COLON_CANCER, DoseResponseAnchors.bySex(
                new DoseResponseAnchor(30.9, 0.8),
                new DoseResponseAnchor(30.1, 0.86)));
        anchors.put(Disease.CVD, DoseResponseAnchors.uniform(new DoseResponseAnchor(7.5, 0.84)));
        anchors.put(Disease.DEMENTIA, DoseResponseAnchors.uniform(new DoseResponseAnchor(31.5, 0.72)));
        anchors.put(Disease.DEPRESSION, DoseResponseAnchors.byAge(3,
                new DoseResponseAnchor(11.25, 0.927945490148335),
                new DoseResponseAnchor(11.25, 0.859615572255727)));
        anchors.put(Disease.DIABETES, DoseResponseAnchors.uniform(new DoseResponseAnchor(10, 0.83)));
        return anchors;
    }

    public DoseResponseCurve curve (Disease disease) {
        DoseResponseCurve curve = curves.get(disease);
        checkArgument(curve != null, "No dose-response curve for disease %s", disease);
        return curve;
    }

    /**
     * Relative risk compared with zero activity for each of the given diseases, at every stratum and quantile of the
     * supplied total MET exposure.
     */
    public RelativeRiskTable relativeRisks (QuantileMatrix totalMet, Iterable<Disease> diseases) {
        Map<Disease, QuantileMatrix> relativeRisks = new EnumMap<>(Disease.class);
        for (Disease disease : diseases) {
            relativeRisks.put(disease, curve(disease).relativeRisks(totalMet));
        }
        return new RelativeRiskTable(relativeRisks);
    }

    /** Relative risks for every disease that has a curve. */
    public RelativeRiskTable relativeRisks (QuantileMatrix totalMet) {
        return relativeRisks(totalMet, curves.keySet());
    }

}
