package com.conveyal.ithim.risk;

import com.conveyal.ithim.IthimConfig;
import com.conveyal.ithim.NumericDomainException;
import com.conveyal.ithim.model.Disease;
import com.conveyal.ithim.model.QuantileMatrix;
import com.conveyal.ithim.model.RelativeRiskTable;
import com.conveyal.ithim.model.Sex;
import com.conveyal.ithim.model.Stratum;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DoseResponseModelTest {

    private static final double EPSILON = 1e-12;

    private final DoseResponseModel model = new DoseResponseModel(IthimConfig.fromDefaults());

    /** Every curve passes through its own literature anchor. */
    @Test
    public void testCurvesPassThroughAnchors () {
        for (Map.Entry<Disease, DoseResponseAnchors> entry : DoseResponseModel.defaultAnchors().entrySet()) {
            DoseResponseCurve curve = model.curve(entry.getKey());
            for (Stratum stratum : Stratum.ALL) {
                DoseResponseAnchor anchor = entry.getValue().get(stratum);
                assertEquals(anchor.relativeRisk, curve.relativeRisk(stratum, anchor.exposure), EPSILON);
            }
        }
    }

    @Test
    public void testCvdValues () {
        DoseResponseCurve cvd = model.curve(Disease.CVD);
        Stratum stratum = Stratum.of(5, Sex.F);
        assertEquals(1, cvd.relativeRisk(stratum, 0));
        assertEquals(Math.pow(0.84, Math.sqrt(1 / 7.5)), cvd.perUnitRelativeRisk.get(stratum), EPSILON);
        // Four times the anchor exposure gives the square of the anchor relative risk when k is one half.
        assertEquals(0.84 * 0.84, cvd.relativeRisk(stratum, 30), EPSILON);
    }

    @Test
    public void testBreastCancerOnlyAffectsWomen () {
        DoseResponseCurve breastCancer = model.curve(Disease.BREAST_CANCER);
        assertEquals(1, breastCancer.relativeRisk(Stratum.of(4, Sex.M), 50), EPSILON);
        assertTrue(breastCancer.relativeRisk(Stratum.of(4, Sex.F), 50) < 1);
    }

    @Test
    public void testDepressionAgeSplit () {
        DoseResponseCurve depression = model.curve(Disease.DEPRESSION);
        assertEquals(0.927945490148335, depression.relativeRisk(Stratum.of(3, Sex.M), 11.25), EPSILON);
        assertEquals(0.859615572255727, depression.relativeRisk(Stratum.of(4, Sex.M), 11.25), EPSILON);
    }

    @Test
    public void testRelativeRiskTable () {
        QuantileMatrix mets = QuantileMatrix.fromFunction(3, (stratum, q) -> 5.0 * (q + 1));
        RelativeRiskTable table = model.relativeRisks(mets, EnumSet.of(Disease.CVD, Disease.DIABETES));
        assertEquals(EnumSet.of(Disease.CVD, Disease.DIABETES), table.diseases());
        QuantileMatrix diabetes = table.get(Disease.DIABETES);
        for (Stratum stratum : Stratum.ALL) {
            assertTrue(diabetes.get(stratum, 2) < diabetes.get(stratum, 1));
            assertTrue(diabetes.get(stratum, 1) < diabetes.get(stratum, 0));
        }
        assertEquals(6, model.relativeRisks(mets).diseases().size());
    }

    @Test
    public void testInvalidAnchors () {
        assertThrows(NumericDomainException.class, () -> new DoseResponseAnchor(0, 0.8));
        assertThrows(NumericDomainException.class, () -> new DoseResponseAnchor(10, -1));
    }

}
