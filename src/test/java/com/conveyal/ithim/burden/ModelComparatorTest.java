package com.conveyal.ithim.burden;

import com.conveyal.ithim.ConfigurationException;
import com.conveyal.ithim.IthimComponents;
import com.conveyal.ithim.IthimTestData;
import com.conveyal.ithim.MissingBurdenDataException;
import com.conveyal.ithim.exposure.ExposureScenario;
import com.conveyal.ithim.io.JsonUtil;
import com.conveyal.ithim.model.BurdenType;
import com.conveyal.ithim.model.Disease;
import com.conveyal.ithim.model.GbdTable;
import com.conveyal.ithim.model.QuantileSet;
import com.conveyal.ithim.model.ScenarioParameters;
import com.conveyal.ithim.model.Stratum;
import com.conveyal.ithim.model.StratumMatrix;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ModelComparatorTest {

    private static final double EPSILON = 1e-9;

    private static IthimComponents components;

    private static ModelComparator comparator;

    private static ExposureScenario baseline;

    @BeforeAll
    public static void setUp () {
        components = new IthimComponents(IthimTestData.config(20_000, 4, 1));
        comparator = components.comparator;
        baseline = components.scenario(IthimTestData.parameters(20).build());
    }

    @AfterAll
    public static void tearDown () {
        components.shutdown();
    }

    private static ExposureScenario cycling (double meanCycleTime) {
        return components.scenario(baseline.parameters.toBuilder().meanCycleTime(meanCycleTime).build());
    }

    @Test
    public void testIdenticalScenarioHasNoEffect () {
        ExposureScenario same = cycling(20);
        ComparisonReport report = comparator.compareModels(baseline, same);
        for (BurdenType burdenType : BurdenType.values()) {
            assertEquals(0, comparator.totalDelta(report, burdenType, null), EPSILON);
        }
        for (Disease disease : report.diseases()) {
            assertEquals(0, report.attributableFractions.get(disease).sum(), EPSILON);
        }
    }

    @Test
    public void testMoreCyclingReducesBurden () {
        double doubled = comparator.deltaBurden(baseline, cycling(40), "daly", "CVD");
        double tripled = comparator.deltaBurden(baseline, cycling(60), "daly", "CVD");
        assertTrue(doubled < 0);
        assertTrue(tripled < doubled);
        double lessCycling = comparator.deltaBurden(baseline, cycling(5), "daly", "CVD");
        assertTrue(lessCycling > 0);
    }

    @Test
    public void testMoreCyclingReducesBurdenWithHundredMinutesWalking () {
        ScenarioParameters walkers = baseline.parameters.toBuilder().meanWalkTime(100).meanCycleTime(20).build();
        ExposureScenario walkingBaseline = components.scenario(walkers);
        ExposureScenario doubled = components.scenario(walkers.toBuilder().meanCycleTime(40).build());
        ExposureScenario tripled = components.scenario(walkers.toBuilder().meanCycleTime(60).build());
        double doubledDelta = comparator.deltaBurden(walkingBaseline, doubled, "daly", "CVD");
        double tripledDelta = comparator.deltaBurden(walkingBaseline, tripled, "daly", "CVD");
        assertTrue(doubledDelta < 0);
        assertTrue(tripledDelta < doubledDelta);
    }

    @Test
    public void testQueryNamesAreTrimmed () {
        ComparisonReport report = comparator.compareModels(baseline, cycling(40));
        assertEquals(comparator.getBurden(report, "daly", "CVD"), comparator.getBurden(report, " daly ", " CVD "));
        assertEquals(comparator.getBurden(report, "daly", "all"), comparator.getBurden(report, " daly", " all"));
        assertEquals(comparator.getBurden(report, "yll", "Diabetes"),
                comparator.getBurden(report, "YLL\t", "diabetes "));
    }

    @Test
    public void testAllIsSumOfDiseases () {
        ComparisonReport report = comparator.compareModels(baseline, cycling(40));
        for (BurdenType burdenType : BurdenType.values()) {
            double sum = 0;
            for (Disease disease : Disease.values()) {
                sum += comparator.getBurden(report, burdenType.label, disease.label);
            }
            assertEquals(sum, comparator.getBurden(report, burdenType.label, "all"), Math.abs(sum) * 1e-12);
        }
        // Defaults are DALYs summed over all diseases.
        assertEquals(comparator.getBurden(report, "daly", "all"), comparator.getBurden(report, null, null));
        assertEquals(comparator.totalDelta(report, BurdenType.DALY, null), comparator.getBurden(report, null, null));
        // Physical activity has no effect on breast cancer in men, but does in women.
        assertTrue(comparator.totalDelta(report, BurdenType.DALY, Disease.BREAST_CANCER) < 0);
    }

    @Test
    public void testReportContents () throws Exception {
        ComparisonReport report = comparator.compareModels(baseline, cycling(40));
        assertEquals(6, report.diseases().size());
        assertEquals(4, report.deltas.size());
        for (Disease disease : report.diseases()) {
            assertEquals(1, report.normalizedDiseaseBurden.get(disease).get(Stratum.ALL.get(0), 0));
            assertTrue(report.attributableFractions.get(disease).min() >= 0);
        }
        String json = JsonUtil.objectMapper.writeValueAsString(report);
        assertTrue(json.contains("attributableFractions"));
        assertTrue(json.contains("\"CVD\""));
        assertTrue(json.contains("\"BreastCancer\""));
    }

    @Test
    public void testUnknownQueries () {
        ComparisonReport report = comparator.compareModels(baseline, cycling(40));
        assertThrows(ConfigurationException.class, () -> comparator.getBurden(report, "qaly", "all"));
        assertThrows(ConfigurationException.class, () -> comparator.getBurden(report, "daly", "Stroke"));
        assertThrows(ConfigurationException.class, () -> comparator.getBurden(report, "daly", "RTIs"));
        assertThrows(ConfigurationException.class, () -> comparator.deltaBurden(baseline, baseline, "qaly", null));
    }

    @Test
    public void testDiseaseOutsideBurdenTable () {
        GbdTable cvdOnly = IthimTestData.gbd(Disease.CVD);
        ExposureScenario cvdBaseline = components.scenario(baseline.parameters.toBuilder().gbd(cvdOnly).build());
        ExposureScenario cvdScenario = components.scenario(cvdBaseline.parameters.toBuilder().meanCycleTime(40).build());
        ComparisonReport report = comparator.compareModels(cvdBaseline, cvdScenario);
        assertEquals(1, report.diseases().size());
        assertEquals(comparator.getBurden(report, "daly", "CVD"), comparator.getBurden(report, "daly", "all"));
        assertThrows(ConfigurationException.class,
                () -> comparator.deltaBurden(cvdBaseline, cvdScenario, "daly", "Diabetes"));
    }

    @Test
    public void testMissingBurdenData () {
        GbdTable incomplete = GbdTable.builder()
                .put(Disease.CVD, BurdenType.DALY, StratumMatrix.filled(10))
                .build();
        ScenarioParameters parameters = baseline.parameters.toBuilder().gbd(incomplete).build();
        ExposureScenario incompleteBaseline = components.scenario(parameters);
        assertThrows(MissingBurdenDataException.class,
                () -> comparator.compareModels(incompleteBaseline, cycling(40)));
    }

    @Test
    public void testMismatchedQuantiles () {
        ExposureScenario quartiles = components.scenario(
                baseline.parameters.toBuilder().quantiles(new QuantileSet(0.125, 0.375, 0.625, 0.875)).build());
        assertThrows(ConfigurationException.class, () -> comparator.compareModels(baseline, quartiles));
    }

}
