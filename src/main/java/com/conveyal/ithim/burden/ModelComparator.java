package com.conveyal.ithim.burden;

import com.conveyal.ithim.ConfigurationException;
import com.conveyal.ithim.exposure.ExposureScenario;
import com.conveyal.ithim.model.AttributableFractions;
import com.conveyal.ithim.model.BurdenDeltas;
import com.conveyal.ithim.model.BurdenType;
import com.conveyal.ithim.model.Disease;
import com.conveyal.ithim.model.GbdTable;
import com.conveyal.ithim.model.RelativeRiskTable;
import com.conveyal.ithim.risk.AttributableFractionEngine;
import com.conveyal.ithim.risk.DoseResponseModel;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Runs the comparative risk assessment of a scenario against a baseline and answers queries about the change in
 * burden. The diseases assessed are those present in the baseline's burden of disease table. Road injuries are never
 * part of this assessment even when the table contains them.
 */
public class ModelComparator {

    private static final Logger LOG = LoggerFactory.getLogger(ModelComparator.class);

    private final DoseResponseModel doseResponseModel;

    private final AttributableFractionEngine attributableFractionEngine;

    private final BurdenAggregator burdenAggregator;

    public ModelComparator (DoseResponseModel doseResponseModel, AttributableFractionEngine attributableFractionEngine,
                            BurdenAggregator burdenAggregator) {
        this.doseResponseModel = doseResponseModel;
        this.attributableFractionEngine = attributableFractionEngine;
        this.burdenAggregator = burdenAggregator;
    }

    public ComparisonReport compareModels (ExposureScenario baseline, ExposureScenario scenario) {
        if (!baseline.parameters.quantiles.equals(scenario.parameters.quantiles)) {
            throw new ConfigurationException(String.format(
                    "Baseline and scenario must use the same quantiles, found %s and %s.",
                    baseline.parameters.quantiles, scenario.parameters.quantiles));
        }
        Stopwatch stopwatch = Stopwatch.createStarted();
        GbdTable gbd = baseline.parameters.gbd;
        Set<Disease> diseases = gbd.diseases();
        gbd.validateComplete(diseases);

        RelativeRiskTable rrBaseline = doseResponseModel.relativeRisks(baseline.quantiles.totalMet, diseases);
        RelativeRiskTable rrScenario = doseResponseModel.relativeRisks(scenario.quantiles.totalMet, diseases);
        RelativeRiskTable rrNormalizedToBaseline = attributableFractionEngine.normalizedToBaseline(rrBaseline, rrScenario);
        AttributableFractions af = attributableFractionEngine.attributableFractions(rrScenario, rrBaseline);
        RelativeRiskTable normalizedScenario = attributableFractionEngine.normalizeDiseaseBurden(rrScenario);
        RelativeRiskTable normalizedBaseline = attributableFractionEngine.normalizeDiseaseBurden(rrBaseline);
        AttributableFractions alternativeAf =
                attributableFractionEngine.alternativeAttributableFractions(normalizedScenario, normalizedBaseline);

        Map<BurdenType, BurdenDeltas> deltas = new EnumMap<>(BurdenType.class);
        for (BurdenType burdenType : BurdenType.values()) {
            BurdenDeltas burdenDeltas = burdenAggregator.deltas(burdenType, gbd, af, normalizedScenario, normalizedBaseline);
            LOG.debug("Change in {}: {}", burdenType.label, burdenDeltas.total());
            deltas.put(burdenType, burdenDeltas);
        }
        LOG.info("Compared scenario against baseline for diseases {} in {}.", diseases, stopwatch);
        return new ComparisonReport(rrBaseline, rrScenario, rrNormalizedToBaseline, af, alternativeAf,
                normalizedScenario, normalizedBaseline, deltas);
    }

    /**
     * Total change in burden across all strata.
     *
     * @param burdenType one of deaths, yll, yld or daly. Null means daly.
     * @param disease the label of one disease in the report, or "all" for the sum over diseases. Null means all.
     */
    public double getBurden (ComparisonReport report, String burdenType, String disease) {
        BurdenType type = burdenType == null ? BurdenType.DEFAULT : BurdenType.fromName(burdenType);
        Disease selected = parseDisease(disease, report.diseases());
        return totalDelta(report, type, selected);
    }

    /** Total change in burden across all strata for a single disease, or for all diseases when disease is null. */
    public double totalDelta (ComparisonReport report, BurdenType burdenType, Disease disease) {
        BurdenDeltas deltas = report.deltas(burdenType);
        return disease == null ? deltas.total() : deltas.total(disease);
    }

    /**
     * Compare the scenario against the baseline and return a single total change in burden. The query is validated
     * before any computation takes place.
     */
    public double deltaBurden (ExposureScenario baseline, ExposureScenario scenario, String burdenType, String disease) {
        BurdenType type = burdenType == null ? BurdenType.DEFAULT : BurdenType.fromName(burdenType);
        Disease selected = parseDisease(disease, baseline.parameters.gbd.diseases());
        return totalDelta(compareModels(baseline, scenario), type, selected);
    }

    /** Returns null for "all". Unknown diseases and diseases outside the assessment are configuration errors. */
    private static Disease parseDisease (String disease, Set<Disease> assessed) {
        if (disease == null || Disease.ALL.equalsIgnoreCase(disease.trim())) {
            return null;
        }
        Disease selected = Disease.fromName(disease);
        if (!assessed.contains(selected)) {
            LOG.error("Disease {} is not present in the burden of disease table.", disease);
            throw new ConfigurationException("Disease not contained in burden of disease table: " + disease);
        }
        return selected;
    }

}
