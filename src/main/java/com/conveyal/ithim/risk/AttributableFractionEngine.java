package com.conveyal.ithim.risk;

import com.conveyal.ithim.model.AttributableFractions;
import com.conveyal.ithim.model.Disease;
import com.conveyal.ithim.model.QuantileMatrix;
import com.conveyal.ithim.model.RelativeRiskTable;
import com.conveyal.ithim.model.Stratum;
import com.conveyal.ithim.model.StratumMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Compares the relative risks of a scenario against those of a baseline. Each quantile stands for an equal share of
 * the stratum's population, so sums over quantiles are proportional to the mean relative risk of the stratum.
 */
public class AttributableFractionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AttributableFractionEngine.class);

    /**
     * The proportional reduction in disease burden when the population moves from baseline to scenario exposure:
     * one minus the ratio of summed scenario relative risk to summed baseline relative risk, in each stratum.
     * Negative values mean the scenario carries more risk than the baseline.
     */
    public AttributableFractions attributableFractions (RelativeRiskTable scenario, RelativeRiskTable baseline) {
        checkSameDiseases(scenario, baseline);
        Map<Disease, StratumMatrix> fractions = new EnumMap<>(Disease.class);
        for (Disease disease : scenario.diseases()) {
            StratumMatrix scenarioSums = scenario.get(disease).rowSums();
            StratumMatrix baselineSums = baseline.get(disease).rowSums();
            StratumMatrix af = scenarioSums.combine(baselineSums, (s, b) -> 1 - s / b);
            LOG.debug("Attributable fraction for {}: {}", disease, af);
            fractions.put(disease, af);
        }
        return new AttributableFractions(fractions);
    }

    /** Baseline relative risk divided by scenario relative risk, cell by cell. Reported but not used for burden. */
    public RelativeRiskTable normalizedToBaseline (RelativeRiskTable baseline, RelativeRiskTable scenario) {
        checkSameDiseases(scenario, baseline);
        Map<Disease, QuantileMatrix> ratios = new EnumMap<>(Disease.class);
        for (Disease disease : baseline.diseases()) {
            ratios.put(disease, baseline.get(disease).combine(scenario.get(disease), (b, s) -> b / s));
        }
        return new RelativeRiskTable(ratios);
    }

    /**
     * The shape of burden across quantiles within each stratum: every relative risk divided by the relative risk of
     * the stratum's first (least active) quantile. The first quantile of the result is always one.
     */
    public RelativeRiskTable normalizeDiseaseBurden (RelativeRiskTable relativeRisks) {
        Map<Disease, QuantileMatrix> normalized = new EnumMap<>(Disease.class);
        for (Disease disease : relativeRisks.diseases()) {
            QuantileMatrix rr = relativeRisks.get(disease);
            normalized.put(disease, QuantileMatrix.fromFunction(rr.nQuantiles,
                    (stratum, q) -> rr.get(stratum, q) / rr.get(stratum, 0)));
        }
        return new RelativeRiskTable(normalized);
    }

    /**
     * An alternative attributable fraction computed from normalized burden shapes as
     * (sum of scenario - sum of baseline) / sum of scenario. This is only a diagnostic and never feeds into burden.
     */
    public AttributableFractions alternativeAttributableFractions (RelativeRiskTable scenarioNormalized,
                                                                   RelativeRiskTable baselineNormalized) {
        checkSameDiseases(scenarioNormalized, baselineNormalized);
        Map<Disease, StratumMatrix> fractions = new EnumMap<>(Disease.class);
        for (Disease disease : scenarioNormalized.diseases()) {
            QuantileMatrix scenario = scenarioNormalized.get(disease);
            QuantileMatrix baseline = baselineNormalized.get(disease);
            fractions.put(disease, StratumMatrix.fromFunction((Stratum stratum) -> {
                double scenarioSum = scenario.rowSum(stratum);
                return (scenarioSum - baseline.rowSum(stratum)) / scenarioSum;
            }));
        }
        return new AttributableFractions(fractions);
    }

    private static void checkSameDiseases (RelativeRiskTable a, RelativeRiskTable b) {
        checkArgument(a.diseases().equals(b.diseases()),
                "Relative risk tables cover different diseases: %s and %s", a.diseases(), b.diseases());
    }

}
