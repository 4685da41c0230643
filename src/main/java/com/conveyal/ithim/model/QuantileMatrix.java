package com.conveyal.ithim.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An immutable table of values by stratum and quantile: travel times, MET exposures or relative risks at each of
 * the probability points of a QuantileSet, for each of the sixteen strata.
 */
public final class QuantileMatrix {

    /** Function of a stratum and a zero-based quantile index, used to fill new matrices. */
    public interface CellFunction {
        double apply (Stratum stratum, int quantile);
    }

    public final int nQuantiles;

    /** First index is Stratum.index(), second is quantile index. */
    private final double[][] values;

    private QuantileMatrix (double[][] values, int nQuantiles) {
        this.values = values;
        this.nQuantiles = nQuantiles;
    }

    public static QuantileMatrix fromFunction (int nQuantiles, CellFunction function) {
        checkArgument(nQuantiles > 0, "A quantile matrix must have at least one quantile.");
        double[][] values = new double[Stratum.N_STRATA][nQuantiles];
        for (Stratum stratum : Stratum.ALL) {
            for (int q = 0; q < nQuantiles; q++) {
                values[stratum.index()][q] = function.apply(stratum, q);
            }
        }
        return new QuantileMatrix(values, nQuantiles);
    }

    /** Build a matrix from one row of quantile values per stratum, indexed by Stratum.index(). */
    public static QuantileMatrix fromRows (double[][] rows) {
        checkArgument(rows.length == Stratum.N_STRATA, "Must supply one row per stratum.");
        int nQuantiles = rows[0].length;
        for (double[] row : rows) {
            checkArgument(row.length == nQuantiles, "All strata must have the same number of quantiles.");
        }
        return fromFunction(nQuantiles, (stratum, q) -> rows[stratum.index()][q]);
    }

    public double get (Stratum stratum, int quantile) {
        return values[stratum.index()][quantile];
    }

    /** A copy of the values at every quantile for one stratum. */
    public double[] row (Stratum stratum) {
        return values[stratum.index()].clone();
    }

    /** Sum across the quantile axis for one stratum. */
    public double rowSum (Stratum stratum) {
        double sum = 0;
        for (double value : values[stratum.index()]) {
            sum += value;
        }
        return sum;
    }

    /** Sums across the quantile axis for every stratum. */
    public StratumMatrix rowSums () {
        return StratumMatrix.fromFunction(this::rowSum);
    }

    public QuantileMatrix map (DoubleUnaryOperator operator) {
        return fromFunction(nQuantiles, (stratum, q) -> operator.applyAsDouble(get(stratum, q)));
    }

    public QuantileMatrix combine (QuantileMatrix other, DoubleBinaryOperator operator) {
        checkArgument(other.nQuantiles == nQuantiles, "Quantile matrices must have the same number of quantiles.");
        return fromFunction(nQuantiles, (stratum, q) -> operator.applyAsDouble(get(stratum, q), other.get(stratum, q)));
    }

    /** Multiply every quantile of each stratum by that stratum's value in the given matrix. */
    public QuantileMatrix scaleRows (StratumMatrix factors) {
        return fromFunction(nQuantiles, (stratum, q) -> get(stratum, q) * factors.get(stratum));
    }

    /** Same structure as StratumMatrix JSON, with a list of quantile values in place of each scalar. */
    @JsonValue
    public Map<String, double[][]> toJson () {
        Map<String, double[][]> bySex = new LinkedHashMap<>();
        for (Sex sex : Sex.values()) {
            double[][] rows = new double[Stratum.N_AGE_CLASSES][];
            for (int ageClass = 1; ageClass <= Stratum.N_AGE_CLASSES; ageClass++) {
                rows[ageClass - 1] = row(Stratum.of(ageClass, sex));
            }
            bySex.put(sex.name(), rows);
        }
        return bySex;
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (!(other instanceof QuantileMatrix)) return false;
        return Arrays.deepEquals(values, ((QuantileMatrix) other).values);
    }

    @Override
    public int hashCode () {
        return Arrays.deepHashCode(values);
    }

}
