package com.conveyal.ithim.model;

import com.conveyal.ithim.InputFormatException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.function.ToDoubleFunction;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable table holding one number per stratum (eight age classes by two sexes). This is used for population
 * shares, relative exposure weights, exposure means, attributable fractions and burden values.
 * All operations return new instances.
 */
public final class StratumMatrix {

    /** First index is sex ordinal, second is zero-based age class. */
    private final double[][] values;

    private StratumMatrix (double[][] values) {
        this.values = values;
    }

    /** Build a matrix from one column of eight values per sex, ordered by increasing age class. */
    public static StratumMatrix of (double[] male, double[] female) {
        checkNotNull(male);
        checkNotNull(female);
        checkArgument(male.length == Stratum.N_AGE_CLASSES && female.length == Stratum.N_AGE_CLASSES,
                "Each sex must have exactly " + Stratum.N_AGE_CLASSES + " age classes.");
        double[][] values = new double[Sex.values().length][];
        values[Sex.M.ordinal()] = male.clone();
        values[Sex.F.ordinal()] = female.clone();
        return new StratumMatrix(values);
    }

    /**
     * JSON representation used in parameter files and reports: an object with keys "M" and "F", each holding eight
     * values ordered by age class.
     */
    @JsonCreator
    public static StratumMatrix fromJson (Map<String, double[]> columns) {
        double[] male = columns.get(Sex.M.name());
        double[] female = columns.get(Sex.F.name());
        if (male == null || female == null || columns.size() != 2) {
            throw new InputFormatException("Stratified values must have exactly the keys M and F, found " + columns.keySet());
        }
        if (male.length != Stratum.N_AGE_CLASSES || female.length != Stratum.N_AGE_CLASSES) {
            throw new InputFormatException("Stratified values must have " + Stratum.N_AGE_CLASSES + " age classes per sex.");
        }
        return of(male, female);
    }

    @JsonValue
    public Map<String, double[]> toJson () {
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (Sex sex : Sex.values()) {
            columns.put(sex.name(), column(sex));
        }
        return columns;
    }

    public static StratumMatrix filled (double value) {
        return fromFunction(stratum -> value);
    }

    public static StratumMatrix fromFunction (ToDoubleFunction<Stratum> function) {
        double[][] values = new double[Sex.values().length][Stratum.N_AGE_CLASSES];
        for (Stratum stratum : Stratum.ALL) {
            values[stratum.sex.ordinal()][stratum.ageClass - 1] = function.applyAsDouble(stratum);
        }
        return new StratumMatrix(values);
    }

    public double get (Stratum stratum) {
        return values[stratum.sex.ordinal()][stratum.ageClass - 1];
    }

    public double get (int ageClass, Sex sex) {
        return get(Stratum.of(ageClass, sex));
    }

    /** A copy of the eight values for one sex, ordered by age class. */
    public double[] column (Sex sex) {
        return values[sex.ordinal()].clone();
    }

    public StratumMatrix map (DoubleUnaryOperator operator) {
        return fromFunction(stratum -> operator.applyAsDouble(get(stratum)));
    }

    /** Apply the operator cell by cell, with the value from this matrix as the left operand. */
    public StratumMatrix combine (StratumMatrix other, DoubleBinaryOperator operator) {
        return fromFunction(stratum -> operator.applyAsDouble(get(stratum), other.get(stratum)));
    }

    public double sum () {
        double sum = 0;
        for (double[] column : values) {
            for (double value : column) {
                sum += value;
            }
        }
        return sum;
    }

    /** The sum over all strata of the product of this matrix and the given weights. */
    public double weightedSum (StratumMatrix weights) {
        double sum = 0;
        for (Stratum stratum : Stratum.ALL) {
            sum += get(stratum) * weights.get(stratum);
        }
        return sum;
    }

    public double min () {
        double min = Double.POSITIVE_INFINITY;
        for (Stratum stratum : Stratum.ALL) {
            min = Math.min(min, get(stratum));
        }
        return min;
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (!(other instanceof StratumMatrix)) return false;
        return Arrays.deepEquals(values, ((StratumMatrix) other).values);
    }

    @Override
    public int hashCode () {
        return Arrays.deepHashCode(values);
    }

    @Override
    public String toString () {
        return "M=" + Arrays.toString(values[Sex.M.ordinal()]) + " F=" + Arrays.toString(values[Sex.F.ordinal()]);
    }

}
