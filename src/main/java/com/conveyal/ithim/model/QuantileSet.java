package com.conveyal.ithim.model;

import com.conveyal.ithim.NumericDomainException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The ordered probability points at which exposure distributions are summarized. Every quantile matrix produced in
 * one comparison shares the cardinality and ordering of a single QuantileSet. Each quantile is treated downstream as
 * an equally weighted representative point of the population's exposure distribution.
 */
public final class QuantileSet {

    /** The 10th, 30th, 50th, 70th and 90th percentiles, i.e. the midpoints of population quintiles. */
    public static final QuantileSet QUINTILE_MIDPOINTS = new QuantileSet(0.1, 0.3, 0.5, 0.7, 0.9);

    private final double[] probabilities;

    @JsonCreator
    public QuantileSet (double... probabilities) {
        checkNotNull(probabilities);
        if (probabilities.length == 0) {
            throw new NumericDomainException("At least one quantile must be supplied.");
        }
        for (int q = 0; q < probabilities.length; q++) {
            double p = probabilities[q];
            if (!(p > 0 && p < 1)) {
                throw new NumericDomainException("Quantile probabilities must be strictly between 0 and 1, found " + p);
            }
            if (q > 0 && p <= probabilities[q - 1]) {
                throw new NumericDomainException("Quantile probabilities must be in strictly ascending order.");
            }
        }
        this.probabilities = probabilities.clone();
    }

    public int size () {
        return probabilities.length;
    }

    public double get (int q) {
        return probabilities[q];
    }

    @JsonValue
    public double[] toArray () {
        return probabilities.clone();
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (!(other instanceof QuantileSet)) return false;
        return Arrays.equals(probabilities, ((QuantileSet) other).probabilities);
    }

    @Override
    public int hashCode () {
        return Arrays.hashCode(probabilities);
    }

    @Override
    public String toString () {
        return Arrays.toString(probabilities);
    }

}
