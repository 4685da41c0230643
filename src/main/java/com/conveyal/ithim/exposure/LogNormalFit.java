package com.conveyal.ithim.exposure;

import com.conveyal.ithim.NumericDomainException;
import org.apache.commons.math3.distribution.LogNormalDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;

import java.util.Arrays;

/**
 * A lognormal distribution parameterized by matching its first two moments to a given mean and standard deviation:
 * location = ln(mean) - ln(1 + (sd/mean)^2) / 2 and scale = sqrt(ln(1 + (sd/mean)^2)).
 * The mean must be positive. Callers are responsible for flooring zero means before fitting.
 */
public final class LogNormalFit {

    // Pass a null generator, this instance is only used for its inverse CDF and would otherwise seed a Well19937c.
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0, 1);

    public final double location;

    public final double scale;

    private LogNormalFit (double location, double scale) {
        this.location = location;
        this.scale = scale;
    }

    public static LogNormalFit fromMoments (double mean, double sd) {
        if (!(mean > 0)) {
            throw new NumericDomainException("Lognormal mean must be positive, found " + mean);
        }
        double relativeVariance = FastMath.log(1 + (sd / mean) * (sd / mean));
        return new LogNormalFit(FastMath.log(mean) - relativeVariance / 2, FastMath.sqrt(relativeVariance));
    }

    /** Inverse cumulative distribution function. With a scale of zero every quantile is the mean. */
    public double quantile (double probability) {
        if (scale == 0) {
            return FastMath.exp(location);
        }
        return FastMath.exp(location + scale * STANDARD_NORMAL.inverseCumulativeProbability(probability));
    }

    /** The mean of this distribution, exp(location + scale^2 / 2), which recovers the fitted mean. */
    public double mean () {
        return FastMath.exp(location + scale * scale / 2);
    }

    /** Draw n independent values using the supplied generator. */
    public double[] sample (RandomGenerator random, int n) {
        if (scale == 0) {
            double[] constant = new double[n];
            Arrays.fill(constant, FastMath.exp(location));
            return constant;
        }
        return new LogNormalDistribution(random, location, scale).sample(n);
    }

}
