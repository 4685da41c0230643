package com.conveyal.ithim.exposure;

import com.conveyal.ithim.model.QuantileMatrix;
import com.conveyal.ithim.model.QuantileSet;
import com.conveyal.ithim.model.Stratum;
import com.conveyal.ithim.model.StratumMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits a lognormal distribution to the mean and standard deviation of each stratum and reads off the requested
 * quantiles. This gives exact quantiles of active transport time, which unlike total MET exposure has a closed form.
 *
 * A lognormal cannot have a mean of zero, and strata with no exposure at all are common (e.g. no cycling in the
 * oldest age class). Means at or below zero are therefore replaced with a small positive floor before fitting, with a
 * standard deviation of the floor times the coefficient of variation. This is a modelling policy: the resulting
 * quantiles are tiny but positive.
 */
public class QuantileResolver {

    private static final Logger LOG = LoggerFactory.getLogger(QuantileResolver.class);

    public interface Config {
        double meanFloor ();
    }

    private final double meanFloor;

    public QuantileResolver (Config config) {
        this.meanFloor = config.meanFloor();
    }

    public QuantileMatrix resolve (StratumMatrix mean, StratumMatrix sd, double cv, QuantileSet quantiles) {
        return QuantileMatrix.fromFunction(quantiles.size(),
                (stratum, q) -> fit(mean.get(stratum), sd.get(stratum), cv, stratum).quantile(quantiles.get(q)));
    }

    LogNormalFit fit (double mean, double sd, double cv, Stratum stratum) {
        if (mean <= 0) {
            LOG.debug("Mean of {} in stratum {} floored to {} before lognormal fit.", mean, stratum, meanFloor);
            return LogNormalFit.fromMoments(meanFloor, meanFloor * cv);
        }
        return LogNormalFit.fromMoments(mean, sd);
    }

}
