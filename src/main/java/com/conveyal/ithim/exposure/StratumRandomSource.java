package com.conveyal.ithim.exposure;

import com.conveyal.ithim.model.Stratum;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Supplies an independent random number generator for each stratum of a Monte Carlo simulation.
 * Giving every stratum its own generator, derived only from a seed and the stratum, makes results reproducible no
 * matter how many threads the strata are spread across or in which order they complete.
 */
public interface StratumRandomSource {

    /** Called once per stratum per simulation. Must return a new generator on every call. */
    RandomGenerator generatorFor (Stratum stratum);

    /**
     * Mersenne twister generators seeded from the given seed and the stratum index. Two sources with the same seed
     * produce identical sequences for every stratum.
     */
    static StratumRandomSource seeded (long seed) {
        return stratum -> new MersenneTwister(new int[] { (int) (seed >>> 32), (int) seed, stratum.index() });
    }

}
