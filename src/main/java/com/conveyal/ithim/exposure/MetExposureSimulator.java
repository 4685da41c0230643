package com.conveyal.ithim.exposure;

import com.conveyal.ithim.IthimException;
import com.conveyal.ithim.model.QuantileMatrix;
import com.conveyal.ithim.model.QuantileSet;
import com.conveyal.ithim.model.Stratum;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Finds quantiles of total physical activity (MET-hours per week) in each stratum by Monte Carlo simulation.
 * Total activity is the sum of active transport activity and non-travel activity, each lognormally distributed and
 * independent of the other. The sum of two lognormals has no closed form, so we draw a large sample from each, add
 * the draws pairwise and read off empirical quantiles.
 *
 * Active transport time is converted to METs by splitting each draw into walking and cycling time using the stratum's
 * proportion of time walking, then applying a fixed MET intensity to each mode. Cycling energy is assumed not to depend
 * on speed.
 *
 * Strata are independent, so they are simulated in parallel on a fixed-size pool of daemon threads. Each stratum gets
 * its own random number generator from the StratumRandomSource, so results do not depend on the number of threads.
 */
public class MetExposureSimulator {

    private static final Logger LOG = LoggerFactory.getLogger(MetExposureSimulator.class);

    private static final double MINUTES_PER_HOUR = 60;

    public interface Config {
        int sampleSize ();
        int simulationThreads ();
        double walkingMets ();
        double cyclingMets ();
        double meanFloor ();
        double totalMetFloor ();
    }

    private final int sampleSize;

    private final double walkingMets;

    private final double cyclingMets;

    private final double meanFloor;

    private final double totalMetFloor;

    private final ExecutorService executor;

    public MetExposureSimulator (Config config) {
        this.sampleSize = config.sampleSize();
        this.walkingMets = config.walkingMets();
        this.cyclingMets = config.cyclingMets();
        this.meanFloor = config.meanFloor();
        this.totalMetFloor = config.totalMetFloor();
        // More threads than strata would never be used.
        int nThreads = Math.min(config.simulationThreads(), Stratum.N_STRATA);
        this.executor = Executors.newFixedThreadPool(nThreads,
                new ThreadFactoryBuilder().setDaemon(true).setNameFormat("met-simulation-%d").build());
        LOG.info("MET exposure simulation will draw {} samples per stratum on {} threads.", sampleSize, nThreads);
    }

    /**
     * Simulate total MET exposure quantiles for all strata.
     *
     * @param cv coefficient of variation of active transport time
     * @param cvNonTravel coefficient of variation of non-travel activity
     * @return MET-hours per week at each quantile, never less than the configured floor
     */
    public QuantileMatrix simulate (ExposureMeans means, double cv, double cvNonTravel, QuantileSet quantiles,
                                    StratumRandomSource randomSource) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<Future<double[]>> futures = new ArrayList<>(Stratum.N_STRATA);
        for (Stratum stratum : Stratum.ALL) {
            Callable<double[]> task = () -> simulateStratum(
                    means.meanActiveTransportTime.get(stratum), cv,
                    means.meanNonTravel.get(stratum), cvNonTravel,
                    means.pWalk.get(stratum),
                    quantiles, randomSource.generatorFor(stratum)
            );
            futures.add(executor.submit(task));
        }
        double[][] rows = new double[Stratum.N_STRATA][];
        try {
            for (Stratum stratum : Stratum.ALL) {
                rows[stratum.index()] = futures.get(stratum.index()).get();
            }
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new IthimException("Interrupted while simulating MET exposure.", e);
        } catch (ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            throw new IthimException("MET exposure simulation failed.", e.getCause());
        }
        LOG.info("Simulated total MET exposure for {} strata in {}.", Stratum.N_STRATA, stopwatch);
        return QuantileMatrix.fromRows(rows);
    }

    /**
     * Draw sampleSize values of total MET exposure for a single stratum and return the requested empirical
     * quantiles, using linear interpolation between order statistics.
     */
    double[] simulateStratum (double meanTravelTime, double cvTravel, double meanNonTravel, double cvNonTravel,
                              double pWalk, QuantileSet quantiles, RandomGenerator random) {
        double[] travel = travelMets(meanTravelTime, cvTravel, pWalk, random);
        double[] nonTravel = nonTravelMets(meanNonTravel, cvNonTravel, random);
        double[] total = new double[sampleSize];
        for (int i = 0; i < sampleSize; i++) {
            total[i] = travel[i] + nonTravel[i];
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(total);
        double[] result = new double[quantiles.size()];
        for (int q = 0; q < result.length; q++) {
            result[q] = Math.max(percentile.evaluate(quantiles.get(q) * 100), totalMetFloor);
        }
        return result;
    }

    /** Active transport MET-hours per week, drawn from the lognormal distribution of active transport time. */
    double[] travelMets (double meanTravelTime, double cv, double pWalk, RandomGenerator random) {
        double[] minutes = fitWithFloor(meanTravelTime, cv).sample(random, sampleSize);
        double metsPerMinute = (pWalk * walkingMets + (1 - pWalk) * cyclingMets) / MINUTES_PER_HOUR;
        double[] mets = new double[sampleSize];
        for (int i = 0; i < sampleSize; i++) {
            mets[i] = minutes[i] * metsPerMinute;
        }
        return mets;
    }

    /** Non-travel MET-hours per week, drawn from its own lognormal distribution. */
    double[] nonTravelMets (double meanNonTravel, double cv, RandomGenerator random) {
        return fitWithFloor(meanNonTravel, cv).sample(random, sampleSize);
    }

    private LogNormalFit fitWithFloor (double mean, double cv) {
        double flooredMean = mean > 0 ? mean : meanFloor;
        return LogNormalFit.fromMoments(flooredMean, flooredMean * cv);
    }

    /** Stop the worker threads. No further simulations can be run after this is called. */
    public void shutdown () {
        executor.shutdownNow();
    }

}
