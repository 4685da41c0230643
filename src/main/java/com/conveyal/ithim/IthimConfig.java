package com.conveyal.ithim;

import com.conveyal.ithim.exposure.MetExposureSimulator;
import com.conveyal.ithim.exposure.QuantileResolver;
import com.conveyal.ithim.model.QuantileSet;
import com.conveyal.ithim.risk.DoseResponseModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Loads the policy constants of the model and exposes them to the components through their Config interfaces.
 * Every key has a documented default in ithim-defaults.properties on the classpath. Any of them may be overridden by
 * a user-supplied properties file, by environment variables or by system properties (see ConfigBase).
 */
public class IthimConfig extends ConfigBase implements
        QuantileResolver.Config,
        MetExposureSimulator.Config,
        DoseResponseModel.Config
{

    // CONSTANTS AND STATIC FIELDS

    private static final Logger LOG = LoggerFactory.getLogger(IthimConfig.class);

    public static final String DEFAULTS_RESOURCE = "ithim-defaults.properties";

    // INSTANCE FIELDS

    private final double walkingMets;
    private final double cyclingMets;
    private final double extrapolationExponent;
    private final int sampleSize;
    private final QuantileSet quantiles;
    private final double totalMetFloor;
    private final double meanFloor;
    private final int simulationThreads;
    private final long randomSeed;

    // CONSTRUCTORS

    protected IthimConfig (Properties properties) {
        super(properties);
        walkingMets = doubleProp("walking-mets");
        if (!(walkingMets > 0)) invalid("walking-mets", "must be positive");
        cyclingMets = doubleProp("cycling-mets");
        if (!(cyclingMets > 0)) invalid("cycling-mets", "must be positive");
        extrapolationExponent = doubleProp("extrapolation-exponent");
        if (!(extrapolationExponent > 0)) invalid("extrapolation-exponent", "must be positive");
        sampleSize = intProp("sample-size");
        if (sampleSize < 1) invalid("sample-size", "must be at least one");
        totalMetFloor = doubleProp("total-met-floor");
        if (!(totalMetFloor > 0)) invalid("total-met-floor", "must be positive");
        meanFloor = doubleProp("mean-floor");
        if (!(meanFloor > 0)) invalid("mean-floor", "must be positive");
        {
            // Zero means one thread per available processor.
            int threads = intProp("simulation-threads");
            if (threads < 0) invalid("simulation-threads", "must not be negative");
            if (threads == 0) {
                threads = Runtime.getRuntime().availableProcessors();
                LOG.info("Java reports the number of available processors is: {}", threads);
            }
            simulationThreads = Math.max(threads, 1);
        }
        randomSeed = longProp("random-seed");
        quantiles = parseQuantiles(doubleArrayProp("quantiles"));
        throwIfErrors();
    }

    private QuantileSet parseQuantiles (double[] probabilities) {
        if (probabilities.length == 0) {
            // A missing key has already been recorded by strProp, this also catches an empty list.
            invalid("quantiles", "must contain at least one probability");
            return null;
        }
        try {
            return new QuantileSet(probabilities);
        } catch (NumericDomainException e) {
            invalid("quantiles", e.getMessage());
            return null;
        }
    }

    // INTERFACE IMPLEMENTATIONS
    // Methods implementing component Config interfaces.
    // Note that one method can implement several Config interfaces at once.

    @Override public double walkingMets ()           { return walkingMets; }
    @Override public double cyclingMets ()           { return cyclingMets; }
    @Override public double extrapolationExponent () { return extrapolationExponent; }
    @Override public int    sampleSize ()            { return sampleSize; }
    @Override public double totalMetFloor ()         { return totalMetFloor; }
    @Override public double meanFloor ()             { return meanFloor; }
    @Override public int    simulationThreads ()     { return simulationThreads; }

    public QuantileSet quantiles ()                  { return quantiles; }
    public long randomSeed ()                        { return randomSeed; }

    // STATIC FACTORY METHODS
    // Use these to construct IthimConfig objects for readability.

    /** The documented defaults, subject only to environment variable and system property overrides. */
    public static IthimConfig fromDefaults () {
        return new IthimConfig(defaultProperties());
    }

    /** The given properties layered over the documented defaults. */
    public static IthimConfig fromProperties (Properties overrides) {
        Properties properties = defaultProperties();
        properties.putAll(overrides);
        return new IthimConfig(properties);
    }

    public static IthimConfig fromFile (String filename) {
        LOG.info("Loading configuration from {}", filename);
        return fromProperties(propsFromFile(filename));
    }

    private static Properties defaultProperties () {
        return propsFromResource(IthimConfig.class, "/" + DEFAULTS_RESOURCE);
    }

}
