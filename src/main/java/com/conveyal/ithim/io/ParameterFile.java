package com.conveyal.ithim.io;

import com.conveyal.ithim.InputFormatException;
import com.conveyal.ithim.exposure.MeanType;
import com.conveyal.ithim.model.GbdTable;
import com.conveyal.ithim.model.QuantileSet;
import com.conveyal.ithim.model.ScenarioParameters;
import com.conveyal.ithim.model.Sex;
import com.conveyal.ithim.model.Stratum;
import com.conveyal.ithim.model.StratumMatrix;
import com.conveyal.ithim.model.TravelMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Map;

/**
 * The JSON description of one scenario, as written by users. Relative walking and cycling weights may be given
 * directly, or derived from a table of mean active transport times by dividing every stratum by the referent
 * stratum. Explicit weights take precedence over those derived from the table.
 *
 * Fields are public and mutable so Jackson can fill them in. Call toParameters to get validated, immutable
 * ScenarioParameters.
 */
public class ParameterFile {

    private static final Logger LOG = LoggerFactory.getLogger(ParameterFile.class);

    public StratumMatrix populationShare;

    public StratumMatrix walkWeights;

    public StratumMatrix cycleWeights;

    public StratumMatrix nonTravelWeights;

    /** Path to an active transport CSV, resolved against the directory containing the parameter file. */
    public String activeTransportFile;

    public int referentAgeClass = 3;

    public String referentSex = "F";

    public double meanWalkTime;

    public double meanCycleTime;

    public double meanNonTravel;

    public double cv;

    public double cvNonTravel;

    public String meanType = MeanType.OVERALL.label;

    /** Optional, the configured quantiles are used when absent. */
    public double[] quantiles;

    public static ParameterFile read (File file) {
        try {
            return JsonUtil.objectMapper.readValue(file, ParameterFile.class);
        } catch (IOException e) {
            throw new InputFormatException("Could not read scenario parameters from " + file, e);
        }
    }

    /**
     * @param baseDirectory directory against which a relative activeTransportFile is resolved
     * @param gbd the burden of disease table to attach to the parameters
     * @param defaultQuantiles used when the file does not list its own quantiles
     */
    public ScenarioParameters toParameters (File baseDirectory, GbdTable gbd, QuantileSet defaultQuantiles) {
        if (populationShare == null || nonTravelWeights == null) {
            throw new InputFormatException("Parameter file must contain populationShare and nonTravelWeights.");
        }
        StratumMatrix walk = walkWeights;
        StratumMatrix cycle = cycleWeights;
        if (walk == null || cycle == null) {
            if (activeTransportFile == null) {
                throw new InputFormatException(
                        "Parameter file must give walkWeights and cycleWeights, or an activeTransportFile.");
            }
            File csv = new File(activeTransportFile);
            if (!csv.isAbsolute()) {
                csv = new File(baseDirectory, activeTransportFile);
            }
            if (referentAgeClass < 1 || referentAgeClass > Stratum.N_AGE_CLASSES) {
                throw new InputFormatException("Referent age class out of range: " + referentAgeClass);
            }
            Map<TravelMode, StratumMatrix> times = ActiveTransportTimeReader.read(csv);
            Stratum referent = Stratum.of(referentAgeClass, Sex.fromCode(referentSex));
            if (walk == null) walk = relativeToReferent(times.get(TravelMode.WALKING), referent);
            if (cycle == null) cycle = relativeToReferent(times.get(TravelMode.CYCLING), referent);
            LOG.info("Derived relative active transport weights from {} with referent stratum {}.", csv, referent);
        }
        return ScenarioParameters.builder()
                .populationShare(populationShare)
                .walkWeights(walk)
                .cycleWeights(cycle)
                .nonTravelWeights(nonTravelWeights)
                .meanWalkTime(meanWalkTime)
                .meanCycleTime(meanCycleTime)
                .meanNonTravel(meanNonTravel)
                .cv(cv)
                .cvNonTravel(cvNonTravel)
                .meanType(MeanType.fromName(meanType))
                .quantiles(quantiles == null ? defaultQuantiles : new QuantileSet(quantiles))
                .gbd(gbd)
                .build();
    }

    static StratumMatrix relativeToReferent (StratumMatrix times, Stratum referent) {
        double referentTime = times.get(referent);
        if (!(referentTime > 0)) {
            throw new InputFormatException(String.format(
                    "Mean time in referent stratum %s must be positive to derive relative weights, found %s.",
                    referent, referentTime));
        }
        return times.map(time -> time / referentTime);
    }

}
