package com.conveyal.ithim.exposure;

import com.conveyal.ithim.model.StratumMatrix;

/**
 * Mean exposures by stratum for one scenario, as computed by ExposureMeansModel. Times are minutes per week,
 * non-travel activity is MET-hours per week.
 */
public final class ExposureMeans {

    public final StratumMatrix meanWalkTime;

    public final StratumMatrix meanCycleTime;

    /** Walking plus cycling time. */
    public final StratumMatrix meanActiveTransportTime;

    /** Mean active transport time times the constant coefficient of variation. */
    public final StratumMatrix sdActiveTransportTime;

    /** Proportion of active transport time spent cycling. */
    public final StratumMatrix propTimeCycling;

    /** Proportion of active transport time spent walking, one minus propTimeCycling. */
    public final StratumMatrix pWalk;

    public final StratumMatrix meanNonTravel;

    ExposureMeans (StratumMatrix meanWalkTime, StratumMatrix meanCycleTime, StratumMatrix meanNonTravel, double cv) {
        this.meanWalkTime = meanWalkTime;
        this.meanCycleTime = meanCycleTime;
        this.meanNonTravel = meanNonTravel;
        this.meanActiveTransportTime = meanWalkTime.combine(meanCycleTime, Double::sum);
        this.sdActiveTransportTime = meanActiveTransportTime.map(mean -> mean * cv);
        // With no active travel at all the split is undefined, count it as walking.
        this.propTimeCycling = meanCycleTime.combine(meanActiveTransportTime,
                (cycle, total) -> total > 0 ? cycle / total : 0);
        this.pWalk = propTimeCycling.map(p -> 1 - p);
    }

}
