package com.conveyal.ithim.exposure;

import com.conveyal.ithim.model.QuantileMatrix;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Quantiles of the exposure distributions of one scenario. Travel times are in minutes per week and total exposure in
 * MET-hours per week. Walking and cycling time quantiles are not independent distributions: they are the active
 * transport time quantiles split by each stratum's proportion of time spent cycling.
 */
public final class ExposureQuantiles {

    public final QuantileMatrix activeTransportTime;

    public final QuantileMatrix walkingTime;

    public final QuantileMatrix cyclingTime;

    /** Travel plus non-travel activity, floored at a small positive value. This is the dose-response input. */
    public final QuantileMatrix totalMet;

    private ExposureQuantiles (QuantileMatrix activeTransportTime, QuantileMatrix walkingTime,
                               QuantileMatrix cyclingTime, QuantileMatrix totalMet) {
        this.activeTransportTime = activeTransportTime;
        this.walkingTime = walkingTime;
        this.cyclingTime = cyclingTime;
        this.totalMet = totalMet;
    }

    public static ExposureQuantiles of (ExposureMeans means, QuantileMatrix activeTransportTime,
                                        QuantileMatrix totalMet) {
        checkArgument(activeTransportTime.nQuantiles == totalMet.nQuantiles,
                "Time and MET quantiles must use the same quantile set.");
        return new ExposureQuantiles(
                activeTransportTime,
                activeTransportTime.scaleRows(means.pWalk),
                activeTransportTime.scaleRows(means.propTimeCycling),
                totalMet
        );
    }

}
