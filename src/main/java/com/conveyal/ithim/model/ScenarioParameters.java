package com.conveyal.ithim.model;

import com.conveyal.ithim.NumericDomainException;
import com.conveyal.ithim.exposure.MeanType;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * All inputs describing one scenario (baseline or alternative): the population structure, relative exposure
 * weights by stratum, population-wide mean exposures and their coefficients of variation, and the external burden
 * of disease table. Walking and cycling times are in minutes per week, non-travel activity in MET-hours per week.
 *
 * Instances are immutable. Use the Builder, which validates all values when build() is called, so that no invalid
 * parameters can reach the numeric pipeline. A scenario is usually derived from a baseline with toBuilder(),
 * changing only the travel behaviour.
 */
public final class ScenarioParameters {

    /** Share of the total population in each stratum. */
    public final StratumMatrix populationShare;

    /** Relative walking time by stratum (shape factors, not minutes). */
    public final StratumMatrix walkWeights;

    /** Relative cycling time by stratum. */
    public final StratumMatrix cycleWeights;

    /** Relative non-travel physical activity by stratum. */
    public final StratumMatrix nonTravelWeights;

    public final double meanWalkTime;

    public final double meanCycleTime;

    public final double meanNonTravel;

    /** Coefficient of variation of active transport time, assumed constant across strata. */
    public final double cv;

    /** Coefficient of variation of non-travel activity. */
    public final double cvNonTravel;

    public final MeanType meanType;

    public final QuantileSet quantiles;

    public final GbdTable gbd;

    private ScenarioParameters (Builder builder) {
        this.populationShare = builder.populationShare;
        this.walkWeights = builder.walkWeights;
        this.cycleWeights = builder.cycleWeights;
        this.nonTravelWeights = builder.nonTravelWeights;
        this.meanWalkTime = builder.meanWalkTime;
        this.meanCycleTime = builder.meanCycleTime;
        this.meanNonTravel = builder.meanNonTravel;
        this.cv = builder.cv;
        this.cvNonTravel = builder.cvNonTravel;
        this.meanType = builder.meanType;
        this.quantiles = builder.quantiles;
        this.gbd = builder.gbd;
    }

    public static Builder builder () {
        return new Builder();
    }

    /** A builder initialized with all values of this instance. */
    public Builder toBuilder () {
        return new Builder()
                .populationShare(populationShare)
                .walkWeights(walkWeights)
                .cycleWeights(cycleWeights)
                .nonTravelWeights(nonTravelWeights)
                .meanWalkTime(meanWalkTime)
                .meanCycleTime(meanCycleTime)
                .meanNonTravel(meanNonTravel)
                .cv(cv)
                .cvNonTravel(cvNonTravel)
                .meanType(meanType)
                .quantiles(quantiles)
                .gbd(gbd);
    }

    public static class Builder {

        private StratumMatrix populationShare;
        private StratumMatrix walkWeights;
        private StratumMatrix cycleWeights;
        private StratumMatrix nonTravelWeights;
        private double meanWalkTime;
        private double meanCycleTime;
        private double meanNonTravel;
        private double cv;
        private double cvNonTravel;
        private MeanType meanType = MeanType.OVERALL;
        private QuantileSet quantiles = QuantileSet.QUINTILE_MIDPOINTS;
        private GbdTable gbd;

        public Builder populationShare (StratumMatrix populationShare) {
            this.populationShare = populationShare;
            return this;
        }

        public Builder walkWeights (StratumMatrix walkWeights) {
            this.walkWeights = walkWeights;
            return this;
        }

        public Builder cycleWeights (StratumMatrix cycleWeights) {
            this.cycleWeights = cycleWeights;
            return this;
        }

        public Builder nonTravelWeights (StratumMatrix nonTravelWeights) {
            this.nonTravelWeights = nonTravelWeights;
            return this;
        }

        public Builder meanWalkTime (double meanWalkTime) {
            this.meanWalkTime = meanWalkTime;
            return this;
        }

        public Builder meanCycleTime (double meanCycleTime) {
            this.meanCycleTime = meanCycleTime;
            return this;
        }

        public Builder meanNonTravel (double meanNonTravel) {
            this.meanNonTravel = meanNonTravel;
            return this;
        }

        public Builder cv (double cv) {
            this.cv = cv;
            return this;
        }

        public Builder cvNonTravel (double cvNonTravel) {
            this.cvNonTravel = cvNonTravel;
            return this;
        }

        public Builder meanType (MeanType meanType) {
            this.meanType = meanType;
            return this;
        }

        public Builder quantiles (QuantileSet quantiles) {
            this.quantiles = quantiles;
            return this;
        }

        public Builder gbd (GbdTable gbd) {
            this.gbd = gbd;
            return this;
        }

        public ScenarioParameters build () {
            checkNotNull(populationShare, "Population shares are required.");
            checkNotNull(walkWeights, "Walking weights are required.");
            checkNotNull(cycleWeights, "Cycling weights are required.");
            checkNotNull(nonTravelWeights, "Non-travel activity weights are required.");
            checkNotNull(meanType, "Mean type is required.");
            checkNotNull(quantiles, "Quantiles are required.");
            checkNotNull(gbd, "Burden of disease table is required.");
            checkNonNegative(populationShare, "population share");
            checkNonNegative(walkWeights, "walking weight");
            checkNonNegative(cycleWeights, "cycling weight");
            checkNonNegative(nonTravelWeights, "non-travel weight");
            checkNonNegative(meanWalkTime, "mean walking time");
            checkNonNegative(meanCycleTime, "mean cycling time");
            checkNonNegative(meanNonTravel, "mean non-travel activity");
            checkPositive(cv, "coefficient of variation of active transport time");
            checkPositive(cvNonTravel, "coefficient of variation of non-travel activity");
            return new ScenarioParameters(this);
        }

        private static void checkNonNegative (StratumMatrix matrix, String name) {
            if (!(matrix.min() >= 0)) {
                throw new NumericDomainException("Every " + name + " must be non-negative: " + matrix);
            }
        }

        private static void checkNonNegative (double value, String name) {
            if (!(value >= 0) || Double.isInfinite(value)) {
                throw new NumericDomainException("The " + name + " must be non-negative and finite, found " + value);
            }
        }

        private static void checkPositive (double value, String name) {
            if (!(value > 0) || Double.isInfinite(value)) {
                throw new NumericDomainException("The " + name + " must be positive and finite, found " + value);
            }
        }
    }

}
