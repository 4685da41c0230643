package com.conveyal.ithim.risk;

import com.conveyal.ithim.model.Sex;
import com.conveyal.ithim.model.Stratum;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The literature anchor applying to each stratum for one disease. Some diseases use a single anchor for everyone,
 * others differ by sex or between younger and older age classes.
 */
public final class DoseResponseAnchors {

    private final DoseResponseAnchor[] anchors;

    private DoseResponseAnchors (DoseResponseAnchor[] anchors) {
        this.anchors = anchors;
    }

    public DoseResponseAnchor get (Stratum stratum) {
        return anchors[stratum.index()];
    }

    public static DoseResponseAnchors uniform (DoseResponseAnchor anchor) {
        checkNotNull(anchor);
        DoseResponseAnchor[] anchors = new DoseResponseAnchor[Stratum.N_STRATA];
        for (Stratum stratum : Stratum.ALL) {
            anchors[stratum.index()] = anchor;
        }
        return new DoseResponseAnchors(anchors);
    }

    public static DoseResponseAnchors bySex (DoseResponseAnchor male, DoseResponseAnchor female) {
        checkNotNull(male);
        checkNotNull(female);
        DoseResponseAnchor[] anchors = new DoseResponseAnchor[Stratum.N_STRATA];
        for (Stratum stratum : Stratum.ALL) {
            anchors[stratum.index()] = stratum.sex == Sex.M ? male : female;
        }
        return new DoseResponseAnchors(anchors);
    }

    /**
     * One anchor for age classes up to and including lastYoungAgeClass, another for all older age classes,
     * the same for both sexes.
     */
    public static DoseResponseAnchors byAge (int lastYoungAgeClass, DoseResponseAnchor young, DoseResponseAnchor old) {
        checkArgument(lastYoungAgeClass >= 1 && lastYoungAgeClass < Stratum.N_AGE_CLASSES,
                "Age split must leave at least one age class on each side.");
        checkNotNull(young);
        checkNotNull(old);
        DoseResponseAnchor[] anchors = new DoseResponseAnchor[Stratum.N_STRATA];
        for (Stratum stratum : Stratum.ALL) {
            anchors[stratum.index()] = stratum.ageClass <= lastYoungAgeClass ? young : old;
        }
        return new DoseResponseAnchors(anchors);
    }

}
