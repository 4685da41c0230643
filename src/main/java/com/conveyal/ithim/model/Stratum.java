package com.conveyal.ithim.model;

import com.google.common.collect.ImmutableList;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A population subgroup defined by an age class and a sex. There are always eight age classes, numbered from one,
 * so every stratified table in the model has exactly sixteen cells. Strata are ordered with all male age classes
 * first, then all female age classes, and this ordering is used for flat indexing into arrays.
 */
public final class Stratum {

    public static final int N_AGE_CLASSES = 8;

    public static final int N_STRATA = N_AGE_CLASSES * Sex.values().length;

    /** All strata in index order. */
    public static final ImmutableList<Stratum> ALL;

    static {
        ImmutableList.Builder<Stratum> builder = ImmutableList.builder();
        for (Sex sex : Sex.values()) {
            for (int ageClass = 1; ageClass <= N_AGE_CLASSES; ageClass++) {
                builder.add(new Stratum(ageClass, sex));
            }
        }
        ALL = builder.build();
    }

    public final int ageClass;

    public final Sex sex;

    private Stratum (int ageClass, Sex sex) {
        this.ageClass = ageClass;
        this.sex = sex;
    }

    public static Stratum of (int ageClass, Sex sex) {
        checkArgument(ageClass >= 1 && ageClass <= N_AGE_CLASSES, "Age class must be in range [1, 8].");
        checkNotNull(sex);
        return ALL.get(index(ageClass, sex));
    }

    /** Position of this stratum in flat arrays of length N_STRATA. */
    public int index () {
        return index(ageClass, sex);
    }

    private static int index (int ageClass, Sex sex) {
        return sex.ordinal() * N_AGE_CLASSES + ageClass - 1;
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (!(other instanceof Stratum)) return false;
        Stratum stratum = (Stratum) other;
        return ageClass == stratum.ageClass && sex == stratum.sex;
    }

    @Override
    public int hashCode () {
        return Objects.hash(ageClass, sex);
    }

    @Override
    public String toString () {
        return "ageClass" + ageClass + "/" + sex;
    }

}
