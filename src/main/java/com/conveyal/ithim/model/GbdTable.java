package com.conveyal.ithim.model;

import com.conveyal.ithim.InputFormatException;
import com.conveyal.ithim.MissingBurdenDataException;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Baseline burden of disease supplied from Global Burden of Disease estimates: one value per disease, stratum and
 * burden type. The model never computes these numbers, it only redistributes and scales them.
 * Instances are immutable and are assembled with a Builder, usually by GbdTableReader.
 */
public final class GbdTable {

    private final ImmutableMap<Disease, Map<BurdenType, Map<Stratum, Double>>> values;

    private GbdTable (ImmutableMap<Disease, Map<BurdenType, Map<Stratum, Double>>> values) {
        this.values = values;
    }

    /** Diseases having at least one row in this table, in enum order. */
    public Set<Disease> diseases () {
        return ImmutableSet.copyOf(Sets.newEnumSet(values.keySet(), Disease.class));
    }

    public boolean contains (Disease disease) {
        return values.containsKey(disease);
    }

    public double value (Disease disease, BurdenType burdenType, Stratum stratum) {
        Map<BurdenType, Map<Stratum, Double>> byType = values.get(disease);
        if (byType == null) {
            throw new MissingBurdenDataException("No burden of disease rows for " + disease.label);
        }
        Map<Stratum, Double> byStratum = byType.get(burdenType);
        Double value = byStratum == null ? null : byStratum.get(stratum);
        if (value == null) {
            throw new MissingBurdenDataException(String.format("No %s value for %s in stratum %s.",
                    burdenType.label, disease.label, stratum));
        }
        return value;
    }

    /** Values for one disease and burden type in every stratum, failing if any stratum is absent. */
    public StratumMatrix burden (Disease disease, BurdenType burdenType) {
        return StratumMatrix.fromFunction(stratum -> value(disease, burdenType, stratum));
    }

    /** Check that every stratum has a value for every burden type, for each of the given diseases. */
    public void validateComplete (Iterable<Disease> diseases) {
        for (Disease disease : diseases) {
            for (BurdenType burdenType : BurdenType.values()) {
                burden(disease, burdenType);
            }
        }
    }

    public static Builder builder () {
        return new Builder();
    }

    public static class Builder {

        private final Map<Disease, Map<BurdenType, Map<Stratum, Double>>> values = new EnumMap<>(Disease.class);

        public Builder put (Disease disease, Stratum stratum, BurdenType burdenType, double value) {
            checkNotNull(disease);
            checkNotNull(stratum);
            checkNotNull(burdenType);
            Map<Stratum, Double> byStratum = values
                    .computeIfAbsent(disease, d -> new EnumMap<>(BurdenType.class))
                    .computeIfAbsent(burdenType, t -> new HashMap<>());
            if (byStratum.containsKey(stratum)) {
                throw new InputFormatException(String.format("Duplicate %s value for %s in stratum %s.",
                        burdenType.label, disease.label, stratum));
            }
            byStratum.put(stratum, value);
            return this;
        }

        /** Set the values of one disease and burden type in all strata at once. */
        public Builder put (Disease disease, BurdenType burdenType, StratumMatrix matrix) {
            for (Stratum stratum : Stratum.ALL) {
                put(disease, stratum, burdenType, matrix.get(stratum));
            }
            return this;
        }

        public GbdTable build () {
            ImmutableMap.Builder<Disease, Map<BurdenType, Map<Stratum, Double>>> copy = ImmutableMap.builder();
            for (Map.Entry<Disease, Map<BurdenType, Map<Stratum, Double>>> entry : values.entrySet()) {
                Map<BurdenType, Map<Stratum, Double>> byType = Maps.newEnumMap(BurdenType.class);
                entry.getValue().forEach((type, byStratum) -> byType.put(type, ImmutableMap.copyOf(byStratum)));
                copy.put(entry.getKey(), Maps.immutableEnumMap(byType));
            }
            return new GbdTable(copy.build());
        }
    }

}
