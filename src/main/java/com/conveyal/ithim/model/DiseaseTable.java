package com.conveyal.ithim.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.Maps;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An immutable mapping from diseases to one stratified table per disease. Iteration follows the declaration order of
 * the Disease enum, so every table built from the same disease set lines up.
 */
public abstract class DiseaseTable<T> {

    private final Map<Disease, T> values;

    protected DiseaseTable (Map<Disease, T> values) {
        this.values = Maps.immutableEnumMap(values);
    }

    public Set<Disease> diseases () {
        return values.keySet();
    }

    public T get (Disease disease) {
        T value = values.get(disease);
        checkArgument(value != null, "No values for disease %s", disease);
        return value;
    }

    @JsonValue
    public Map<String, T> toJson () {
        Map<String, T> byLabel = new LinkedHashMap<>();
        values.forEach((disease, value) -> byLabel.put(disease.label, value));
        return byLabel;
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (other == null || getClass() != other.getClass()) return false;
        return values.equals(((DiseaseTable<?>) other).values);
    }

    @Override
    public int hashCode () {
        return values.hashCode();
    }

}
