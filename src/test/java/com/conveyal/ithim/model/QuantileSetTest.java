package com.conveyal.ithim.model;

import com.conveyal.ithim.NumericDomainException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class QuantileSetTest {

    @Test
    public void testQuintileMidpoints () {
        QuantileSet quantiles = QuantileSet.QUINTILE_MIDPOINTS;
        assertEquals(5, quantiles.size());
        assertEquals(0.1, quantiles.get(0));
        assertEquals(0.9, quantiles.get(4));
    }

    @Test
    public void testProbabilitiesOutsideUnitInterval () {
        assertThrows(NumericDomainException.class, () -> new QuantileSet(0, 0.5));
        assertThrows(NumericDomainException.class, () -> new QuantileSet(0.5, 1));
        assertThrows(NumericDomainException.class, () -> new QuantileSet(-0.1));
        assertThrows(NumericDomainException.class, () -> new QuantileSet(Double.NaN));
    }

    @Test
    public void testOrdering () {
        assertThrows(NumericDomainException.class, () -> new QuantileSet(0.5, 0.3));
        assertThrows(NumericDomainException.class, () -> new QuantileSet(0.5, 0.5));
        assertThrows(NumericDomainException.class, () -> new QuantileSet());
    }

}
