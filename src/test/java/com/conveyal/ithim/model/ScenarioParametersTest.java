package com.conveyal.ithim.model;

import com.conveyal.ithim.IthimTestData;
import com.conveyal.ithim.NumericDomainException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ScenarioParametersTest {

    @Test
    public void testToBuilder () {
        ScenarioParameters parameters = IthimTestData.parameters(20).build();
        ScenarioParameters changed = parameters.toBuilder().meanCycleTime(40).build();
        assertEquals(40, changed.meanCycleTime);
        assertEquals(parameters.meanWalkTime, changed.meanWalkTime);
        assertEquals(parameters.walkWeights, changed.walkWeights);
    }

    @Test
    public void testNegativeValuesRejected () {
        assertThrows(NumericDomainException.class, () -> IthimTestData.parameters(-1).build());
        assertThrows(NumericDomainException.class,
                () -> IthimTestData.parameters(20).walkWeights(StratumMatrix.filled(-1)).build());
        assertThrows(NumericDomainException.class, () -> IthimTestData.parameters(20).cv(0).build());
    }

}
