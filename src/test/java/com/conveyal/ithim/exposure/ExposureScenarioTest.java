package com.conveyal.ithim.exposure;

import com.conveyal.ithim.IthimComponents;
import com.conveyal.ithim.IthimTestData;
import com.conveyal.ithim.model.Sex;
import com.conveyal.ithim.model.Stratum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExposureScenarioTest {

    private final IthimComponents components = new IthimComponents(IthimTestData.config(5_000, 2, 1));

    @AfterEach
    public void shutdown () {
        components.shutdown();
    }

    @Test
    public void testQuantilesSplitByMode () {
        ExposureScenario scenario = components.scenario(IthimTestData.parameters(20).build());
        ExposureQuantiles quantiles = scenario.quantiles;
        assertEquals(5, quantiles.activeTransportTime.nQuantiles);
        assertEquals(5, quantiles.totalMet.nQuantiles);
        for (Stratum stratum : Stratum.ALL) {
            for (int q = 0; q < 5; q++) {
                double total = quantiles.activeTransportTime.get(stratum, q);
                double split = quantiles.walkingTime.get(stratum, q) + quantiles.cyclingTime.get(stratum, q);
                assertEquals(total, split, total * 1e-12);
                assertTrue(quantiles.totalMet.get(stratum, q) >= 0.1);
            }
        }
        // No cycling at all in the oldest age class.
        assertEquals(0, quantiles.cyclingTime.get(Stratum.of(8, Sex.M), 4));
    }

}
