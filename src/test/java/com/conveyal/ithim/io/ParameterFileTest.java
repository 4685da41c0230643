package com.conveyal.ithim.io;

import com.conveyal.ithim.ConfigurationException;
import com.conveyal.ithim.InputFormatException;
import com.conveyal.ithim.IthimTestData;
import com.conveyal.ithim.exposure.MeanType;
import com.conveyal.ithim.model.GbdTable;
import com.conveyal.ithim.model.QuantileSet;
import com.conveyal.ithim.model.ScenarioParameters;
import com.conveyal.ithim.model.Sex;
import com.conveyal.ithim.model.Stratum;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ParameterFileTest {

    private static final GbdTable GBD = IthimTestData.fullGbd();

    private static File resource (String name) throws URISyntaxException {
        return new File(ParameterFileTest.class.getResource(name).toURI());
    }

    @Test
    public void testWeightsFromActiveTransportFile () throws Exception {
        File file = resource("baseline.json");
        ParameterFile parameterFile = ParameterFile.read(file);
        ScenarioParameters parameters =
                parameterFile.toParameters(file.getParentFile(), GBD, QuantileSet.QUINTILE_MIDPOINTS);
        // Referent stratum is age class 3, female.
        assertEquals(1, parameters.walkWeights.get(3, Sex.F), 1e-12);
        assertEquals(1, parameters.cycleWeights.get(3, Sex.F), 1e-12);
        assertEquals(60.0 / 57, parameters.walkWeights.get(2, Sex.M), 1e-12);
        assertEquals(30.0 / 12, parameters.cycleWeights.get(2, Sex.M), 1e-12);
        assertEquals(MeanType.OVERALL, parameters.meanType);
        assertEquals(QuantileSet.QUINTILE_MIDPOINTS, parameters.quantiles);
        assertEquals(3.0, parameters.cv);
    }

    @Test
    public void testExplicitWeights () throws Exception {
        File file = resource("scenario.json");
        ScenarioParameters parameters = ParameterFile.read(file)
                .toParameters(file.getParentFile(), GBD, QuantileSet.QUINTILE_MIDPOINTS);
        assertEquals(2, parameters.cycleWeights.get(Stratum.of(2, Sex.F)));
        assertEquals(MeanType.REFERENT, parameters.meanType);
        assertEquals(new QuantileSet(0.2, 0.4, 0.6, 0.8), parameters.quantiles);
    }

    @Test
    public void testReferentWithoutTravel () throws Exception {
        File file = resource("baseline.json");
        ParameterFile parameterFile = ParameterFile.read(file);
        // Nobody in the oldest female age class cycles.
        parameterFile.referentAgeClass = 8;
        assertThrows(InputFormatException.class,
                () -> parameterFile.toParameters(file.getParentFile(), GBD, QuantileSet.QUINTILE_MIDPOINTS));
    }

    @Test
    public void testUnknownMeanType () throws Exception {
        File file = resource("scenario.json");
        ParameterFile parameterFile = ParameterFile.read(file);
        parameterFile.meanType = "median";
        assertThrows(ConfigurationException.class,
                () -> parameterFile.toParameters(file.getParentFile(), GBD, QuantileSet.QUINTILE_MIDPOINTS));
    }

    @Test
    public void testMissingWeights () throws Exception {
        File file = resource("scenario.json");
        ParameterFile parameterFile = ParameterFile.read(file);
        parameterFile.walkWeights = null;
        assertThrows(InputFormatException.class,
                () -> parameterFile.toParameters(file.getParentFile(), GBD, QuantileSet.QUINTILE_MIDPOINTS));
    }

}
