package com.conveyal.ithim.io;

import com.conveyal.ithim.InputFormatException;
import com.conveyal.ithim.model.BurdenType;
import com.conveyal.ithim.model.Disease;
import com.conveyal.ithim.model.GbdTable;
import com.conveyal.ithim.model.Sex;
import com.conveyal.ithim.model.Stratum;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class GbdTableReaderTest {

    private static final String HEADER = "disease,ageClass,sex,burdenType,value\n";

    private static InputStream inline (String rows) {
        return new ByteArrayInputStream((HEADER + rows).getBytes(StandardCharsets.UTF_8));
    }

    /** Injury rows and diseases outside the pathway are dropped. */
    @Test
    public void testRead () {
        GbdTable gbd = GbdTableReader.read(GbdTableReaderTest.class.getResourceAsStream("gbd.csv"), "gbd.csv");
        assertEquals(EnumSet.of(Disease.CVD, Disease.DIABETES), gbd.diseases());
        assertEquals(3031, gbd.value(Disease.CVD, BurdenType.DALY, Stratum.of(3, Sex.F)));
        assertEquals(80, gbd.value(Disease.DIABETES, BurdenType.DEATHS, Stratum.of(8, Sex.M)));
        gbd.validateComplete(gbd.diseases());
    }

    @Test
    public void testUnknownBurdenType () {
        assertThrows(InputFormatException.class, () -> GbdTableReader.read(inline("CVD,1,M,qaly,3\n"), "inline"));
    }

    @Test
    public void testMalformedValue () {
        assertThrows(InputFormatException.class, () -> GbdTableReader.read(inline("CVD,1,M,daly,many\n"), "inline"));
        assertThrows(InputFormatException.class, () -> GbdTableReader.read(inline("CVD,9,M,daly,1\n"), "inline"));
        assertThrows(InputFormatException.class, () -> GbdTableReader.read(inline("CVD,1,X,daly,1\n"), "inline"));
    }

}
