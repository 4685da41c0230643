package com.conveyal.ithim.io;

import com.conveyal.ithim.ConfigurationException;
import com.conveyal.ithim.InputFormatException;
import com.conveyal.ithim.model.BurdenType;
import com.conveyal.ithim.model.Disease;
import com.conveyal.ithim.model.GbdTable;
import com.conveyal.ithim.model.Sex;
import com.conveyal.ithim.model.Stratum;
import com.csvreader.CsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads Global Burden of Disease estimates from a CSV file with columns disease, ageClass, sex, burdenType and value.
 * Rows for road traffic injuries and for diseases outside the physical activity pathway are skipped.
 */
public class GbdTableReader {

    private static final Logger LOG = LoggerFactory.getLogger(GbdTableReader.class);

    public static GbdTable read (File file) {
        try (InputStream stream = new FileInputStream(file)) {
            return read(stream, file.getName());
        } catch (IOException e) {
            throw new InputFormatException("Could not read burden of disease file " + file, e);
        }
    }

    public static GbdTable read (InputStream stream, String source) {
        GbdTable.Builder builder = GbdTable.builder();
        Set<String> skipped = new TreeSet<>();
        int nRows = 0;
        CsvReader reader = new CsvReader(stream, ',', StandardCharsets.UTF_8);
        try {
            CsvFields.requireHeaders(reader, source, "disease", "ageClass", "sex", "burdenType", "value");
            while (reader.readRecord()) {
                String diseaseName = CsvFields.string(reader, "disease");
                Disease disease = Disease.forLabel(diseaseName);
                if (disease == null) {
                    skipped.add(diseaseName);
                    continue;
                }
                int ageClass = CsvFields.ageClass(reader, "ageClass");
                if (ageClass < 1 || ageClass > Stratum.N_AGE_CLASSES) {
                    throw new InputFormatException(String.format("Age class %d on line %d of %s is out of range.",
                            ageClass, CsvFields.lineNumber(reader), source));
                }
                Sex sex = Sex.fromCode(CsvFields.string(reader, "sex"));
                BurdenType burdenType = burdenType(CsvFields.string(reader, "burdenType"), reader);
                builder.put(disease, Stratum.of(ageClass, sex), burdenType, CsvFields.number(reader, "value"));
                nRows += 1;
            }
        } catch (IOException e) {
            throw new InputFormatException("Could not read burden of disease table " + source, e);
        } finally {
            reader.close();
        }
        for (String name : skipped) {
            if (Disease.INJURY_LABEL.equals(name)) {
                LOG.warn("Skipping {} rows in {}, injuries are not part of the physical activity pathway.", name, source);
            } else {
                LOG.warn("Skipping rows for unrecognized disease {} in {}.", name, source);
            }
        }
        GbdTable table = builder.build();
        LOG.info("Read {} burden of disease values for {} from {}.", nRows, table.diseases(), source);
        return table;
    }

    /** An unknown burden type in an input table is a format problem, not a query problem. */
    private static BurdenType burdenType (String name, CsvReader reader) {
        try {
            return BurdenType.fromName(name);
        } catch (ConfigurationException e) {
            throw new InputFormatException(String.format("Unknown burden type '%s' on line %d.",
                    name, CsvFields.lineNumber(reader)), e);
        }
    }

}
