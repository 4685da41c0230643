package com.conveyal.ithim.io;

import com.conveyal.ithim.InputFormatException;
import com.conveyal.ithim.model.Sex;
import com.conveyal.ithim.model.Stratum;
import com.conveyal.ithim.model.StratumMatrix;
import com.conveyal.ithim.model.TravelMode;
import com.csvreader.CsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a table of mean walking and cycling times (minutes per week) stratified by age class and sex, with columns
 * mode, ageClass, sex and value. Within each mode and sex, rows must appear in strictly increasing age class order,
 * and every mode must cover the same number of age classes. Age classes must lie in 1..8, so together with the
 * ordering and the count of eight rows per sex, each column is exactly age classes 1 through 8.
 */
public class ActiveTransportTimeReader {

    private static final Logger LOG = LoggerFactory.getLogger(ActiveTransportTimeReader.class);

    public static Map<TravelMode, StratumMatrix> read (File file) {
        try (InputStream stream = new FileInputStream(file)) {
            return read(stream, file.getName());
        } catch (IOException e) {
            throw new InputFormatException("Could not read active transport file " + file, e);
        }
    }

    public static Map<TravelMode, StratumMatrix> read (InputStream stream, String source) {
        // Values for each mode and sex, in file order.
        Map<TravelMode, Map<Sex, List<Double>>> values = new EnumMap<>(TravelMode.class);
        CsvReader reader = new CsvReader(stream, ',', StandardCharsets.UTF_8);
        try {
            CsvFields.requireHeaders(reader, source, "mode", "ageClass", "sex", "value");
            Map<TravelMode, Map<Sex, Integer>> lastAgeClass = new EnumMap<>(TravelMode.class);
            while (reader.readRecord()) {
                TravelMode mode = TravelMode.fromName(CsvFields.string(reader, "mode"));
                Sex sex = Sex.fromCode(CsvFields.string(reader, "sex"));
                int ageClass = CsvFields.ageClass(reader, "ageClass");
                if (ageClass < 1 || ageClass > Stratum.N_AGE_CLASSES) {
                    throw new InputFormatException(String.format("Age class %d on line %d of %s is out of range.",
                            ageClass, CsvFields.lineNumber(reader), source));
                }
                double value = CsvFields.number(reader, "value");
                Integer previous = lastAgeClass.computeIfAbsent(mode, m -> new EnumMap<>(Sex.class)).put(sex, ageClass);
                if (previous != null && ageClass <= previous) {
                    throw new InputFormatException(String.format(
                            "Age classes must be in increasing order in %s, found %d after %d for %s %s on line %d.",
                            source, ageClass, previous, mode, sex, CsvFields.lineNumber(reader)));
                }
                values.computeIfAbsent(mode, m -> new EnumMap<>(Sex.class))
                        .computeIfAbsent(sex, s -> new ArrayList<>())
                        .add(value);
            }
        } catch (IOException e) {
            throw new InputFormatException("Could not read active transport table " + source, e);
        } finally {
            reader.close();
        }
        return toMatrices(values, source);
    }

    private static Map<TravelMode, StratumMatrix> toMatrices (Map<TravelMode, Map<Sex, List<Double>>> values,
                                                              String source) {
        Integer rowsPerMode = null;
        for (TravelMode mode : TravelMode.values()) {
            Map<Sex, List<Double>> bySex = values.get(mode);
            if (bySex == null) {
                throw new InputFormatException(String.format("%s has no rows for mode %s.", source, mode.code));
            }
            int rows = bySex.values().stream().mapToInt(List::size).sum();
            if (rowsPerMode != null && rows != rowsPerMode) {
                throw new InputFormatException(String.format(
                        "Problem with age classes in %s: modes have different numbers of rows (%d and %d).",
                        source, rowsPerMode, rows));
            }
            rowsPerMode = rows;
        }
        Map<TravelMode, StratumMatrix> matrices = new EnumMap<>(TravelMode.class);
        for (TravelMode mode : TravelMode.values()) {
            Map<Sex, List<Double>> bySex = values.get(mode);
            double[][] columns = new double[Sex.values().length][];
            for (Sex sex : Sex.values()) {
                List<Double> column = bySex.get(sex);
                if (column == null || column.size() != Stratum.N_AGE_CLASSES) {
                    throw new InputFormatException(String.format("%s must have %d age classes for %s %s, found %d.",
                            source, Stratum.N_AGE_CLASSES, mode.code, sex, column == null ? 0 : column.size()));
                }
                columns[sex.ordinal()] = column.stream().mapToDouble(Double::doubleValue).toArray();
            }
            matrices.put(mode, StratumMatrix.of(columns[Sex.M.ordinal()], columns[Sex.F.ordinal()]));
        }
        LOG.info("Read mean active transport time for {} age classes from {}.", Stratum.N_AGE_CLASSES, source);
        return matrices;
    }

}
