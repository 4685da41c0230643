package com.conveyal.ithim.io;

import com.conveyal.ithim.InputFormatException;
import com.csvreader.CsvReader;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads typed values from the current record of a CsvReader, converting every problem into an InputFormatException
 * that names the column and line.
 */
abstract class CsvFields {

    /** Age classes may be written either as a bare number or in the form ageClass3. */
    private static final Pattern AGE_CLASS = Pattern.compile("(?i)(?:ageClass)?\\s*(\\d+)");

    static void requireHeaders (CsvReader reader, String source, String... headers) throws IOException {
        if (!reader.readHeaders()) {
            throw new InputFormatException(source + " is empty.");
        }
        for (String header : headers) {
            if (reader.getIndex(header) < 0) {
                throw new InputFormatException(String.format("%s is missing required column '%s'.", source, header));
            }
        }
    }

    static String string (CsvReader reader, String column) throws IOException {
        String value = reader.get(column);
        if (value == null || value.trim().isEmpty()) {
            throw new InputFormatException(String.format("Missing value in column '%s' on line %d.",
                    column, lineNumber(reader)));
        }
        return value.trim();
    }

    static double number (CsvReader reader, String column) throws IOException {
        String value = string(reader, column);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new InputFormatException(String.format("Value '%s' in column '%s' on line %d is not a number.",
                    value, column, lineNumber(reader)), e);
        }
    }

    static int ageClass (CsvReader reader, String column) throws IOException {
        String value = string(reader, column);
        Matcher matcher = AGE_CLASS.matcher(value);
        if (!matcher.matches()) {
            throw new InputFormatException(String.format("Value '%s' in column '%s' on line %d is not an age class.",
                    value, column, lineNumber(reader)));
        }
        return Integer.parseInt(matcher.group(1));
    }

    /** One-based line number in the file, counting the header line. */
    static long lineNumber (CsvReader reader) {
        return reader.getCurrentRecord() + 2;
    }

}
