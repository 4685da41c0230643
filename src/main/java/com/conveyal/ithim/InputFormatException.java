package com.conveyal.ithim;

/**
 * Input tables are malformed: age classes out of order, mismatched numbers of age classes between travel modes,
 * unparseable values or missing columns.
 */
public class InputFormatException extends IthimException {

    public InputFormatException (String message) {
        super(message);
    }

    public InputFormatException (String message, Throwable cause) {
        super(message, cause);
    }

}
