package com.conveyal.ithim;

/**
 * A generic exception for problems encountered while assessing the health impact of a change in active travel.
 * Subclasses distinguish bad input files, bad configuration, incomplete burden of disease data and numeric domain
 * problems. All of them are raised as soon as the problem is detected, before any part of the comparison is computed.
 */
public class IthimException extends RuntimeException {

    public IthimException (String message) {
        super(message);
    }

    public IthimException (String message, Throwable cause) {
        super(message, cause);
    }

}
