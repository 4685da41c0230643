package com.conveyal.ithim;

/** The supplied burden of disease table has no value for a disease, stratum and burden type that was requested. */
public class MissingBurdenDataException extends IthimException {

    public MissingBurdenDataException (String message) {
        super(message);
    }

}
