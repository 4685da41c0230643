package com.conveyal.ithim;

/**
 * A value lies outside the domain of the function it will be fed into, e.g. a quantile probability that is not
 * strictly between zero and one, or a negative exposure weight.
 */
public class NumericDomainException extends IthimException {

    public NumericDomainException (String message) {
        super(message);
    }

}
