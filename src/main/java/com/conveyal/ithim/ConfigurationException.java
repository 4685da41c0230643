package com.conveyal.ithim;

/**
 * An unrecognized option value: mean type, burden type, disease name, or a configuration property that is missing
 * or cannot be parsed.
 */
public class ConfigurationException extends IthimException {

    public ConfigurationException (String message) {
        super(message);
    }

    public ConfigurationException (String message, Throwable cause) {
        super(message, cause);
    }

}
