package com.conveyal.ithim.model;

import com.conveyal.ithim.InputFormatException;

/** Active travel modes whose time is converted to physical activity exposure. */
public enum TravelMode {
    WALKING("walk"),
    CYCLING("cycle");

    /** Short name used in the mode column of active transport tables. */
    public final String code;

    TravelMode (String code) {
        this.code = code;
    }

    /** Accepts either the short code or the full name, ignoring case. */
    public static TravelMode fromName (String name) {
        String trimmed = name == null ? null : name.trim();
        for (TravelMode mode : values()) {
            if (mode.code.equalsIgnoreCase(trimmed) || mode.name().equalsIgnoreCase(trimmed)) {
                return mode;
            }
        }
        throw new InputFormatException("Travel mode must be walk or cycle, found: " + name);
    }
}
