package com.conveyal.ithim.model;

import com.conveyal.ithim.InputFormatException;

/** The two sexes by which every exposure, risk and burden table is stratified. Males come first in every table. */
public enum Sex {
    M, F;

    /** Parse the single-letter code used in input tables. */
    public static Sex fromCode (String code) {
        if (code != null) {
            String trimmed = code.trim();
            if ("M".equalsIgnoreCase(trimmed)) return M;
            if ("F".equalsIgnoreCase(trimmed)) return F;
        }
        throw new InputFormatException("Sex must be M or F, found: " + code);
    }
}
