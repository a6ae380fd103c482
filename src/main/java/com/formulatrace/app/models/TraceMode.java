package com.formulatrace.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Trace direction: PRECEDENTS walks upstream (inputs),
 * DEPENDENTS walks downstream (consumers).
 */
public enum TraceMode {
    PRECEDENTS,
    DEPENDENTS;

    /**
     * Case-insensitive and lenient: anything other than "dependents",
     * including null, means PRECEDENTS.
     */
    @JsonCreator
    public static TraceMode fromValue(String value) {
        if (value != null && "dependents".equals(value.trim().toLowerCase(Locale.ROOT))) {
            return DEPENDENTS;
        }
        return PRECEDENTS;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String heading() {
        return this == DEPENDENTS ? "Dependents" : "Precedents";
    }
}
