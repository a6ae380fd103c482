package com.formulatrace.app.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the edges of a trace came from: the host's own precedent/dependent
 * index, a scan of formula text, both, or neither.
 */
public enum TraceSource {
    API("api"),
    FORMULA_SCAN("formula_scan"),
    MIXED("mixed"),
    NONE("none");

    private final String wireName;

    TraceSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
