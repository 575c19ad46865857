package com.goormthonuniv.crosscheck.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NormalizedVerdict {
    SUPPORTED, CONTRADICTED, CONTESTED, UNKNOWN;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
