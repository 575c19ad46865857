package com.goormthonuniv.crosscheck.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IssueType {
    MISINFORMATION, FALLACY, BIAS;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IssueType fromWire(String value) {
        return value == null ? null : IssueType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
