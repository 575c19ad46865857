package com.goormthonuniv.crosscheck.search;

import com.goormthonuniv.crosscheck.dto.FactCheckMatch;

import java.util.List;

public record FactCheckResult(boolean configured, List<FactCheckMatch> matches) {

    public FactCheckResult {
        matches = matches == null ? List.of() : List.copyOf(matches);
    }

    public static FactCheckResult notConfigured() {
        return new FactCheckResult(false, List.of());
    }
}
