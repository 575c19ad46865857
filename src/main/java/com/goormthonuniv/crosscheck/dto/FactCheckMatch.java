package com.goormthonuniv.crosscheck.dto;

public record FactCheckMatch(
        String claimText,
        String claimant,          // nullable
        String publisher,
        String reviewTitle,
        String textualRating,     // nullable
        String reviewUrl,
        String reviewDate,        // nullable
        String languageCode,      // nullable
        NormalizedVerdict normalizedVerdict
) {}
