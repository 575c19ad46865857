package com.goormthonuniv.crosscheck.verify;

public enum ProviderFamily {
    FACT_CHECK,
    ENCYCLOPEDIC,
    STRUCTURED_ENTITY,
    BIOMEDICAL,
    NEWS_ARCHIVE
}
