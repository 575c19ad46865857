package com.goormthonuniv.crosscheck.dto;

import java.util.List;

public record PageContext(
        String summary,
        List<String> topicKeywords,
        List<String> entityKeywords
) {
    public PageContext {
        topicKeywords = topicKeywords == null ? List.of() : List.copyOf(topicKeywords);
        entityKeywords = entityKeywords == null ? List.of() : List.copyOf(entityKeywords);
    }

    public static PageContext empty() {
        return new PageContext(null, List.of(), List.of());
    }
}
