package com.goormthonuniv.crosscheck.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record Finding(
        String id,
        @NotBlank String quote,          // 원문 그대로의 인용 구간
        String correction,               // misinformation 일 때만
        String rationale,
        @NotEmpty List<IssueType> issueTypes,
        double confidence,               // 0.0~1.0
        double severity                  // 0.0~1.0
) {
    public Finding {
        issueTypes = issueTypes == null ? List.of() : List.copyOf(issueTypes);
    }

    public boolean isMisinformation() {
        return issueTypes.contains(IssueType.MISINFORMATION);
    }
}
