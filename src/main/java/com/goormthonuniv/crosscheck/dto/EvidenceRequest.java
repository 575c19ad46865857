package com.goormthonuniv.crosscheck.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record EvidenceRequest(
        long tabId,
        @NotNull @Valid Finding finding,
        PageContext pageContext,       // 선택
        boolean forceRefresh           // true 면 캐시 무시
) {}
