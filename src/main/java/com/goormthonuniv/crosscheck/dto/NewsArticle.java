package com.goormthonuniv.crosscheck.dto;

public record NewsArticle(
        String title,
        String url,
        String domain,
        Double tone,          // 음수일수록 비판적 보도. 정렬에만 쓰고 판정에는 쓰지 않는다
        String seenDate,
        String language
) {}
