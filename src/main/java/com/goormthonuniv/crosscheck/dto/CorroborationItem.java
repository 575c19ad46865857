package com.goormthonuniv.crosscheck.dto;

public record CorroborationItem(
        String title,
        String snippet,
        String url,
        CorroborationSource source
) {}
