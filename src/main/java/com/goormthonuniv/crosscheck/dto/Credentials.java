package com.goormthonuniv.crosscheck.dto;

/**
 * verify 호출 단위 자격증명. 공백 문자열은 미설정과 같다.
 */
public record Credentials(String factCheckKey, String llmKey) {

    public static Credentials none() {
        return new Credentials(null, null);
    }

    public boolean hasFactCheckKey() {
        return factCheckKey != null && !factCheckKey.isBlank();
    }

    public boolean hasLlmKey() {
        return llmKey != null && !llmKey.isBlank();
    }
}
