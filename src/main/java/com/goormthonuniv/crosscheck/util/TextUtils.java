package com.goormthonuniv.crosscheck.util;

import org.apache.commons.text.StringEscapeUtils;

import java.util.*;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern QUOTES = Pattern.compile("[“”\"'`‘’]+");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final Pattern TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s-]");

    /** 검색 키워드 추출용(제공자 공통) */
    private static final Set<String> KEYWORD_STOPWORDS = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "being", "have", "has", "had",
            "do", "does", "did", "will", "would", "could", "should", "to", "of", "in", "for", "on",
            "with", "at", "by", "from", "as", "that", "this", "these", "those", "and", "or", "if",
            "but", "about", "according", "claims", "claim", "reported", "reports"
    );

    private TextUtils() {}

    /** 따옴표 제거 + 공백 정리 */
    public static String clean(String text) {
        if (text == null) return "";
        String t = QUOTES.matcher(text).replaceAll("");
        return SPACES.matcher(t).replaceAll(" ").trim();
    }

    public static String collapse(String text) {
        if (text == null) return "";
        return SPACES.matcher(text).replaceAll(" ").trim();
    }

    public static String stripHtml(String text) {
        if (text == null) return "";
        String t = TAGS.matcher(text).replaceAll("");
        return collapse(StringEscapeUtils.unescapeHtml4(t));
    }

    public static List<String> words(String text) {
        String t = collapse(text);
        if (t.isEmpty()) return List.of();
        return Arrays.asList(t.split(" "));
    }

    public static String firstWords(String text, int max) {
        List<String> w = words(text);
        if (w.size() <= max) return String.join(" ", w);
        return String.join(" ", w.subList(0, max));
    }

    /** 문자 수 기준 자르기(단어 경계 유지) */
    public static String truncateAtWord(String text, int maxChars) {
        String t = collapse(text);
        if (t.length() <= maxChars) return t;
        int cut = t.lastIndexOf(' ', maxChars);
        return (cut > 0 ? t.substring(0, cut) : t.substring(0, maxChars)).trim();
    }

    public static String ellipsize(String text, int max) {
        String t = collapse(text);
        if (t.length() <= max) return t;
        return t.substring(0, max - 3).trim() + "...";
    }

    /**
     * 자유 텍스트를 키워드 나열로 바꾼다. 3자 이상, 불용어 제외, 최대 10개.
     * 남는 게 없으면 원문 앞 6단어.
     */
    public static String searchKeywords(String value) {
        String cleaned = clean(value);
        List<String> out = new ArrayList<>();
        for (String w : NON_WORD.matcher(cleaned).replaceAll(" ").split("\\s+")) {
            if (w.length() > 2 && !KEYWORD_STOPWORDS.contains(w.toLowerCase(Locale.ROOT))) {
                out.add(w);
            }
        }
        if (out.isEmpty()) {
            return firstWords(cleaned, 6);
        }
        return String.join(" ", out.subList(0, Math.min(out.size(), 10)));
    }

    /** 소문자 + 영숫자 토큰(minLen 이상) */
    public static List<String> lowerTokens(String text, int minLen) {
        if (text == null || text.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String t : text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\s-]", " ").split("\\s+")) {
            String token = t.trim();
            if (token.length() >= minLen) out.add(token);
        }
        return out;
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public static String nn(String s) {
        return s == null ? "" : s;
    }

    /** 빈 문자열이면 null */
    public static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
