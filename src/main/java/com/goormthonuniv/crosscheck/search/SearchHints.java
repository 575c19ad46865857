package com.goormthonuniv.crosscheck.search;

import com.goormthonuniv.crosscheck.verify.QueryIntent;

import java.util.*;

/**
 * 어댑터별 관련도 필터에 쓰는 호출자 제공 신호.
 * topic/entity 는 소문자 단어 단위로 보관한다.
 */
public record SearchHints(Set<String> topicTerms, Set<String> entityTerms, QueryIntent intent) {

    public SearchHints {
        topicTerms = topicTerms == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(topicTerms));
        entityTerms = entityTerms == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(entityTerms));
        intent = intent == null ? QueryIntent.ARGUMENTATION : intent;
    }

    public static SearchHints none() {
        return new SearchHints(Set.of(), Set.of(), QueryIntent.ARGUMENTATION);
    }

    public static SearchHints of(Collection<String> topics, Collection<String> entities, QueryIntent intent) {
        return new SearchHints(wordsOf(topics), wordsOf(entities), intent);
    }

    private static Set<String> wordsOf(Collection<String> phrases) {
        Set<String> out = new LinkedHashSet<>();
        if (phrases == null) return out;
        for (String p : phrases) {
            if (p == null) continue;
            for (String w : p.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}0-9\\s-]", " ").split("\\s+")) {
                if (w.length() > 2) out.add(w);
            }
        }
        return out;
    }
}
