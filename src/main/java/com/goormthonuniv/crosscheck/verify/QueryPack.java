package com.goormthonuniv.crosscheck.verify;

import com.goormthonuniv.crosscheck.search.SearchHints;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 한 건의 검증 동안만 쓰이는 파생 쿼리 묶음.
 * 제공자 계열마다 구체적인 것부터 정렬된 변형 쿼리 목록을 가진다(항상 1개 이상).
 */
public record QueryPack(
        String primary,
        String coreClaim,
        Map<ProviderFamily, List<String>> variants,
        List<String> topicTerms,
        List<String> entityTerms,
        QueryIntent intent
) {
    public QueryPack {
        EnumMap<ProviderFamily, List<String>> copy = new EnumMap<>(ProviderFamily.class);
        for (ProviderFamily family : ProviderFamily.values()) {
            List<String> list = variants == null ? null : variants.get(family);
            copy.put(family, list == null || list.isEmpty() ? List.of(coreClaim) : List.copyOf(list));
        }
        variants = Collections.unmodifiableMap(copy);
        topicTerms = topicTerms == null ? List.of() : List.copyOf(topicTerms);
        entityTerms = entityTerms == null ? List.of() : List.copyOf(entityTerms);
    }

    public List<String> variantsFor(ProviderFamily family) {
        return variants.get(family);
    }

    public SearchHints hints() {
        return SearchHints.of(topicTerms, entityTerms, intent);
    }
}
