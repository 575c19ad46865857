package com.goormthonuniv.crosscheck.llm;

import java.util.*;

/**
 * 점수 목록 → 남길 id 집합. I/O 없는 순수 정책.
 *
 * - 일반(오류/편향) finding: useful 이고 relevance ≥ 0.55 인 것 상위 8
 * - misinformation finding: 같은 집합 중 supportive 가 아닌 것 상위 8
 *   → 없으면 relevance ≥ 0.7 상위 5 → 그래도 없으면 상위 4
 * - 넓게 관련된 게 하나도 없으면 relevance ≥ 0.45 상위 4, 그것도 없으면 상위 3
 */
public final class RerankPolicy {

    static final double BROAD_RELEVANCE = 0.55;
    static final double STRONG_RELEVANCE = 0.7;
    static final double BEST_EFFORT_RELEVANCE = 0.45;

    static final int MAX_KEPT = 8;
    static final int MAX_STRONG_SUPPORTIVE = 5;
    static final int MAX_BROAD_FALLBACK = 4;
    static final int MAX_BEST_EFFORT = 4;
    static final int MAX_LAST_RESORT = 3;

    private RerankPolicy() {}

    public static Set<String> keepSet(List<ScoredCandidate> scored, boolean misinformation) {
        List<ScoredCandidate> sorted = new ArrayList<>(scored);
        sorted.sort(Comparator.comparingDouble(ScoredCandidate::relevance).reversed());

        List<ScoredCandidate> broad = sorted.stream().filter(ScoredCandidate::broadlyRelevant).toList();

        if (!broad.isEmpty()) {
            if (!misinformation) {
                return ids(broad, MAX_KEPT);
            }
            List<ScoredCandidate> nonSupportive = broad.stream()
                    .filter(c -> c.stance() != Stance.SUPPORTIVE)
                    .toList();
            if (!nonSupportive.isEmpty()) {
                return ids(nonSupportive, MAX_KEPT);
            }
            List<ScoredCandidate> strong = broad.stream()
                    .filter(c -> c.relevance() >= STRONG_RELEVANCE)
                    .toList();
            if (!strong.isEmpty()) {
                return ids(strong, MAX_STRONG_SUPPORTIVE);
            }
            return ids(broad, MAX_BROAD_FALLBACK);
        }

        // 신호가 약해도 전부 버리지는 않는다
        List<ScoredCandidate> bestEffort = sorted.stream()
                .filter(c -> c.relevance() >= BEST_EFFORT_RELEVANCE)
                .toList();
        if (!bestEffort.isEmpty()) {
            return ids(bestEffort, MAX_BEST_EFFORT);
        }
        return ids(sorted, MAX_LAST_RESORT);
    }

    private static Set<String> ids(List<ScoredCandidate> rows, int limit) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        rows.stream().limit(limit).forEach(r -> out.add(r.id()));
        return out;
    }
}
