package com.goormthonuniv.crosscheck.llm;

/**
 * @param id        "kind:index" (예: wikipedia:2)
 * @param relevance 0.0~1.0 으로 잘린 값
 */
public record ScoredCandidate(String id, double relevance, boolean useful, Stance stance) {

    public ScoredCandidate {
        relevance = Double.isFinite(relevance) ? Math.max(0, Math.min(1, relevance)) : 0;
        stance = stance == null ? Stance.UNKNOWN : stance;
    }

    boolean broadlyRelevant() {
        return useful && relevance >= RerankPolicy.BROAD_RELEVANCE;
    }
}
