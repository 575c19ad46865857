package com.goormthonuniv.crosscheck.llm;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 외부 LLM 을 JSON 응답 오라클로 쓴다.
 */
public interface RelevanceOracle {
    /**
     * 프롬프트에 대한 JSON 문서(객체 또는 배열)를 돌려준다.
     * 호출 실패나 복구 불가능한 응답이면 {@link com.goormthonuniv.crosscheck.search.ProviderException}.
     */
    JsonNode completeJson(String prompt, String apiKey);
}
