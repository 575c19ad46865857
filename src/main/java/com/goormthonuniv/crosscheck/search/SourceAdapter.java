package com.goormthonuniv.crosscheck.search;

import java.util.List;

public interface SourceAdapter<T> {
    String name(); // "wikipedia", "wikidata", "pubmed", "gdelt" (에러 맵 키)

    /**
     * 결과가 없으면 빈 목록. 조회가 깨졌을 때만 {@link ProviderException}.
     */
    List<T> search(String query, SearchHints hints);
}
