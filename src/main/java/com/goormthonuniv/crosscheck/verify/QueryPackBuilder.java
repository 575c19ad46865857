package com.goormthonuniv.crosscheck.verify;

import com.goormthonuniv.crosscheck.dto.Finding;
import com.goormthonuniv.crosscheck.dto.PageContext;
import com.goormthonuniv.crosscheck.util.TextUtils;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Finding 하나로부터 제공자 계열별 검색 쿼리 변형들을 만든다.
 *
 * 설계 포인트
 * - 인용문/정정문에서 엔티티(대문자 연속)와 토픽 term 을 뽑고, 페이지 문맥 키워드를 합친다
 * - 보도 동사/출처 서두와 양보절을 걷어낸 핵심 주장(core claim)을 22단어 이내로 만든다
 * - compact claim = 엔티티 상위 2 + 토픽 상위 6 (비면 core claim)
 * - 계열별 변형은 구체적인 것부터, 중복 제거, 최대 7개, 120자 제한
 * - 어떤 경우에도 계열별 목록은 비지 않는다(최후엔 [core claim])
 *
 * 실패하지 않는다. 출력은 원문 문자열이며 URL 인코딩은 어댑터가 한다.
 */
@Component
public class QueryPackBuilder {

    private static final int MAX_QUERY_LEN = 120;
    private static final int MAX_VARIANTS = 7;
    private static final int CORRECTION_WORDS = 18;
    private static final int QUOTE_SNIPPET_WORDS = 12;
    private static final int SUMMARY_WORDS = 10;
    private static final int MAX_TOPICS = 10;
    private static final int MAX_ENTITIES = 6;

    public QueryPack build(Finding finding, PageContext pageContext) {
        PageContext ctx = pageContext == null ? PageContext.empty() : pageContext;
        String quote = TextUtils.clean(finding.quote());
        String correction = TextUtils.firstWords(TextUtils.clean(finding.correction()), CORRECTION_WORDS);

        // 1) 엔티티: 인용문+정정문 추출분 우선, 페이지 문맥 엔티티로 보강
        String claimText = correction.isEmpty() ? quote : quote + ". " + correction;
        LinkedHashSet<String> entitySet = new LinkedHashSet<>(ClaimText.extractEntities(claimText));
        for (String e : ctx.entityKeywords()) {
            String v = TextUtils.clean(e);
            if (!v.isEmpty() && entitySet.stream().noneMatch(x -> x.equalsIgnoreCase(v))) entitySet.add(v);
        }
        List<String> entities = entitySet.stream().limit(MAX_ENTITIES).toList();

        // 2) 토픽 term: 엔티티 구성 단어 제외, 문맥 토픽 보강
        LinkedHashSet<String> topicSet = new LinkedHashSet<>(ClaimText.topicTerms(claimText, entities));
        for (String t : ctx.topicKeywords()) {
            String v = TextUtils.clean(t).toLowerCase(Locale.ROOT);
            if (!v.isEmpty()) topicSet.add(v);
        }
        List<String> topics = topicSet.stream().limit(MAX_TOPICS).toList();

        // 3) core / compact claim
        String core = ClaimText.coreClaim(quote, entities);
        if (core.isBlank()) {
            core = TextUtils.firstWords(TextUtils.collapse(finding.quote()), ClaimText.FALLBACK_WORDS);
        }
        String compact = join(take(entities, 2), take(topics, 6));
        if (compact.isBlank()) compact = core;
        compact = TextUtils.truncateAtWord(compact, MAX_QUERY_LEN);

        QueryIntent intent = finding.isMisinformation() ? QueryIntent.MISINFORMATION : QueryIntent.ARGUMENTATION;

        // 4) 계열별 변형
        String entityTopic = join(take(entities, 1), take(topics, 3));
        String topicOnly = join(List.of(), take(topics, 4));
        String contextPhrase = join(take(ctx.entityKeywords(), 1), take(ctx.topicKeywords(), 3));
        String contextTopics = join(List.of(), take(ctx.topicKeywords(), 3));
        String summarySnippet = TextUtils.isBlank(ctx.summary()) ? ""
                : TextUtils.firstWords(TextUtils.searchKeywords(ctx.summary()), SUMMARY_WORDS);
        String quoteSnippet = TextUtils.firstWords(quote, QUOTE_SNIPPET_WORDS);

        Map<ProviderFamily, List<String>> variants = new EnumMap<>(ProviderFamily.class);
        // 의도 구절은 구체적인 변형이 다 빈손일 때 시도한다. 엔티티 조회는 이름만 받으므로 제외
        String intentPhrased = compact + " " + intent.phrase();
        variants.put(ProviderFamily.FACT_CHECK, finalize(core,
                core, compact, quoteSnippet, entityTopic, contextPhrase, intentPhrased));
        variants.put(ProviderFamily.ENCYCLOPEDIC, finalize(core,
                compact, entityTopic, topicOnly, contextPhrase, core, intentPhrased));
        variants.put(ProviderFamily.STRUCTURED_ENTITY, finalize(core,
                entities.size() > 0 ? entities.get(0) : "",
                entities.size() > 1 ? entities.get(1) : "",
                entities.size() > 2 ? entities.get(2) : "",
                first(ctx.entityKeywords()),
                compact));
        variants.put(ProviderFamily.BIOMEDICAL, finalize(core,
                topicOnly, compact, contextTopics, core, intentPhrased));
        variants.put(ProviderFamily.NEWS_ARCHIVE, finalize(core,
                compact, entityTopic, intentPhrased, summarySnippet, core));

        return new QueryPack(compact, core, variants, topics, entities, intent);
    }

    // ----------------------------- helpers -----------------------------

    private static List<String> finalize(String core, String... candidates) {
        LinkedHashMap<String, String> seen = new LinkedHashMap<>();
        for (String c : candidates) {
            String q = TextUtils.truncateAtWord(TextUtils.collapse(c), MAX_QUERY_LEN);
            if (q.isEmpty() || q.chars().noneMatch(Character::isLetterOrDigit)) continue;
            seen.putIfAbsent(q.toLowerCase(Locale.ROOT), q);
            if (seen.size() >= MAX_VARIANTS) break;
        }
        if (seen.isEmpty()) {
            return List.of(core);
        }
        return new ArrayList<>(seen.values());
    }

    private static List<String> take(List<String> list, int n) {
        return list.stream().filter(s -> !TextUtils.isBlank(s)).limit(n).collect(Collectors.toList());
    }

    private static String join(List<String> head, List<String> tail) {
        List<String> all = new ArrayList<>(head);
        all.addAll(tail);
        return TextUtils.collapse(String.join(" ", all));
    }

    private static String first(List<String> list) {
        return list.isEmpty() ? "" : TextUtils.clean(list.get(0));
    }
}
