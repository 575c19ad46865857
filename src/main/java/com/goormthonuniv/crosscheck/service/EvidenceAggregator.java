package com.goormthonuniv.crosscheck.service;

import com.goormthonuniv.crosscheck.dto.Corroboration;
import com.goormthonuniv.crosscheck.dto.CorroborationItem;
import com.goormthonuniv.crosscheck.dto.Credentials;
import com.goormthonuniv.crosscheck.dto.NewsArticle;
import com.goormthonuniv.crosscheck.search.*;
import com.goormthonuniv.crosscheck.verify.ProviderFamily;
import com.goormthonuniv.crosscheck.verify.QueryPack;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * 5개 제공자 파이프라인을 동시에 돌리고 전부 끝날 때까지 기다린다.
 *
 * - 파이프라인마다 계열별 변형 쿼리를 순서대로 시도, 처음으로 1건 이상 나온 결과를 채택
 * - 모든 변형이 0건이면 빈 목록(정상)
 * - 예외는 해당 파이프라인 이름으로 에러 맵에 기록. 다른 파이프라인은 영향 없음
 * - 뉴스 아카이브 실패는 항상 빈 결과로 삼킨다(에러 맵에 남기지 않음)
 */
@Slf4j
@Service
public class EvidenceAggregator {

    static final String FACT_CHECKS = "factChecks";
    static final String WIKIPEDIA = "wikipedia";
    static final String WIKIDATA = "wikidata";
    static final String PUBMED = "pubmed";

    private final FactCheckRegistryAdapter factChecks;
    private final WikipediaAdapter wikipedia;
    private final WikidataAdapter wikidata;
    private final PubMedAdapter pubmed;
    private final GdeltAdapter gdelt;
    private final Executor executor;
    private final Executor newsArchiveExecutor;

    public EvidenceAggregator(FactCheckRegistryAdapter factChecks,
                              WikipediaAdapter wikipedia,
                              WikidataAdapter wikidata,
                              PubMedAdapter pubmed,
                              GdeltAdapter gdelt,
                              @Qualifier("evidenceExecutor") Executor executor,
                              @Qualifier("newsArchiveExecutor") Executor newsArchiveExecutor) {
        this.factChecks = factChecks;
        this.wikipedia = wikipedia;
        this.wikidata = wikidata;
        this.pubmed = pubmed;
        this.gdelt = gdelt;
        this.executor = executor;
        this.newsArchiveExecutor = newsArchiveExecutor;
    }

    /** 한 갈래의 최종 상태: 값 또는 오류 */
    private record Outcome<T>(T value, Throwable error) {}

    public AggregatedEvidence aggregate(QueryPack pack, Credentials credentials) {
        Credentials creds = credentials == null ? Credentials.none() : credentials;
        SearchHints hints = pack.hints();

        CompletableFuture<Outcome<FactCheckResult>> fc =
                branch(() -> runFactChecks(pack.variantsFor(ProviderFamily.FACT_CHECK), creds.factCheckKey()), executor);
        CompletableFuture<Outcome<List<CorroborationItem>>> wiki =
                branch(() -> firstNonEmpty(wikipedia, pack.variantsFor(ProviderFamily.ENCYCLOPEDIC), hints), executor);
        CompletableFuture<Outcome<List<CorroborationItem>>> wd =
                branch(() -> firstNonEmpty(wikidata, pack.variantsFor(ProviderFamily.STRUCTURED_ENTITY), hints), executor);
        CompletableFuture<Outcome<List<CorroborationItem>>> pm =
                branch(() -> firstNonEmpty(pubmed, pack.variantsFor(ProviderFamily.BIOMEDICAL), hints), executor);
        // 간격 대기 중인 뉴스 아카이브 갈래가 공용 풀을 붙잡지 않도록 전용 풀에서 돈다
        CompletableFuture<Outcome<List<NewsArticle>>> news =
                branch(() -> firstNonEmpty(gdelt, pack.variantsFor(ProviderFamily.NEWS_ARCHIVE), hints), newsArchiveExecutor);

        // handle() 로 감쌌으므로 join 은 실패하지 않는다
        CompletableFuture.allOf(fc, wiki, wd, pm, news).join();

        Map<String, String> errors = new LinkedHashMap<>();
        FactCheckResult factCheckResult = settle(fc.join(), FACT_CHECKS, errors,
                new FactCheckResult(creds.hasFactCheckKey(), List.of()));
        List<CorroborationItem> wikiItems = settle(wiki.join(), WIKIPEDIA, errors, List.of());
        List<CorroborationItem> wdItems = settle(wd.join(), WIKIDATA, errors, List.of());
        List<CorroborationItem> pmItems = settle(pm.join(), PUBMED, errors, List.of());

        Outcome<List<NewsArticle>> newsOutcome = news.join();
        List<NewsArticle> articles = newsOutcome.value() == null ? List.of() : newsOutcome.value();
        if (newsOutcome.error() != null) {
            log.debug("gdelt pipeline swallowed: {}", message(newsOutcome.error()));
        }

        log.info("evidence query=\"{}\" factChecks={}{} wikipedia={} wikidata={} pubmed={} gdelt={} errors={}",
                pack.primary(),
                factCheckResult.matches().size(), factCheckResult.configured() ? "" : "(not configured)",
                wikiItems.size(), wdItems.size(), pmItems.size(), articles.size(),
                errors.keySet());

        return new AggregatedEvidence(
                factCheckResult,
                new Corroboration(wikiItems, wdItems, pmItems),
                articles,
                errors);
    }

    // ----------------------------- pipelines -----------------------------

    /** 키가 없으면 첫 시도에서 바로 configured=false 로 끝난다. 키가 있으면 시도할 변형이 없어도 configured=true */
    FactCheckResult runFactChecks(List<String> variants, String apiKey) {
        boolean configured = apiKey != null && !apiKey.isBlank();
        for (String query : variants) {
            if (query == null || query.isBlank()) continue;
            FactCheckResult result = factChecks.search(query, apiKey);
            if (!result.configured()) {
                return FactCheckResult.notConfigured();
            }
            configured = true;
            if (!result.matches().isEmpty()) {
                return result;
            }
        }
        return new FactCheckResult(configured, List.of());
    }

    static <T> List<T> firstNonEmpty(SourceAdapter<T> adapter, List<String> variants, SearchHints hints) {
        for (String query : variants) {
            if (query == null || query.isBlank()) continue;
            List<T> items = adapter.search(query, hints);
            if (items != null && !items.isEmpty()) {
                log.debug("{} hit on variant \"{}\" ({} items)", adapter.name(), query, items.size());
                return items;
            }
        }
        return List.of();
    }

    // ----------------------------- helpers -----------------------------

    private static <T> CompletableFuture<Outcome<T>> branch(Supplier<T> work, Executor executor) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(work, executor);
        } catch (RejectedExecutionException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.handle((value, error) -> new Outcome<>(value, unwrap(error)));
    }

    private static <T> T settle(Outcome<T> outcome, String key, Map<String, String> errors, T fallback) {
        if (outcome.error() != null) {
            String msg = message(outcome.error());
            errors.put(key, msg);
            log.warn("{} pipeline failed: {}", key, msg);
            return fallback;
        }
        return outcome.value() == null ? fallback : outcome.value();
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    static String message(Throwable e) {
        String msg = e.getMessage();
        return msg == null || msg.isBlank() ? e.getClass().getSimpleName() : msg;
    }
}
