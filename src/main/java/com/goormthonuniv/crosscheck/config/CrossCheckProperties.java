package com.goormthonuniv.crosscheck.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * crosscheck.* 설정 바인딩.
 *
 * 기본값은 운영에서 관찰된 정책값이며, 점수 가중치 테이블은 배포 코퍼스에 맞게 yml 로 재보정한다.
 */
@Configuration
@ConfigurationProperties(prefix = "crosscheck")
@Data
public class CrossCheckProperties {

    private Credentials credentials = new Credentials();
    private Endpoints endpoints = new Endpoints();
    private Timeouts timeouts = new Timeouts();
    private NewsArchive newsArchive = new NewsArchive();
    private Scoring scoring = new Scoring();
    private Rerank rerank = new Rerank();
    private Executor executor = new Executor();
    private Cache cache = new Cache();

    /** 호출자(web 계층)가 읽어 verify(...)에 넘기는 선택 자격증명. 엔진은 직접 읽지 않는다. */
    @Data
    public static class Credentials {
        private String factCheckKey = "";
        private String llmKey = "";
    }

    @Data
    public static class Endpoints {
        private String factCheck = "https://factchecktools.googleapis.com/v1alpha1/claims:search";
        private String wikipedia = "https://en.wikipedia.org/w/api.php";
        private String wikidata = "https://www.wikidata.org/w/api.php";
        private String pubmedSearch = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils/esearch.fcgi";
        private String pubmedSummary = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils/esummary.fcgi";
        private String gdelt = "https://api.gdeltproject.org/api/v2/doc/doc";
        private String llm = "https://openrouter.ai/api/v1/chat/completions";
    }

    @Data
    public static class Timeouts {
        private Duration connect = Duration.ofSeconds(5);
        private Duration provider = Duration.ofSeconds(18);
        private Duration newsArchive = Duration.ofSeconds(20);
        private Duration llm = Duration.ofSeconds(55);
    }

    @Data
    public static class NewsArchive {
        /** 프로세스 전역 최소 요청 간격 */
        private Duration minInterval = Duration.ofMillis(5_200);
        private int maxRecords = 30;
        private String timespan = "3m";
        private List<String> trustedDomains = new ArrayList<>(List.of(
                "snopes.com", "politifact.com", "factcheck.org", "reuters.com",
                "apnews.com", "bbc.com", "fullfact.org", "leadstories.com",
                "washingtonpost.com", "nytimes.com", "npr.org", "pbs.org",
                "who.int", "cdc.gov", "nature.com", "sciencemag.org"
        ));
    }

    @Data
    public static class Scoring {
        private Encyclopedic encyclopedic = new Encyclopedic();
        private Biomedical biomedical = new Biomedical();
    }

    @Data
    public static class Encyclopedic {
        private List<String> topicAnchors = new ArrayList<>(List.of(
                "border", "immigration", "election", "covid", "vaccine", "climate", "economy",
                "inflation", "crime", "healthcare", "tax", "war", "ukraine", "gaza", "china"
        ));
        private int titleWeight = 3;
        private int combinedWeight = 2;
        private int hintBonus = 1;
        private int administrationPenalty = 3;
        private int entityOnlyPenalty = 4;
        /** 쿼리 term 수가 richQueryTerms 이상이면 richFloor, 아니면 baseFloor */
        private int baseFloor = 3;
        private int richFloor = 6;
        private int richQueryTerms = 5;
        private int maxRawResults = 12;
        private int maxResults = 5;
    }

    @Data
    public static class Biomedical {
        private List<String> strongQualityTerms = new ArrayList<>(List.of(
                "systematic review", "meta-analysis", "umbrella review"));
        private List<String> qualityTerms = new ArrayList<>(List.of(
                "cohort", "case-control", "randomized", "population-based", "nationwide",
                "consensus", "longitudinal"));
        private List<String> lowSignalTerms = new ArrayList<>(List.of(
                "editorial", "comment", "letter", "case report", "protocol"));
        private int strongQualityBonus = 8;
        private int qualityBonus = 4;
        private int lowSignalPenalty = 5;
        private int retractedScore = -100;
        private double echoOverlap = 0.8;
        private int echoPenalty = 7;
        private int minKeptScore = -1;
        private int fetchLimit = 20;
        private int maxResults = 5;
    }

    @Data
    public static class Rerank {
        private String model = "arcee-ai/trinity-large-preview:free";
        private int maxTokens = 1800;
        private String title = "CrossCheck Evidence Reranker";
    }

    @Data
    public static class Executor {
        private int corePoolSize = 10;
        private int maxPoolSize = 40;
        private int queueCapacity = 200;
        private int newsArchivePoolSize = 2;
        private int newsArchiveQueueCapacity = 100;
    }

    @Data
    public static class Cache {
        private Duration staleAfter = Duration.ofMinutes(10);
        private long maximumSize = 2_000;
    }
}
