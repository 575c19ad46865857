package com.goormthonuniv.crosscheck.verify;

import com.goormthonuniv.crosscheck.util.TextUtils;
import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 인용문에서 엔티티/토픽 term/핵심 주장을 뽑는 휴리스틱 모음.
 */
final class ClaimText {

    private static final String CAP_WORD = "[A-Z][A-Za-z0-9'’.&-]*";
    private static final Pattern ENTITY = Pattern.compile(
            "\\b" + CAP_WORD + "(?:\\s+(?:(?:of|the|and|for|de|del|la|van|von)\\s+)?" + CAP_WORD + ")*");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]\\s*$");
    private static final Pattern POSSESSIVE = Pattern.compile("['’]s$");

    // 인명/조직이 아닌 대문자 단어: 날짜, 경칭, 문장 첫머리 기능어
    private static final Set<String> ENTITY_STOP = Set.of(
            "january", "february", "march", "april", "may", "june", "july", "august", "september",
            "october", "november", "december", "jan", "feb", "mar", "apr", "jun", "jul", "aug",
            "sep", "sept", "oct", "nov", "dec",
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday",
            "mr", "mrs", "ms", "dr", "prof", "sir", "madam", "sen", "rep", "gov", "gen", "president",
            "senator", "governor", "minister", "secretary", "professor", "doctor",
            "the", "a", "an", "this", "that", "these", "those", "it", "he", "she", "they", "we", "i",
            "you", "but", "and", "or", "if", "in", "on", "at", "so", "yes", "no", "our", "their",
            "his", "her", "my", "its", "today", "yesterday", "tomorrow", "last", "next", "according",
            "when", "while", "after", "before", "because", "there", "here", "what", "why", "how",
            "every", "all", "many", "most", "some", "not", "now", "then", "also"
    );

    private static final Set<String> TOPIC_STOP = Set.of(
            "a", "an", "the", "and", "or", "but", "to", "of", "in", "for", "on", "with", "at", "by",
            "from", "is", "are", "was", "were", "be", "been", "being", "has", "have", "had", "can",
            "could", "would", "should", "will", "shall", "may", "might", "must", "do", "does", "did",
            "that", "this", "these", "those", "it", "its", "they", "them", "their", "he", "she",
            "his", "her", "we", "our", "you", "your", "i", "me", "my", "not", "no", "yes", "so",
            "than", "then", "there", "here", "what", "which", "who", "whom", "whose", "why", "how",
            "when", "where", "about", "into", "over", "under", "after", "before", "because", "while",
            "just", "only", "very", "really", "also", "even", "more", "most", "some", "any", "all",
            "every", "each", "much", "many", "said", "says", "say", "claim", "claims", "claimed",
            "stated", "states", "according", "reported", "reports", "told", "believe", "believes",
            "think", "thinks", "know", "knows", "people", "thing", "things", "way", "going", "get",
            "got", "make", "made", "like", "now", "today", "year", "years", "time", "one", "two"
    );

    private static final String REPORTING_VERBS =
            "said|says|claimed|claims|stated|states|argued|argues|told reporters|insisted|insists|"
                    + "wrote|writes|reported|reports|suggested|suggests|believes|believed|noted|notes|"
                    + "added|adds|warned|warns|announced|announces|alleged|alleges|maintained|maintains";

    private static final Pattern ATTRIBUTION_PREFIX = Pattern.compile(
            "^(?:according to|per|as reported by)\\s+[^,]{1,80},\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern TIME_PREFIX = Pattern.compile(
            "^(?:on|last|this|earlier|in|by|since|during)\\s+[\\w\\s'’-]{1,25}?,\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern REPORTING_PREAMBLE = Pattern.compile(
            "^(?:[\\w.'’-]+\\s+){1,5}?(?:" + REPORTING_VERBS + ")\\s*,?\\s*(?:that\\s+)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern REPORTING_TAIL = Pattern.compile(
            ",\\s*(?:[\\w.'’-]+\\s+){0,4}(?:" + REPORTING_VERBS + ")\\s*[.!]?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONCESSIVE_TAIL = Pattern.compile(
            "[,;]?\\s+(?:although|though|even though|even if|whereas|despite|while)\\b.*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_PRONOUN = Pattern.compile(
            "^(he|she|they|it|we)\\b", Pattern.CASE_INSENSITIVE);

    static final int CORE_CLAIM_WORDS = 22;
    static final int FALLBACK_WORDS = 12;
    private static final int MAX_ENTITIES = 5;
    private static final int MIN_CLAUSE_WORDS = 3;

    private static final LevenshteinDistance NEAR = new LevenshteinDistance(1);

    private ClaimText() {}

    /** 대문자 단어 연속을 엔티티 후보로 본다. 문장 첫머리 단어 하나짜리는 다른 곳에서도 대문자로 나올 때만 채택 */
    static List<String> extractEntities(String text) {
        if (TextUtils.isBlank(text)) return List.of();
        LinkedHashSet<String> out = new LinkedHashSet<>();
        Set<String> midSentenceCaps = new HashSet<>();
        List<String[]> candidates = new ArrayList<>();

        Matcher m = ENTITY.matcher(text);
        while (m.find()) {
            boolean sentenceStart = m.start() == 0 || SENTENCE_END.matcher(text.substring(0, m.start())).find();
            String[] words = m.group().split("\\s+");
            if (!sentenceStart) {
                for (String w : words) midSentenceCaps.add(bare(w).toLowerCase(Locale.ROOT));
            }
            candidates.add(new String[]{String.join(" ", words), sentenceStart ? "1" : "0"});
        }

        for (String[] c : candidates) {
            List<String> words = new ArrayList<>(Arrays.asList(c[0].split(" ")));
            words.replaceAll(ClaimText::bare);
            while (!words.isEmpty() && isEntityStop(words.get(0))) words.remove(0);
            while (!words.isEmpty() && isEntityStop(words.get(words.size() - 1))) words.remove(words.size() - 1);
            if (words.isEmpty()) continue;

            String entity = String.join(" ", words);
            if (entity.length() < 2) continue;
            boolean trimmedHead = !c[0].startsWith(words.get(0));
            if (words.size() == 1 && "1".equals(c[1]) && !trimmedHead
                    && !midSentenceCaps.contains(entity.toLowerCase(Locale.ROOT))
                    && !isAcronym(entity)) {
                continue;
            }
            out.add(entity);
            if (out.size() >= MAX_ENTITIES) break;
        }
        return new ArrayList<>(out);
    }

    /** 소문자 토픽 term. 빈도순(동률은 등장순), 편집거리 1 이내 변형은 하나로 병합 */
    static List<String> topicTerms(String text, Collection<String> entities) {
        if (TextUtils.isBlank(text)) return List.of();
        Set<String> entityWords = new HashSet<>();
        for (String e : entities) {
            entityWords.addAll(TextUtils.lowerTokens(e, 1));
        }

        LinkedHashMap<String, Integer> tf = new LinkedHashMap<>();
        for (String token : TextUtils.lowerTokens(text, 3)) {
            String t = trimHyphens(token);
            if (t.length() < 3 || TOPIC_STOP.contains(t) || entityWords.contains(t)) continue;
            if (t.chars().allMatch(Character::isDigit)) continue;
            tf.merge(t, 1, Integer::sum);
        }

        LinkedHashMap<String, Integer> merged = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : tf.entrySet()) {
            String k = e.getKey();
            String rep = k.length() < 5 ? k : merged.keySet().stream()
                    .filter(x -> x.length() >= 5 && NEAR.apply(x, k) >= 0)
                    .findFirst().orElse(k);
            merged.merge(rep, e.getValue(), Integer::sum);
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(merged.entrySet());
        ranked.sort((a, b) -> Integer.compare(b.getValue(), a.getValue())); // stable
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, Integer> e : ranked) out.add(e.getKey());
        return out;
    }

    /**
     * 보도 동사 서두("X said that ..."), 출처/시점 서두("according to ...,", "on Tuesday,"),
     * 양보절 꼬리를 걷어낸 핵심 주장. 앞 대명사는 첫 엔티티로 치환.
     */
    static String coreClaim(String quote, List<String> entities) {
        String s = TextUtils.collapse(quote);
        if (s.isEmpty()) return "";

        for (int i = 0; i < 3; i++) {
            String before = s;
            s = stripIfLeavesClause(s, ATTRIBUTION_PREFIX);
            s = stripIfLeavesClause(s, TIME_PREFIX);
            s = stripIfLeavesClause(s, REPORTING_PREAMBLE);
            if (s.equals(before)) break;
        }
        s = stripIfLeavesClause(s, REPORTING_TAIL);
        s = stripIfLeavesClause(s, CONCESSIVE_TAIL);
        s = s.replaceAll("[\\s.,;:!?]+$", "").trim();

        if (!entities.isEmpty()) {
            Matcher p = LEADING_PRONOUN.matcher(s);
            if (p.find()) {
                s = entities.get(0) + s.substring(p.end());
            }
        }

        s = TextUtils.firstWords(s, CORE_CLAIM_WORDS);
        if (s.isBlank()) {
            return TextUtils.firstWords(quote, FALLBACK_WORDS);
        }
        return s;
    }

    private static String stripIfLeavesClause(String s, Pattern p) {
        Matcher m = p.matcher(s);
        if (!m.find()) return s;
        String rest = (s.substring(0, m.start()) + s.substring(m.end())).trim();
        return TextUtils.words(rest).size() >= MIN_CLAUSE_WORDS ? rest : s;
    }

    private static String bare(String word) {
        String w = POSSESSIVE.matcher(word).replaceAll("");
        // 문장 끝 마침표 제거. U.S. 같은 약어는 유지
        if (w.endsWith(".") && w.indexOf('.') == w.length() - 1) {
            w = w.substring(0, w.length() - 1);
        }
        return w;
    }

    private static String trimHyphens(String token) {
        return token.replaceAll("^-+|-+$", "");
    }

    private static boolean isEntityStop(String word) {
        return ENTITY_STOP.contains(word.toLowerCase(Locale.ROOT).replace(".", ""));
    }

    private static boolean isAcronym(String word) {
        return word.length() >= 2 && word.replace(".", "").chars().allMatch(Character::isUpperCase);
    }
}
