package com.goormthonuniv.crosscheck.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM 응답 텍스트에서 JSON 문서를 건져낸다.
 * ```json 펜스와 앞뒤 설명문을 걷어내고 스마트 따옴표와 꼬리 쉼표를 고친다.
 */
final class JsonRecovery {

    private static final Pattern FENCED = Pattern.compile("```json\\s*([\\s\\S]*?)\\s*```", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");

    private JsonRecovery() {}

    /** 펜스 블록 → 균형 잡힌 첫 문서 → 원문 순으로 후보를 고른다 */
    static String extractJsonBlock(String input) {
        if (input == null) return "";
        Matcher m = FENCED.matcher(input);
        if (m.find() && !m.group(1).isBlank()) {
            String fenced = m.group(1).trim();
            String balanced = extractBalanced(fenced);
            return balanced != null ? balanced : fenced;
        }
        String balanced = extractBalanced(input);
        return balanced != null ? balanced : input.trim();
    }

    static Optional<JsonNode> parse(ObjectMapper om, String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        List<String> candidates = new ArrayList<>();
        candidates.add(text.trim());
        String normalized = normalize(text);
        if (!candidates.contains(normalized)) candidates.add(normalized);
        String balanced = extractBalanced(normalized);
        if (balanced != null && !candidates.contains(balanced)) candidates.add(balanced);

        for (String candidate : candidates) {
            try {
                JsonNode node = om.readTree(candidate);
                if (node != null && (node.isObject() || node.isArray())) {
                    return Optional.of(node);
                }
            } catch (JsonProcessingException e) {
                // 다음 후보
            }
        }
        return Optional.empty();
    }

    static String normalize(String input) {
        String s = input
                .replace('“', '"').replace('”', '"')
                .replace('‘', '\'').replace('’', '\'');
        return TRAILING_COMMA.matcher(s).replaceAll("$1").trim();
    }

    /** 첫 '{' 또는 '[' 부터 짝이 맞는 지점까지. 문자열 리터럴 안의 괄호는 무시 */
    static String extractBalanced(String input) {
        int start = -1;
        for (int i = 0; i < input.length(); i++) {
            char ch = input.charAt(i);
            if (ch == '{' || ch == '[') {
                start = i;
                break;
            }
        }
        if (start < 0) return null;

        Deque<Character> stack = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < input.length(); i++) {
            char ch = input.charAt(i);
            if (inString) {
                if (escaped) escaped = false;
                else if (ch == '\\') escaped = true;
                else if (ch == '"') inString = false;
                continue;
            }
            if (ch == '"') {
                inString = true;
            } else if (ch == '{' || ch == '[') {
                stack.push(ch);
            } else if (ch == '}' || ch == ']') {
                Character top = stack.peek();
                boolean match = top != null && ((top == '{' && ch == '}') || (top == '[' && ch == ']'));
                if (!match) return null;
                stack.pop();
                if (stack.isEmpty()) return input.substring(start, i + 1).trim();
            }
        }
        return null;
    }
}
