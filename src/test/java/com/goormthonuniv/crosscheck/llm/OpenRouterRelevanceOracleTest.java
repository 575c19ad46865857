package com.goormthonuniv.crosscheck.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.crosscheck.config.CrossCheckProperties;
import com.goormthonuniv.crosscheck.search.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenRouterRelevanceOracleTest {

    private static final String ENDPOINT = "https://openrouter.ai/api/v1/chat/completions";

    private final ObjectMapper om = new ObjectMapper();
    private MockRestServiceServer server;
    private OpenRouterRelevanceOracle oracle;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        oracle = new OpenRouterRelevanceOracle(builder.build(), om, new CrossCheckProperties());
    }

    private String completion(String content) throws Exception {
        return om.writeValueAsString(om.createObjectNode().set("choices", om.createArrayNode()
                .add(om.createObjectNode().set("message", om.createObjectNode().put("content", content)))));
    }

    @Test
    @DisplayName("펜스로 감싼 답도 JSON 으로 복구한다")
    void recoversFencedAnswer() throws Exception {
        // given
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret"))
                .andExpect(content().string(containsString("\"temperature\":0.1")))
                .andExpect(content().string(not(containsString("json_object"))))
                .andRespond(withSuccess(completion("```json\n{\"items\":[{\"id\":\"wikipedia:0\",\"relevance\":0.8}]}\n```"),
                        MediaType.APPLICATION_JSON));

        // when
        JsonNode node = oracle.completeJson("prompt", "secret");

        // then
        assertThat(node.path("items").get(0).path("id").asText()).isEqualTo("wikipedia:0");
        server.verify();
    }

    @Test
    @DisplayName("JSON 이 아니면 strict 모드로 한 번 더 묻는다")
    void strictRetryOnUnparsableAnswer() throws Exception {
        // given
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess(completion("I think candidate one is relevant."), MediaType.APPLICATION_JSON));
        server.expect(requestTo(ENDPOINT))
                .andExpect(content().string(containsString("json_object")))
                .andExpect(content().string(containsString("IMPORTANT: Return valid JSON only.")))
                .andRespond(withSuccess(completion("{\"items\":[]}"), MediaType.APPLICATION_JSON));

        // when
        JsonNode node = oracle.completeJson("prompt", "secret");

        // then
        assertThat(node.path("items").isArray()).isTrue();
        server.verify();
    }

    @Test
    @DisplayName("content 가 조각 배열이어도 이어 붙여 읽는다")
    void contentParts() throws Exception {
        // given
        String body = om.writeValueAsString(om.createObjectNode().set("choices", om.createArrayNode()
                .add(om.createObjectNode().set("message", om.createObjectNode().set("content", om.createArrayNode()
                        .add(om.createObjectNode().put("type", "text").put("text", "{\"items\":"))
                        .add(om.createObjectNode().put("type", "text").put("text", "[]}")))))));
        server.expect(requestTo(ENDPOINT)).andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        // when
        JsonNode node = oracle.completeJson("prompt", "secret");

        // then
        assertThat(node.has("items")).isTrue();
    }

    @Test
    @DisplayName("HTTP 오류는 상태 코드를 담은 ProviderException")
    void httpFailure() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("{\"error\":\"bad key\"}").contentType(MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> oracle.completeJson("prompt", "secret"))
                .hasMessageStartingWith("OpenRouter API failed (401)")
                .isInstanceOfSatisfying(ProviderException.class, e -> assertThat(e.getStatus()).isEqualTo(401));
    }

    @Test
    @DisplayName("키가 없으면 요청하지 않는다")
    void missingKey() {
        assertThatThrownBy(() -> oracle.completeJson("prompt", " "))
                .isInstanceOf(ProviderException.class);
        server.verify();
    }
}
