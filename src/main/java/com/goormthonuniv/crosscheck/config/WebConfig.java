package com.goormthonuniv.crosscheck.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Duration;

@Configuration
public class WebConfig {

    /** 사실확인/위키/PubMed 공용 */
    @Bean
    public RestClient providerRestClient(RestClient.Builder builder, CrossCheckProperties props) {
        return withTimeouts(builder, props.getTimeouts().getConnect(), props.getTimeouts().getProvider());
    }

    @Bean
    public RestClient newsArchiveRestClient(RestClient.Builder builder, CrossCheckProperties props) {
        return withTimeouts(builder, props.getTimeouts().getConnect(), props.getTimeouts().getNewsArchive());
    }

    @Bean
    public RestClient llmRestClient(RestClient.Builder builder, CrossCheckProperties props) {
        return withTimeouts(builder, props.getTimeouts().getConnect(), props.getTimeouts().getLlm());
    }

    private static RestClient withTimeouts(RestClient.Builder builder, Duration connect, Duration read) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connect);
        factory.setReadTimeout(read);
        return builder.clone().requestFactory(factory).build();
    }

    @Bean
    public WebMvcConfigurer corsConfigurer() {
        return new WebMvcConfigurer() {
            @Override public void addCorsMappings(CorsRegistry registry) {
                // 브라우저 확장 프로그램에서 호출
                registry.addMapping("/api/**")
                        .allowedOriginPatterns("chrome-extension://*", "moz-extension://*", "http://localhost:*")
                        .allowedMethods("GET", "POST", "DELETE", "OPTIONS");
            }
        };
    }
}
