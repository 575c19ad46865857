package com.goormthonuniv.crosscheck.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/**
 * 배포 환경별 자격증명/엔드포인트 덮어쓰기. 파일이 없으면 application.yml 기본값.
 */
@Configuration
@PropertySource(
        value = "classpath:properties/env.properties",
        ignoreResourceNotFound = true
)
public class PropertyConfig {

}
