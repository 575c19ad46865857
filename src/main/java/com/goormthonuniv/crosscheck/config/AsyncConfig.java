package com.goormthonuniv.crosscheck.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final CrossCheckProperties props;

    /**
     * 제공자 5갈래 동시 조회 실행자.
     * 포화 시 호출 스레드가 직접 실행한다.
     */
    @Bean(name = "evidenceExecutor")
    public Executor evidenceExecutor() {
        CrossCheckProperties.Executor cfg = props.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getCorePoolSize());
        executor.setMaxPoolSize(cfg.getMaxPoolSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("evidence-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * 뉴스 아카이브 전용 실행자.
     * 요청 간격 대기가 길어 공용 풀과 분리한다.
     */
    @Bean(name = "newsArchiveExecutor")
    public Executor newsArchiveExecutor() {
        CrossCheckProperties.Executor cfg = props.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getNewsArchivePoolSize());
        executor.setMaxPoolSize(cfg.getNewsArchivePoolSize());
        executor.setQueueCapacity(cfg.getNewsArchiveQueueCapacity());
        executor.setThreadNamePrefix("news-archive-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
