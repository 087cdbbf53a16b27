package com.unisync.social.common.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 관계 엔진 스레드 풀 설정
 *
 * 조회 작업자와 저장소 호출을 서로 다른 풀에서 실행한다.
 * 작업자가 저장소 호출 완료를 기다리는 동안 같은 풀을 점유하지 않도록 분리.
 */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final RelationshipEngineProperties properties;

    @Bean(name = "relationshipLookupExecutor")
    public ThreadPoolTaskExecutor relationshipLookupExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setThreadNamePrefix("rel-lookup-");
        ex.setCorePoolSize(properties.getLookupPoolSize());
        ex.setMaxPoolSize(properties.getLookupPoolSize());
        ex.setQueueCapacity(properties.getQueueCapacity());
        ex.setKeepAliveSeconds(60);
        // 거부 시 호출자 스레드를 막지 않고 실패로 처리
        ex.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        ex.initialize();
        return ex;
    }

    @Bean(name = "relationshipStoreExecutor")
    public ThreadPoolTaskExecutor relationshipStoreExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setThreadNamePrefix("rel-store-");
        ex.setCorePoolSize(properties.getStorePoolSize());
        ex.setMaxPoolSize(properties.getStorePoolSize());
        ex.setQueueCapacity(properties.getQueueCapacity());
        ex.setKeepAliveSeconds(60);
        ex.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        ex.initialize();
        return ex;
    }

    @Bean(name = "relationshipSearchScheduler")
    public ThreadPoolTaskScheduler relationshipSearchScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setThreadNamePrefix("rel-search-");
        scheduler.setPoolSize(2);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
