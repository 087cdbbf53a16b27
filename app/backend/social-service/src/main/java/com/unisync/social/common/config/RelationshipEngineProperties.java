package com.unisync.social.common.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 관계 엔진 설정 프로퍼티
 *
 * application.yml의 relationship.engine 설정을 바인딩합니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "relationship.engine")
public class RelationshipEngineProperties {

    /**
     * 관계 상태 동시 조회 한도
     * 환경 변수: RELATIONSHIP_CONCURRENCY_LIMIT
     */
    @Min(1)
    @Max(100)
    private int concurrencyLimit = 10;

    /**
     * 일반 검색 디바운스
     */
    @NotNull
    private Duration searchDebounce = Duration.ofMillis(300);

    /**
     * 단일 필드 확인 디바운스
     */
    @NotNull
    private Duration fieldCheckDebounce = Duration.ofMillis(500);

    /**
     * 저장소 호출 1건당 제한 시간
     * 환경 변수: RELATIONSHIP_STORE_TIMEOUT
     */
    @NotNull
    private Duration storeTimeout = Duration.ofSeconds(3);

    /**
     * 사용자 디렉터리 검색 제한 시간
     */
    @NotNull
    private Duration directoryTimeout = Duration.ofSeconds(3);

    /**
     * 디렉터리 검색 최대 결과 수
     */
    @Min(1)
    private int searchResultLimit = 20;

    /**
     * SSE 검색 스트림 유지 시간
     */
    @NotNull
    private Duration streamTimeout = Duration.ofSeconds(30);

    /**
     * 일괄 상태 조회 API 대기 시간
     */
    @NotNull
    private Duration batchResolveTimeout = Duration.ofSeconds(10);

    /**
     * 조회 작업자 스레드 수
     */
    @Min(1)
    private int lookupPoolSize = 16;

    /**
     * 저장소 호출 스레드 수
     */
    @Min(1)
    private int storePoolSize = 16;

    /**
     * 작업 큐 크기
     */
    @Min(0)
    private int queueCapacity = 500;
}
