package com.unisync.social.relationship.controller;

import com.unisync.social.common.config.RelationshipEngineProperties;
import com.unisync.social.relationship.model.UserId;
import com.unisync.social.relationship.search.SearchCoordinator;
import com.unisync.social.relationship.search.SearchMode;
import com.unisync.social.relationship.search.SearchSessionRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

@RestController
@RequestMapping("/v1/relationships/search")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "사용자 검색 API", description = "사용자 검색 결과와 관계 상태를 SSE로 스트리밍")
public class RelationshipSearchController {

    private final SearchSessionRegistry searchSessionRegistry;
    private final RelationshipEngineProperties properties;

    /**
     * 검색 스트림
     *
     * 같은 사용자가 새 스트림을 열면 이전 스트림은 종료된다.
     * 스트림이 끝나면(완료, 시간 초과, 오류) 검색 세션을 반납한다.
     * 이벤트: candidates, result, complete, error (모두 generation 포함)
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "사용자 검색 (SSE)", description = "디바운스 후 사용자를 검색하고 각 후보의 관계 상태를 조회되는 순서대로 전송합니다")
    public SseEmitter searchStream(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @RequestParam(defaultValue = "") String query,
            @RequestParam(defaultValue = "GENERAL") SearchMode mode
    ) {
        UserId currentUserId = UserId.of(cognitoSub);
        SearchCoordinator coordinator = searchSessionRegistry.acquire(currentUserId);
        SseEmitter emitter = new SseEmitter(properties.getStreamTimeout().toMillis());

        AtomicLong generation = new AtomicLong(-1);
        AtomicBoolean released = new AtomicBoolean();
        Runnable releaseSession = () -> {
            if (released.compareAndSet(false, true)) {
                searchSessionRegistry.release(currentUserId, coordinator);
            }
        };

        emitter.onTimeout(() -> {
            log.debug("검색 스트림 시간 초과: currentUserId={}, generation={}", currentUserId, generation.get());
            coordinator.cancel(generation.get());
            releaseSession.run();
        });
        emitter.onError(error -> {
            coordinator.cancel(generation.get());
            releaseSession.run();
        });
        emitter.onCompletion(releaseSession);

        try {
            generation.set(coordinator.submit(query, mode, new SseSearchListener(emitter)));
        } catch (RuntimeException e) {
            releaseSession.run();
            throw e;
        }
        log.info("사용자 검색 스트림: query={}, mode={}, generation={}", query, mode, generation.get());
        return emitter;
    }
}
