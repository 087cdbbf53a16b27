package com.unisync.social.relationship.controller;

import com.unisync.social.relationship.dto.SearchEvent;
import com.unisync.social.relationship.exception.RelationshipException;
import com.unisync.social.relationship.model.UserSummary;
import com.unisync.social.relationship.search.SearchListener;
import com.unisync.social.relationship.search.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;

/**
 * 검색 파이프라인 이벤트를 SSE 이벤트로 전송
 */
@Slf4j
@RequiredArgsConstructor
class SseSearchListener implements SearchListener {

    static final String CANDIDATES = "candidates";
    static final String RESULT = "result";
    static final String COMPLETE = "complete";
    static final String ERROR = "error";

    private final SseEmitter emitter;

    @Override
    public void onCandidates(long generation, List<UserSummary> candidates) {
        send(CANDIDATES, SearchEvent.candidates(generation, candidates));
    }

    @Override
    public void onResult(SearchResult result) {
        send(RESULT, SearchEvent.result(result));
    }

    @Override
    public void onComplete(long generation) {
        if (send(COMPLETE, SearchEvent.complete(generation))) {
            emitter.complete();
        }
    }

    @Override
    public void onError(long generation, RelationshipException error) {
        if (send(ERROR, SearchEvent.error(generation, error))) {
            emitter.complete();
        }
    }

    @Override
    public void onSuperseded(long generation) {
        emitter.complete();
    }

    private boolean send(String name, SearchEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(name)
                    .id(String.valueOf(event.getGeneration()))
                    .data(event, MediaType.APPLICATION_JSON));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("검색 이벤트 전송 실패 (클라이언트 연결 종료): event={}, generation={}, error={}",
                    name, event.getGeneration(), e.getMessage());
            emitter.completeWithError(e);
            return false;
        }
    }
}
