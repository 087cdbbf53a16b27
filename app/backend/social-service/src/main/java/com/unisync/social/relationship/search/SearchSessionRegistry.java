package com.unisync.social.relationship.search;

import com.unisync.social.relationship.model.UserId;
import com.unisync.social.relationship.service.RelationshipGraphFacade;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 사용자별 검색 코디네이터 보관
 *
 * 같은 사용자가 새 검색 스트림을 열면 같은 코디네이터에 제출되어 이전 검색이 폐기된다.
 * 세션은 열린 스트림 수를 세고, 마지막 스트림이 끝나면 코디네이터를 닫고 제거한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SearchSessionRegistry {

    private final RelationshipGraphFacade relationshipGraphFacade;

    private final Map<UserId, Session> sessions = new ConcurrentHashMap<>();

    /**
     * 스트림 하나를 세션에 등록하고 코디네이터를 반환
     * 반환된 코디네이터는 스트림이 끝날 때 {@link #release(UserId, SearchCoordinator)}로 반납해야 한다.
     */
    public SearchCoordinator acquire(UserId userId) {
        Session session = sessions.compute(userId, (id, existing) -> {
            Session target = existing != null ? existing : new Session(relationshipGraphFacade.openSearch(id));
            target.streams++;
            return target;
        });
        return session.coordinator;
    }

    /**
     * 스트림 하나를 반납. 다른 코디네이터로 교체된 세션에는 영향을 주지 않는다.
     */
    public void release(UserId userId, SearchCoordinator coordinator) {
        AtomicReference<SearchCoordinator> idle = new AtomicReference<>();
        sessions.computeIfPresent(userId, (id, session) -> {
            if (session.coordinator != coordinator) {
                return session;
            }
            session.streams--;
            if (session.streams > 0) {
                return session;
            }
            idle.set(session.coordinator);
            return null;
        });

        SearchCoordinator released = idle.get();
        if (released != null) {
            released.close();
            log.debug("검색 세션 해제: userId={}", userId);
        }
    }

    public int activeSessions() {
        return sessions.size();
    }

    @PreDestroy
    public void closeAll() {
        log.info("검색 세션 전체 종료: sessions={}", sessions.size());
        List<Session> open = new ArrayList<>(sessions.values());
        sessions.clear();
        open.forEach(session -> session.coordinator.close());
    }

    private static final class Session {

        private final SearchCoordinator coordinator;
        private int streams;

        private Session(SearchCoordinator coordinator) {
            this.coordinator = coordinator;
        }
    }
}
