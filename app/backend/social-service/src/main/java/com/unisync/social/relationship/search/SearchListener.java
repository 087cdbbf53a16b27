package com.unisync.social.relationship.search;

import com.unisync.social.relationship.exception.RelationshipException;
import com.unisync.social.relationship.model.UserSummary;

import java.util.List;

/**
 * 검색 파이프라인 이벤트 수신자
 *
 * 모든 이벤트에는 세대 번호가 붙는다. 호출자는 최신 세대가 아닌 이벤트를 버려야 한다.
 */
public interface SearchListener {

    /**
     * 디렉터리 검색 결과 (관계 상태 조회 전)
     */
    default void onCandidates(long generation, List<UserSummary> candidates) {
    }

    void onResult(SearchResult result);

    void onComplete(long generation);

    /**
     * 디렉터리 검색 실패. 이후 같은 세대의 이벤트는 없다.
     */
    default void onError(long generation, RelationshipException error) {
    }

    /**
     * 더 새로운 검색이나 취소로 파이프라인이 버려짐. 이후 같은 세대의 이벤트는 없다.
     */
    default void onSuperseded(long generation) {
    }
}
