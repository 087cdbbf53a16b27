package com.unisync.social.relationship.store;

import com.unisync.social.relationship.model.UserId;
import com.unisync.social.relationship.model.UserSummary;

import java.util.List;

/**
 * 사용자 디렉터리 검색 계약
 */
public interface UserDirectory {

    /**
     * 사용자명 또는 표시 이름으로 검색 (대소문자 무시, 사용자명 오름차순)
     *
     * @param query           공백이 제거된 검색어
     * @param excludingUserId 결과에서 제외할 사용자 (보통 요청자 본인)
     * @param limit           최대 결과 수
     */
    List<UserSummary> search(String query, UserId excludingUserId, int limit);
}
