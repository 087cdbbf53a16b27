package com.unisync.social.relationship.search;

import com.unisync.social.relationship.model.RelationshipStatus;
import com.unisync.social.relationship.model.UserId;
import com.unisync.social.relationship.model.UserSummary;
import lombok.Value;

/**
 * 검색 후보 한 명의 관계 상태 (세대 번호 포함)
 */
@Value
public class SearchResult {

    long generation;
    UserSummary candidate;
    RelationshipStatus status;

    public UserId getUserId() {
        return candidate.getId();
    }
}
