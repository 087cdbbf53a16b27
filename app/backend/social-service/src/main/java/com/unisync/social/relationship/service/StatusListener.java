package com.unisync.social.relationship.service;

import com.unisync.social.relationship.model.RelationshipStatus;
import com.unisync.social.relationship.model.UserId;

/**
 * 후보별 관계 상태 수신 콜백
 * 한 배치 안에서 호출은 직렬화되며 순서는 완료 순서이다.
 */
@FunctionalInterface
public interface StatusListener {

    void onStatus(UserId candidateId, RelationshipStatus status);
}
