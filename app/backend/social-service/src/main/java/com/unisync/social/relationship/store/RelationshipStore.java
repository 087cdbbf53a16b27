package com.unisync.social.relationship.store;

import com.unisync.social.relationship.model.FriendRequest;
import com.unisync.social.relationship.model.PendingRequests;
import com.unisync.social.relationship.model.RelationshipStatus;
import com.unisync.social.relationship.model.UserId;

import java.util.List;
import java.util.Optional;

/**
 * 친구 요청 / 친구 관계 저장소 계약
 *
 * 저장소는 독립적으로 일관성을 유지하며, 한 쌍에 대해 대기 요청과 친구 관계가
 * 동시에 존재하지 않도록 보장한다. 엔진은 저장소에 대한 배타적 잠금을 갖지 않는다.
 */
public interface RelationshipStore {

    /**
     * 친구 요청 생성
     * 같은 방향의 대기 요청이 이미 있으면 그 ID를 반환한다.
     *
     * @throws com.unisync.social.relationship.exception.InvalidTransitionException
     *         친구 관계 또는 반대 방향 대기 요청이 있을 때
     */
    Long createRequest(UserId fromUserId, UserId toUserId);

    /**
     * @throws com.unisync.social.relationship.exception.RequestNotFoundException 요청이 대기 상태가 아닐 때
     */
    void cancelRequest(Long requestId);

    /**
     * 요청을 수락 상태로 바꾸고 친구 관계를 생성한다.
     *
     * @throws com.unisync.social.relationship.exception.RequestNotFoundException 요청이 대기 상태가 아닐 때
     */
    void acceptRequest(Long requestId);

    /**
     * @throws com.unisync.social.relationship.exception.RequestNotFoundException 요청이 대기 상태가 아닐 때
     */
    void rejectRequest(Long requestId);

    /**
     * 친구 관계 삭제. 관계가 없으면 아무것도 하지 않는다.
     */
    void removeFriendship(UserId userA, UserId userB);

    /**
     * userA 기준 userB와의 관계 상태
     */
    RelationshipStatus getStatus(UserId userA, UserId userB);

    PendingRequests listPending(UserId userId);

    Optional<FriendRequest> findRequest(Long requestId);

    List<UserId> listFriends(UserId userId);
}
