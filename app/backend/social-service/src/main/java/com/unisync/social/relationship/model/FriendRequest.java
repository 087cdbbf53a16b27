package com.unisync.social.relationship.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 친구 요청
 * 저장소가 소유하며 엔진은 ID로만 조작한다
 */
@Value
@Builder
public class FriendRequest {

    Long id;
    UserId fromUserId;
    UserId toUserId;
    FriendRequestState state;
    LocalDateTime createdAt;

    public boolean isPending() {
        return state == FriendRequestState.PENDING;
    }

    public boolean isIncomingFor(UserId userId) {
        return toUserId.equals(userId);
    }

    /**
     * sender가 recipient에게 보낸 요청인지 확인 (방향 포함)
     */
    public boolean isFrom(UserId sender, UserId recipient) {
        return fromUserId.equals(sender) && toUserId.equals(recipient);
    }
}
