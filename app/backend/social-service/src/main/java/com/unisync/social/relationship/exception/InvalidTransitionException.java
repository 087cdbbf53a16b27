package com.unisync.social.relationship.exception;

import com.unisync.social.relationship.model.RelationshipStatus;

/**
 * 현재 관계 상태에서 요청한 동작을 적용할 수 없을 때 발생
 */
public class InvalidTransitionException extends RelationshipException {

    public InvalidTransitionException(String message) {
        super(RelationshipErrorType.INVALID_TRANSITION, message, (Long) null);
    }

    public InvalidTransitionException(String message, Long requestId) {
        super(RelationshipErrorType.INVALID_TRANSITION, message, requestId);
    }

    /**
     * 상대방이 보낸 요청이 이미 있음. 자동 수락하지 않고 accept를 명시적으로 호출해야 한다.
     */
    public static InvalidTransitionException incomingRequestExists(Long requestId) {
        return new InvalidTransitionException("Incoming friend request exists, use accept: " + requestId, requestId);
    }

    public static InvalidTransitionException notApplicable(String action, RelationshipStatus observed) {
        return new InvalidTransitionException(
                String.format("Cannot %s from relationship status %s", action, observed),
                observed.getRequestId());
    }

    public static InvalidTransitionException selfRelationship() {
        return new InvalidTransitionException("Cannot create relationship with yourself");
    }

    public static InvalidTransitionException alreadyFriends() {
        return new InvalidTransitionException("Users are already friends");
    }

    public static InvalidTransitionException requestNotInPair(Long requestId) {
        return new InvalidTransitionException("Friend request does not belong to this relationship: " + requestId, requestId);
    }
}
