package com.unisync.social.relationship.exception;

/**
 * 요청이 존재하지 않거나 더 이상 PENDING 상태가 아닐 때 발생
 */
public class RequestNotFoundException extends RelationshipException {

    public RequestNotFoundException(Long requestId) {
        super(RelationshipErrorType.NOT_FOUND, "Friend request is not pending: " + requestId, requestId);
    }
}
