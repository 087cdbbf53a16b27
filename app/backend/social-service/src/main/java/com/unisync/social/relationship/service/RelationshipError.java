package com.unisync.social.relationship.service;

import com.unisync.social.relationship.exception.RelationshipErrorType;
import com.unisync.social.relationship.exception.RelationshipException;
import lombok.Value;

/**
 * 변경 요청 실패 정보
 */
@Value
public class RelationshipError {

    RelationshipErrorType type;
    String message;
    boolean retryable;

    /**
     * 후속 조치에 사용할 요청 ID (예: 받은 요청이 있을 때 수락할 요청 ID)
     */
    Long requestId;

    public static RelationshipError from(RelationshipException e) {
        return new RelationshipError(e.getErrorType(), e.getMessage(), e.isRetryable(), e.getRequestId());
    }
}
