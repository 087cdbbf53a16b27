package com.unisync.social.relationship.exception;

/**
 * 저장소 또는 디렉터리 호출 실패 (재시도 가능)
 */
public class StoreUnavailableException extends RelationshipException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(RelationshipErrorType.STORE_UNAVAILABLE, message, cause);
    }
}
