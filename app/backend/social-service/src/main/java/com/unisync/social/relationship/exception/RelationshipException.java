package com.unisync.social.relationship.exception;

/**
 * 관계 엔진 예외의 공통 상위 타입
 */
public abstract class RelationshipException extends RuntimeException {

    private final RelationshipErrorType errorType;
    private final Long requestId;

    protected RelationshipException(RelationshipErrorType errorType, String message, Long requestId) {
        super(message);
        this.errorType = errorType;
        this.requestId = requestId;
    }

    protected RelationshipException(RelationshipErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.requestId = null;
    }

    public RelationshipErrorType getErrorType() {
        return errorType;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }

    /**
     * 호출자가 후속 조치에 사용할 요청 ID (없으면 null)
     */
    public Long getRequestId() {
        return requestId;
    }
}
