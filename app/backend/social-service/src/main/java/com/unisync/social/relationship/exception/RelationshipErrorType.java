package com.unisync.social.relationship.exception;

/**
 * 관계 엔진 오류 분류
 */
public enum RelationshipErrorType {
    /**
     * 요청 ID가 더 이상 존재하지 않음 (이미 종료된 것으로 간주, 치명적이지 않음)
     */
    NOT_FOUND(false),

    /**
     * 현재 상태에서 허용되지 않는 전이 (예: 받은 요청이 있는데 요청 발송)
     */
    INVALID_TRANSITION(false),

    /**
     * 저장소 또는 네트워크 장애 (재시도 가능)
     */
    STORE_UNAVAILABLE(true),

    /**
     * 저장소 호출 시간 초과 (재시도 가능)
     */
    TIMEOUT(true);

    private final boolean retryable;

    RelationshipErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
