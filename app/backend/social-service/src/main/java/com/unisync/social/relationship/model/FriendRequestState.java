package com.unisync.social.relationship.model;

/**
 * 친구 요청 상태
 * PENDING에서 종료 상태 중 하나로 정확히 한 번 전이한 뒤 변경되지 않음
 */
public enum FriendRequestState {
    /**
     * 응답 대기 중
     */
    PENDING,

    /**
     * 수락됨 (친구 관계 생성)
     */
    ACCEPTED,

    /**
     * 거절됨
     */
    REJECTED,

    /**
     * 요청자가 취소함
     */
    CANCELED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
