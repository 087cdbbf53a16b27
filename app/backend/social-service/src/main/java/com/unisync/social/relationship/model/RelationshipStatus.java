package com.unisync.social.relationship.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 현재 사용자 기준으로 본 상대방과의 관계 상태
 *
 * NONE, OUTGOING_REQUEST(requestId), INCOMING_REQUEST(requestId), FRIENDS 중 정확히 하나.
 * 요청 ID는 요청 상태일 때만 존재한다.
 */
@Getter
@EqualsAndHashCode
public final class RelationshipStatus {

    public enum Kind {
        /**
         * 어느 방향으로도 요청이나 친구 관계가 없음
         */
        NONE,

        /**
         * 현재 사용자가 보낸 요청이 대기 중
         */
        OUTGOING_REQUEST,

        /**
         * 상대방이 보낸 요청이 대기 중
         */
        INCOMING_REQUEST,

        /**
         * 친구 관계 성립
         */
        FRIENDS
    }

    private static final RelationshipStatus NONE = new RelationshipStatus(Kind.NONE, null);
    private static final RelationshipStatus FRIENDS = new RelationshipStatus(Kind.FRIENDS, null);

    private final Kind kind;
    private final Long requestId;

    private RelationshipStatus(Kind kind, Long requestId) {
        this.kind = kind;
        this.requestId = requestId;
    }

    public static RelationshipStatus none() {
        return NONE;
    }

    public static RelationshipStatus friends() {
        return FRIENDS;
    }

    public static RelationshipStatus outgoingRequest(Long requestId) {
        return new RelationshipStatus(Kind.OUTGOING_REQUEST, requireRequestId(requestId));
    }

    public static RelationshipStatus incomingRequest(Long requestId) {
        return new RelationshipStatus(Kind.INCOMING_REQUEST, requireRequestId(requestId));
    }

    public boolean is(Kind kind) {
        return this.kind == kind;
    }

    public boolean isPendingRequest() {
        return kind == Kind.OUTGOING_REQUEST || kind == Kind.INCOMING_REQUEST;
    }

    private static Long requireRequestId(Long requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("Pending request status requires a request id");
        }
        return requestId;
    }

    @Override
    public String toString() {
        return requestId == null ? kind.name() : kind.name() + "(" + requestId + ")";
    }
}
