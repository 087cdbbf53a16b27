package com.unisync.social.relationship.service;

import com.unisync.social.relationship.exception.RelationshipException;
import com.unisync.social.relationship.model.RelationshipStatus;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 변경 요청 결과
 *
 * 성공/실패와 관계없이 status에는 저장소에서 다시 읽은 상태가 담긴다.
 * 재조회마저 실패한 경우 관찰했던 상태를 담고 verified=false로 표시한다.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MutationResult {

    private final RelationshipStatus status;
    private final boolean verified;
    private final RelationshipError error;

    public static MutationResult success(RelationshipStatus status) {
        return new MutationResult(status, true, null);
    }

    public static MutationResult failure(RelationshipException e, RelationshipStatus status, boolean verified) {
        return new MutationResult(status, verified, RelationshipError.from(e));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
