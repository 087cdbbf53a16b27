package com.unisync.social.relationship.service;

import com.unisync.social.relationship.exception.InvalidTransitionException;
import com.unisync.social.relationship.exception.RequestNotFoundException;
import com.unisync.social.relationship.model.FriendRequest;
import com.unisync.social.relationship.model.RelationshipStatus;
import com.unisync.social.relationship.model.RelationshipStatus.Kind;
import com.unisync.social.relationship.model.UserId;
import com.unisync.social.relationship.store.RelationshipStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * 한 사용자 쌍의 관계 전이 규칙
 *
 * 호출자가 관찰한 상태는 어떤 저장소 호출을 시도할지 정하는 힌트로만 사용한다.
 * 두 사용자가 동시에 상태를 바꿀 수 있으므로 모든 동작 뒤에는 저장소에서 상태를 다시 읽어 반환한다.
 */
@Slf4j
@RequiredArgsConstructor
public class RelationshipStateMachine {

    private final RelationshipStore store;

    /**
     * 친구 요청 발송
     *
     * @param currentUserId 요청자
     * @param otherUserId   대상 사용자
     * @param observed      호출자가 관찰한 상태
     * @return 발송 후 저장소 기준 상태
     */
    public RelationshipStatus send(UserId currentUserId, UserId otherUserId, RelationshipStatus observed) {
        requireDistinct(currentUserId, otherUserId);

        switch (observed.getKind()) {
            case OUTGOING_REQUEST:
            case FRIENDS:
                log.debug("친구 요청 생략 (이미 {}): currentUserId={}, otherUserId={}", observed, currentUserId, otherUserId);
                return observed;
            case INCOMING_REQUEST:
                throw InvalidTransitionException.incomingRequestExists(observed.getRequestId());
            default:
                break;
        }

        try {
            Long requestId = store.createRequest(currentUserId, otherUserId);
            log.info("친구 요청 발송: from={}, to={}, requestId={}", currentUserId, otherUserId, requestId);
        } catch (InvalidTransitionException e) {
            // 관찰한 NONE이 오래된 값이었음
            RelationshipStatus actual = store.getStatus(currentUserId, otherUserId);
            if (actual.is(Kind.OUTGOING_REQUEST) || actual.is(Kind.FRIENDS)) {
                log.info("친구 요청 발송 생략 (저장소 상태 {}): from={}, to={}", actual, currentUserId, otherUserId);
                return actual;
            }
            if (actual.is(Kind.INCOMING_REQUEST)) {
                throw InvalidTransitionException.incomingRequestExists(actual.getRequestId());
            }
            throw e;
        }

        return store.getStatus(currentUserId, otherUserId);
    }

    /**
     * 보낸 친구 요청 취소
     * 상대가 먼저 수락/거절한 경우 오류 없이 현재 상태를 반환한다.
     */
    public RelationshipStatus cancel(UserId currentUserId, UserId otherUserId, RelationshipStatus observed) {
        requireDistinct(currentUserId, otherUserId);
        if (observed.is(Kind.NONE)) {
            return observed;
        }
        if (!observed.is(Kind.OUTGOING_REQUEST)) {
            throw InvalidTransitionException.notApplicable("cancel", observed);
        }
        return applyToRequest("취소", observed.getRequestId(), currentUserId, otherUserId,
                currentUserId, otherUserId, store::cancelRequest);
    }

    /**
     * 받은 친구 요청 수락
     * 요청자가 먼저 취소한 경우 오류 없이 현재 상태를 반환한다.
     */
    public RelationshipStatus accept(UserId currentUserId, UserId otherUserId, RelationshipStatus observed) {
        requireDistinct(currentUserId, otherUserId);
        if (!observed.is(Kind.INCOMING_REQUEST)) {
            throw InvalidTransitionException.notApplicable("accept", observed);
        }
        return applyToRequest("수락", observed.getRequestId(), otherUserId, currentUserId,
                currentUserId, otherUserId, store::acceptRequest);
    }

    /**
     * 받은 친구 요청 거절
     */
    public RelationshipStatus reject(UserId currentUserId, UserId otherUserId, RelationshipStatus observed) {
        requireDistinct(currentUserId, otherUserId);
        if (!observed.is(Kind.INCOMING_REQUEST)) {
            throw InvalidTransitionException.notApplicable("reject", observed);
        }
        return applyToRequest("거절", observed.getRequestId(), otherUserId, currentUserId,
                currentUserId, otherUserId, store::rejectRequest);
    }

    /**
     * 친구 삭제. 이미 관계가 없으면 아무것도 하지 않는다.
     */
    public RelationshipStatus remove(UserId currentUserId, UserId otherUserId, RelationshipStatus observed) {
        requireDistinct(currentUserId, otherUserId);
        if (observed.is(Kind.NONE)) {
            return observed;
        }
        if (!observed.is(Kind.FRIENDS)) {
            throw InvalidTransitionException.notApplicable("remove", observed);
        }

        store.removeFriendship(currentUserId, otherUserId);
        log.info("친구 삭제: userId={}, friendUserId={}", currentUserId, otherUserId);

        return store.getStatus(currentUserId, otherUserId);
    }

    private RelationshipStatus applyToRequest(String action, Long requestId,
                                              UserId sender, UserId recipient,
                                              UserId currentUserId, UserId otherUserId,
                                              Consumer<Long> storeCall) {
        Optional<FriendRequest> request = store.findRequest(requestId);

        // 다른 쌍의 요청 ID로 조작하는 것은 허용하지 않음
        if (request.isPresent() && !request.get().isFrom(sender, recipient)) {
            throw InvalidTransitionException.requestNotInPair(requestId);
        }

        if (request.isEmpty() || !request.get().isPending()) {
            log.info("친구 요청 {} 생략 (이미 종료된 요청): requestId={}", action, requestId);
            return store.getStatus(currentUserId, otherUserId);
        }

        try {
            storeCall.accept(requestId);
            log.info("친구 요청 {}: requestId={}, from={}, to={}", action, requestId, sender, recipient);
        } catch (RequestNotFoundException e) {
            log.info("친구 요청 {} 중 상대방이 먼저 처리함: requestId={}", action, requestId);
        }

        return store.getStatus(currentUserId, otherUserId);
    }

    private void requireDistinct(UserId currentUserId, UserId otherUserId) {
        if (currentUserId.equals(otherUserId)) {
            throw InvalidTransitionException.selfRelationship();
        }
    }
}
