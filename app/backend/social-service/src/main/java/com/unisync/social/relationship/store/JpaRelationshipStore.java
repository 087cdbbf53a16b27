package com.unisync.social.relationship.store;

import com.unisync.social.common.entity.FriendRequestEntity;
import com.unisync.social.common.entity.Friendship;
import com.unisync.social.common.repository.FriendRequestRepository;
import com.unisync.social.common.repository.FriendshipRepository;
import com.unisync.social.relationship.exception.InvalidTransitionException;
import com.unisync.social.relationship.exception.RequestNotFoundException;
import com.unisync.social.relationship.model.FriendRequest;
import com.unisync.social.relationship.model.FriendRequestState;
import com.unisync.social.relationship.model.PendingRequests;
import com.unisync.social.relationship.model.RelationshipStatus;
import com.unisync.social.relationship.model.UserId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 서비스 자체 데이터베이스를 사용하는 RelationshipStore 구현
 *
 * 한 쌍의 불변식(대기 요청 하나 또는 친구 관계 하나)은 pending_pair_key 유니크 제약과
 * 요청 행 잠금으로 보장한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaRelationshipStore implements RelationshipStore {

    private final FriendRequestRepository friendRequestRepository;
    private final FriendshipRepository friendshipRepository;

    @Override
    @Transactional
    public Long createRequest(UserId fromUserId, UserId toUserId) {
        if (fromUserId.equals(toUserId)) {
            throw InvalidTransitionException.selfRelationship();
        }

        Friendship pair = Friendship.between(fromUserId.getValue(), toUserId.getValue(), null);
        if (friendshipRepository.existsByUserAAndUserB(pair.getUserA(), pair.getUserB())) {
            throw InvalidTransitionException.alreadyFriends();
        }

        String pairKey = pairKey(fromUserId, toUserId);
        Optional<FriendRequestEntity> pending = friendRequestRepository.findByPendingPairKey(pairKey);
        if (pending.isPresent()) {
            FriendRequestEntity existing = pending.get();
            if (existing.getFromUserId().equals(fromUserId.getValue())) {
                log.debug("같은 방향 대기 요청 재사용: requestId={}", existing.getId());
                return existing.getId();
            }
            throw InvalidTransitionException.incomingRequestExists(existing.getId());
        }

        FriendRequestEntity request = FriendRequestEntity.builder()
                .fromUserId(fromUserId.getValue())
                .toUserId(toUserId.getValue())
                .state(FriendRequestState.PENDING)
                .pendingPairKey(pairKey)
                .build();

        try {
            request = friendRequestRepository.saveAndFlush(request);
        } catch (DataIntegrityViolationException e) {
            // 동시에 들어온 다른 요청이 먼저 저장됨
            throw new InvalidTransitionException("Pending friend request was created concurrently");
        }

        log.info("친구 요청 저장: requestId={}, from={}, to={}", request.getId(), fromUserId, toUserId);
        return request.getId();
    }

    @Override
    @Transactional
    public void cancelRequest(Long requestId) {
        close(requestId, FriendRequestState.CANCELED);
    }

    @Override
    @Transactional
    public void acceptRequest(Long requestId) {
        FriendRequestEntity request = close(requestId, FriendRequestState.ACCEPTED);

        Friendship friendship = Friendship.between(request.getFromUserId(), request.getToUserId(), requestId);
        if (!friendshipRepository.existsByUserAAndUserB(friendship.getUserA(), friendship.getUserB())) {
            friendshipRepository.save(friendship);
        }
        log.info("친구 관계 생성: requestId={}, userA={}, userB={}",
                requestId, friendship.getUserA(), friendship.getUserB());
    }

    @Override
    @Transactional
    public void rejectRequest(Long requestId) {
        close(requestId, FriendRequestState.REJECTED);
    }

    @Override
    @Transactional
    public void removeFriendship(UserId userA, UserId userB) {
        Friendship pair = Friendship.between(userA.getValue(), userB.getValue(), null);
        long deleted = friendshipRepository.deleteByUserAAndUserB(pair.getUserA(), pair.getUserB());
        log.info("친구 관계 삭제: userA={}, userB={}, deleted={}", pair.getUserA(), pair.getUserB(), deleted);
    }

    @Override
    @Transactional(readOnly = true)
    public RelationshipStatus getStatus(UserId userA, UserId userB) {
        Friendship pair = Friendship.between(userA.getValue(), userB.getValue(), null);
        if (friendshipRepository.existsByUserAAndUserB(pair.getUserA(), pair.getUserB())) {
            return RelationshipStatus.friends();
        }

        return friendRequestRepository.findByPendingPairKey(pairKey(userA, userB))
                .map(request -> request.getFromUserId().equals(userA.getValue())
                        ? RelationshipStatus.outgoingRequest(request.getId())
                        : RelationshipStatus.incomingRequest(request.getId()))
                .orElse(RelationshipStatus.none());
    }

    @Override
    @Transactional(readOnly = true)
    public PendingRequests listPending(UserId userId) {
        List<FriendRequest> incoming = friendRequestRepository
                .findByToUserIdAndStateOrderByCreatedAtDesc(userId.getValue(), FriendRequestState.PENDING)
                .stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
        List<FriendRequest> outgoing = friendRequestRepository
                .findByFromUserIdAndStateOrderByCreatedAtDesc(userId.getValue(), FriendRequestState.PENDING)
                .stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
        return PendingRequests.of(incoming, outgoing);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<FriendRequest> findRequest(Long requestId) {
        return friendRequestRepository.findById(requestId).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserId> listFriends(UserId userId) {
        return friendshipRepository.findFriendIds(userId.getValue()).stream()
                .map(UserId::of)
                .collect(Collectors.toList());
    }

    private FriendRequestEntity close(Long requestId, FriendRequestState terminalState) {
        FriendRequestEntity request = friendRequestRepository.findByIdForUpdate(requestId)
                .filter(found -> found.getState() == FriendRequestState.PENDING)
                .orElseThrow(() -> new RequestNotFoundException(requestId));

        request.close(terminalState);
        friendRequestRepository.save(request);
        log.info("친구 요청 종료: requestId={}, state={}", requestId, terminalState);
        return request;
    }

    private FriendRequest toDomain(FriendRequestEntity entity) {
        return FriendRequest.builder()
                .id(entity.getId())
                .fromUserId(UserId.of(entity.getFromUserId()))
                .toUserId(UserId.of(entity.getToUserId()))
                .state(entity.getState())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    /**
     * 방향과 무관한 쌍 키
     */
    static String pairKey(UserId user1, UserId user2) {
        String a = user1.getValue();
        String b = user2.getValue();
        return a.compareTo(b) < 0 ? a + ":" + b : b + ":" + a;
    }
}
