package com.unisync.social.relationship.store;

import com.unisync.social.relationship.exception.InvalidTransitionException;
import com.unisync.social.relationship.exception.RequestNotFoundException;
import com.unisync.social.relationship.model.FriendRequest;
import com.unisync.social.relationship.model.FriendRequestState;
import com.unisync.social.relationship.model.PendingRequests;
import com.unisync.social.relationship.model.RelationshipStatus;
import com.unisync.social.relationship.model.UserId;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 테스트용 메모리 저장소 (JpaRelationshipStore와 같은 규칙)
 */
public class InMemoryRelationshipStore implements RelationshipStore {

    private final AtomicLong sequence = new AtomicLong();
    private final Map<Long, FriendRequest> requests = new LinkedHashMap<>();
    private final Set<Set<UserId>> friendships = new HashSet<>();

    @Override
    public synchronized Long createRequest(UserId fromUserId, UserId toUserId) {
        if (fromUserId.equals(toUserId)) {
            throw InvalidTransitionException.selfRelationship();
        }
        if (friendships.contains(Set.of(fromUserId, toUserId))) {
            throw InvalidTransitionException.alreadyFriends();
        }
        Optional<FriendRequest> pending = pendingBetween(fromUserId, toUserId);
        if (pending.isPresent()) {
            if (pending.get().getFromUserId().equals(fromUserId)) {
                return pending.get().getId();
            }
            throw InvalidTransitionException.incomingRequestExists(pending.get().getId());
        }

        Long id = sequence.incrementAndGet();
        requests.put(id, FriendRequest.builder()
                .id(id)
                .fromUserId(fromUserId)
                .toUserId(toUserId)
                .state(FriendRequestState.PENDING)
                .createdAt(LocalDateTime.now())
                .build());
        return id;
    }

    @Override
    public synchronized void cancelRequest(Long requestId) {
        close(requestId, FriendRequestState.CANCELED);
    }

    @Override
    public synchronized void acceptRequest(Long requestId) {
        FriendRequest request = close(requestId, FriendRequestState.ACCEPTED);
        friendships.add(Set.of(request.getFromUserId(), request.getToUserId()));
    }

    @Override
    public synchronized void rejectRequest(Long requestId) {
        close(requestId, FriendRequestState.REJECTED);
    }

    @Override
    public synchronized void removeFriendship(UserId userA, UserId userB) {
        friendships.remove(Set.of(userA, userB));
    }

    @Override
    public synchronized RelationshipStatus getStatus(UserId userA, UserId userB) {
        if (friendships.contains(Set.of(userA, userB))) {
            return RelationshipStatus.friends();
        }
        return pendingBetween(userA, userB)
                .map(request -> request.getFromUserId().equals(userA)
                        ? RelationshipStatus.outgoingRequest(request.getId())
                        : RelationshipStatus.incomingRequest(request.getId()))
                .orElse(RelationshipStatus.none());
    }

    @Override
    public synchronized PendingRequests listPending(UserId userId) {
        List<FriendRequest> incoming = new ArrayList<>();
        List<FriendRequest> outgoing = new ArrayList<>();
        for (FriendRequest request : requests.values()) {
            if (!request.isPending()) {
                continue;
            }
            if (request.getToUserId().equals(userId)) {
                incoming.add(request);
            } else if (request.getFromUserId().equals(userId)) {
                outgoing.add(request);
            }
        }
        return PendingRequests.of(incoming, outgoing);
    }

    @Override
    public synchronized Optional<FriendRequest> findRequest(Long requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    @Override
    public synchronized List<UserId> listFriends(UserId userId) {
        return friendships.stream()
                .filter(pair -> pair.contains(userId))
                .flatMap(Set::stream)
                .filter(id -> !id.equals(userId))
                .collect(Collectors.toList());
    }

    public synchronized long requestCount() {
        return requests.size();
    }

    private Optional<FriendRequest> pendingBetween(UserId userA, UserId userB) {
        return requests.values().stream()
                .filter(FriendRequest::isPending)
                .filter(request -> request.isFrom(userA, userB) || request.isFrom(userB, userA))
                .findFirst();
    }

    private FriendRequest close(Long requestId, FriendRequestState state) {
        FriendRequest request = requests.get(requestId);
        if (request == null || !request.isPending()) {
            throw new RequestNotFoundException(requestId);
        }
        FriendRequest closed = FriendRequest.builder()
                .id(request.getId())
                .fromUserId(request.getFromUserId())
                .toUserId(request.getToUserId())
                .state(state)
                .createdAt(request.getCreatedAt())
                .build();
        requests.put(requestId, closed);
        return closed;
    }
}
