package com.unisync.social.relationship.service;

import com.unisync.social.common.config.RelationshipEngineProperties;
import com.unisync.social.relationship.exception.InvalidTransitionException;
import com.unisync.social.relationship.exception.RelationshipException;
import com.unisync.social.relationship.model.PendingRequests;
import com.unisync.social.relationship.model.RelationshipStatus;
import com.unisync.social.relationship.model.UserId;
import com.unisync.social.relationship.search.SearchCoordinator;
import com.unisync.social.relationship.search.SearchListener;
import com.unisync.social.relationship.search.SearchMode;
import com.unisync.social.relationship.store.RelationshipStore;
import com.unisync.social.relationship.store.UserDirectory;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 관계 엔진의 진입점
 *
 * 검색, 일괄 상태 조회, 관계 변경 동작을 제공한다. 변경 동작은 항상 저장소에서 다시 읽은 상태를 반환하며
 * 실패한 경우에도 오류와 함께 재조회한 상태를 돌려준다.
 */
@Slf4j
public class RelationshipGraphFacade {

    private final RelationshipStore store;
    private final UserDirectory userDirectory;
    private final RelationshipStateMachine stateMachine;
    private final StatusResolver statusResolver;
    private final ScheduledExecutorService searchScheduler;
    private final Executor directoryExecutor;
    private final RelationshipEngineProperties properties;

    public RelationshipGraphFacade(RelationshipStore store,
                                   UserDirectory userDirectory,
                                   RelationshipStateMachine stateMachine,
                                   StatusResolver statusResolver,
                                   ScheduledExecutorService searchScheduler,
                                   Executor directoryExecutor,
                                   RelationshipEngineProperties properties) {
        this.store = store;
        this.userDirectory = userDirectory;
        this.stateMachine = stateMachine;
        this.statusResolver = statusResolver;
        this.searchScheduler = searchScheduler;
        this.directoryExecutor = directoryExecutor;
        this.properties = properties;
    }

    /**
     * 사용자 한 명의 검색 세션 생성
     * 이후 검색어는 반환된 코디네이터에 계속 제출한다.
     */
    public SearchCoordinator openSearch(UserId currentUserId) {
        return new SearchCoordinator(
                currentUserId, userDirectory, statusResolver, searchScheduler, directoryExecutor, properties);
    }

    /**
     * 새 검색 세션을 열고 검색어 하나를 제출
     *
     * 호출마다 독립된 세션이 만들어지므로 같은 사용자의 두 호출은 서로를 취소하지 않는다.
     * 입력 중인 검색어처럼 이전 검색을 폐기해야 하면 반환된 코디네이터에 다음 검색어를 제출한다.
     */
    public SearchCoordinator search(UserId currentUserId, String query, SearchListener listener) {
        SearchCoordinator coordinator = openSearch(currentUserId);
        coordinator.submit(query, SearchMode.GENERAL, listener);
        return coordinator;
    }

    /**
     * 후보 목록의 관계 상태를 스트리밍으로 조회 (실패한 조회는 NONE)
     */
    public ResolutionHandle resolveStatuses(UserId currentUserId, Collection<UserId> candidateIds,
                                            StatusListener listener) {
        return statusResolver.resolve(currentUserId, candidateIds, properties.getConcurrencyLimit(), listener);
    }

    /**
     * 후보 목록의 관계 상태를 모두 조회할 때까지 기다린다.
     * 제한 시간 안에 조회되지 않은 후보는 NONE으로 채운다.
     */
    public Map<UserId, RelationshipStatus> checkStatuses(UserId currentUserId, Collection<UserId> candidateIds) {
        Set<UserId> candidates = new LinkedHashSet<>(candidateIds);
        Map<UserId, RelationshipStatus> resolved = new ConcurrentHashMap<>();
        ResolutionHandle handle = resolveStatuses(currentUserId, candidates, resolved::put);

        try {
            handle.completion().get(properties.getBatchResolveTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            handle.cancel();
            log.warn("일괄 상태 조회 시간 초과: currentUserId={}, resolved={}/{}",
                    currentUserId, resolved.size(), candidates.size());
        } catch (InterruptedException e) {
            handle.cancel();
            Thread.currentThread().interrupt();
            log.warn("일괄 상태 조회 중단: currentUserId={}", currentUserId);
        } catch (ExecutionException e) {
            handle.cancel();
            log.warn("일괄 상태 조회 실패: currentUserId={}, error={}", currentUserId, e.getMessage());
        }

        Map<UserId, RelationshipStatus> statuses = new LinkedHashMap<>();
        for (UserId candidateId : candidates) {
            statuses.put(candidateId, resolved.getOrDefault(candidateId, RelationshipStatus.none()));
        }
        return statuses;
    }

    /**
     * 상대방과의 현재 관계 상태 (저장소 오류는 그대로 전파)
     */
    public RelationshipStatus checkStatus(UserId currentUserId, UserId otherUserId) {
        if (currentUserId.equals(otherUserId)) {
            throw InvalidTransitionException.selfRelationship();
        }
        return store.getStatus(currentUserId, otherUserId);
    }

    public MutationResult sendRequest(UserId currentUserId, UserId otherUserId) {
        return mutate("send", currentUserId, otherUserId, RelationshipStatus.none(),
                () -> stateMachine.send(currentUserId, otherUserId, store.getStatus(currentUserId, otherUserId)));
    }

    public MutationResult cancelRequest(UserId currentUserId, UserId otherUserId, Long requestId) {
        RelationshipStatus observed = RelationshipStatus.outgoingRequest(requestId);
        return mutate("cancel", currentUserId, otherUserId, observed,
                () -> stateMachine.cancel(currentUserId, otherUserId, observed));
    }

    public MutationResult acceptRequest(UserId currentUserId, UserId otherUserId, Long requestId) {
        RelationshipStatus observed = RelationshipStatus.incomingRequest(requestId);
        return mutate("accept", currentUserId, otherUserId, observed,
                () -> stateMachine.accept(currentUserId, otherUserId, observed));
    }

    public MutationResult rejectRequest(UserId currentUserId, UserId otherUserId, Long requestId) {
        RelationshipStatus observed = RelationshipStatus.incomingRequest(requestId);
        return mutate("reject", currentUserId, otherUserId, observed,
                () -> stateMachine.reject(currentUserId, otherUserId, observed));
    }

    public MutationResult removeFriend(UserId currentUserId, UserId otherUserId) {
        return mutate("remove", currentUserId, otherUserId, RelationshipStatus.friends(),
                () -> stateMachine.remove(currentUserId, otherUserId, store.getStatus(currentUserId, otherUserId)));
    }

    public PendingRequests listPendingRequests(UserId userId) {
        return store.listPending(userId);
    }

    public List<UserId> listFriends(UserId userId) {
        return store.listFriends(userId);
    }

    private MutationResult mutate(String action, UserId currentUserId, UserId otherUserId,
                                  RelationshipStatus observed, Mutation mutation) {
        try {
            return MutationResult.success(mutation.apply());
        } catch (RelationshipException e) {
            log.warn("관계 변경 실패: action={}, currentUserId={}, otherUserId={}, errorType={}, message={}",
                    action, currentUserId, otherUserId, e.getErrorType(), e.getMessage());
            return recheckAfterFailure(e, currentUserId, otherUserId, observed);
        }
    }

    private MutationResult recheckAfterFailure(RelationshipException failure, UserId currentUserId,
                                               UserId otherUserId, RelationshipStatus observed) {
        if (currentUserId.equals(otherUserId)) {
            return MutationResult.failure(failure, RelationshipStatus.none(), true);
        }
        try {
            return MutationResult.failure(failure, store.getStatus(currentUserId, otherUserId), true);
        } catch (RelationshipException recheckFailure) {
            log.warn("실패 후 상태 재조회 실패: currentUserId={}, otherUserId={}, error={}",
                    currentUserId, otherUserId, recheckFailure.getMessage());
            return MutationResult.failure(failure, observed, false);
        }
    }

    @FunctionalInterface
    private interface Mutation {
        RelationshipStatus apply();
    }
}
