package com.unisync.social.relationship.store;

import com.unisync.social.relationship.exception.RelationshipException;
import com.unisync.social.relationship.exception.StoreTimeoutException;
import com.unisync.social.relationship.exception.StoreUnavailableException;
import com.unisync.social.relationship.model.FriendRequest;
import com.unisync.social.relationship.model.PendingRequests;
import com.unisync.social.relationship.model.RelationshipStatus;
import com.unisync.social.relationship.model.UserId;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 저장소 호출마다 제한 시간을 적용하고 인프라 예외를 엔진 오류 분류로 변환하는 데코레이터
 *
 * 제한 시간을 넘긴 호출은 결과를 버릴 뿐 진행 중인 작업을 강제로 중단하지는 않는다.
 */
@Slf4j
public class GuardedRelationshipStore implements RelationshipStore {

    private final RelationshipStore delegate;
    private final Executor executor;
    private final Duration timeout;

    public GuardedRelationshipStore(RelationshipStore delegate, Executor executor, Duration timeout) {
        this.delegate = delegate;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public Long createRequest(UserId fromUserId, UserId toUserId) {
        return call("createRequest", () -> delegate.createRequest(fromUserId, toUserId));
    }

    @Override
    public void cancelRequest(Long requestId) {
        run("cancelRequest", () -> delegate.cancelRequest(requestId));
    }

    @Override
    public void acceptRequest(Long requestId) {
        run("acceptRequest", () -> delegate.acceptRequest(requestId));
    }

    @Override
    public void rejectRequest(Long requestId) {
        run("rejectRequest", () -> delegate.rejectRequest(requestId));
    }

    @Override
    public void removeFriendship(UserId userA, UserId userB) {
        run("removeFriendship", () -> delegate.removeFriendship(userA, userB));
    }

    @Override
    public RelationshipStatus getStatus(UserId userA, UserId userB) {
        return call("getStatus", () -> delegate.getStatus(userA, userB));
    }

    @Override
    public PendingRequests listPending(UserId userId) {
        return call("listPending", () -> delegate.listPending(userId));
    }

    @Override
    public Optional<FriendRequest> findRequest(Long requestId) {
        return call("findRequest", () -> delegate.findRequest(requestId));
    }

    @Override
    public List<UserId> listFriends(UserId userId) {
        return call("listFriends", () -> delegate.listFriends(userId));
    }

    private void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private <T> T call(String operation, Supplier<T> action) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(action, executor);
        } catch (RejectedExecutionException e) {
            log.warn("저장소 호출 거부됨 (작업 큐 포화): operation={}", operation);
            throw new StoreUnavailableException(operation + " rejected by executor", e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("저장소 호출 시간 초과: operation={}, timeout={}ms", operation, timeout.toMillis());
            throw new StoreTimeoutException(operation, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new StoreUnavailableException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            throw translate(operation, e.getCause());
        }
    }

    private RelationshipException translate(String operation, Throwable cause) {
        if (cause instanceof RelationshipException) {
            return (RelationshipException) cause;
        }
        log.warn("저장소 호출 실패: operation={}, error={}", operation, cause.getMessage());
        return new StoreUnavailableException(operation + " failed: " + cause.getMessage(), cause);
    }
}
