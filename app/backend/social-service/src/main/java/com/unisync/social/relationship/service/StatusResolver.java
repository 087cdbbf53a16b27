package com.unisync.social.relationship.service;

import com.unisync.social.relationship.model.RelationshipStatus;
import com.unisync.social.relationship.model.UserId;
import com.unisync.social.relationship.store.RelationshipStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 여러 후보의 관계 상태를 동시 조회 수 제한 하에 병렬로 조회한다.
 *
 * 최대 concurrencyLimit 개의 작업자가 공유 큐에서 후보를 꺼내 조회하므로 동시에 진행 중인
 * 저장소 조회는 한도를 넘지 않는다. 개별 조회 실패는 배치를 멈추지 않고 NONE으로 전달된다.
 */
@Slf4j
public class StatusResolver {

    private final RelationshipStore store;
    private final Executor executor;

    public StatusResolver(RelationshipStore store, Executor executor) {
        this.store = store;
        this.executor = executor;
    }

    /**
     * 후보 목록의 관계 상태 조회 시작
     *
     * @param currentUserId    기준 사용자
     * @param candidateIds     조회할 후보 (중복은 한 번만 조회)
     * @param concurrencyLimit 동시 조회 한도
     * @param listener         결과 콜백 (완료 순서대로 호출)
     * @return 취소 핸들
     */
    public ResolutionHandle resolve(UserId currentUserId, Collection<UserId> candidateIds,
                                    int concurrencyLimit, StatusListener listener) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("Concurrency limit must be positive: " + concurrencyLimit);
        }

        Batch batch = new Batch(currentUserId, new LinkedHashSet<>(candidateIds), listener);
        batch.start(concurrencyLimit);
        return batch;
    }

    private final class Batch implements ResolutionHandle {

        private final UserId currentUserId;
        private final Queue<UserId> pending;
        private final int size;
        private final StatusListener listener;
        private final CompletableFuture<Void> completion = new CompletableFuture<>();
        private final AtomicInteger activeWorkers = new AtomicInteger();
        private final AtomicInteger failures = new AtomicInteger();
        private final Object deliveryLock = new Object();
        private volatile boolean cancelled;

        private Batch(UserId currentUserId, Collection<UserId> candidates, StatusListener listener) {
            this.currentUserId = currentUserId;
            this.pending = new ConcurrentLinkedQueue<>(candidates);
            this.size = candidates.size();
            this.listener = listener;
        }

        private void start(int concurrencyLimit) {
            if (size == 0) {
                completion.complete(null);
                return;
            }

            int workers = Math.min(concurrencyLimit, size);
            activeWorkers.set(workers);
            log.debug("관계 상태 일괄 조회 시작: currentUserId={}, candidates={}, workers={}",
                    currentUserId, size, workers);

            for (int i = 0; i < workers; i++) {
                try {
                    executor.execute(this::drain);
                } catch (RejectedExecutionException e) {
                    log.warn("조회 작업자 시작 실패 (작업 큐 포화): currentUserId={}", currentUserId);
                    workerFinished();
                }
            }
        }

        private void drain() {
            try {
                UserId candidateId;
                while (!cancelled && (candidateId = pending.poll()) != null) {
                    deliver(candidateId, lookup(candidateId));
                }
            } finally {
                workerFinished();
            }
        }

        private RelationshipStatus lookup(UserId candidateId) {
            try {
                RelationshipStatus status = store.getStatus(currentUserId, candidateId);
                return status != null ? status : RelationshipStatus.none();
            } catch (RuntimeException e) {
                failures.incrementAndGet();
                log.warn("관계 상태 조회 실패, NONE으로 처리: currentUserId={}, candidateId={}, error={}",
                        currentUserId, candidateId, e.getMessage());
                return RelationshipStatus.none();
            }
        }

        private void deliver(UserId candidateId, RelationshipStatus status) {
            synchronized (deliveryLock) {
                if (cancelled) {
                    return;
                }
                try {
                    listener.onStatus(candidateId, status);
                } catch (RuntimeException e) {
                    log.warn("관계 상태 콜백 처리 실패: candidateId={}, error={}", candidateId, e.getMessage());
                }
            }
        }

        private void workerFinished() {
            if (activeWorkers.decrementAndGet() > 0) {
                return;
            }
            // 모든 작업자가 시작에 실패한 경우 남은 후보는 NONE으로 전달
            UserId leftover;
            while (!cancelled && (leftover = pending.poll()) != null) {
                deliver(leftover, RelationshipStatus.none());
            }
            log.debug("관계 상태 일괄 조회 완료: currentUserId={}, candidates={}, failures={}, cancelled={}",
                    currentUserId, size, failures.get(), cancelled);
            completion.complete(null);
        }

        @Override
        public void cancel() {
            synchronized (deliveryLock) {
                if (cancelled) {
                    return;
                }
                cancelled = true;
            }
            pending.clear();
            log.debug("관계 상태 일괄 조회 취소: currentUserId={}", currentUserId);
            completion.complete(null);
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public CompletableFuture<Void> completion() {
            return completion;
        }
    }
}
