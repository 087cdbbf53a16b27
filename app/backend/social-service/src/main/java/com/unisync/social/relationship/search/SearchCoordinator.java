package com.unisync.social.relationship.search;

import com.unisync.social.common.config.RelationshipEngineProperties;
import com.unisync.social.relationship.exception.RelationshipException;
import com.unisync.social.relationship.exception.StoreTimeoutException;
import com.unisync.social.relationship.exception.StoreUnavailableException;
import com.unisync.social.relationship.model.UserId;
import com.unisync.social.relationship.model.UserSummary;
import com.unisync.social.relationship.service.ResolutionHandle;
import com.unisync.social.relationship.service.StatusResolver;
import com.unisync.social.relationship.store.UserDirectory;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 한 사용자의 검색어 입력을 하나의 살아있는 검색 파이프라인으로 변환한다.
 *
 * 새 검색어가 들어오면 세대 번호를 올리고 이전 파이프라인의 디바운스 타이머, 디렉터리 검색,
 * 관계 상태 조회 배치를 모두 취소한다. 이벤트 전달과 취소는 같은 잠금 아래에서 일어나므로
 * submit이 반환된 뒤에는 이전 세대의 이벤트가 전달되지 않는다.
 */
@Slf4j
public class SearchCoordinator implements AutoCloseable {

    private final UserId currentUserId;
    private final UserDirectory userDirectory;
    private final StatusResolver statusResolver;
    private final ScheduledExecutorService scheduler;
    private final Executor directoryExecutor;
    private final RelationshipEngineProperties properties;

    private final AtomicLong generation = new AtomicLong();
    private final Object lock = new Object();

    private Pipeline current;
    private SearchPhase phase = SearchPhase.IDLE;
    private boolean closed;

    public SearchCoordinator(UserId currentUserId,
                             UserDirectory userDirectory,
                             StatusResolver statusResolver,
                             ScheduledExecutorService scheduler,
                             Executor directoryExecutor,
                             RelationshipEngineProperties properties) {
        this.currentUserId = currentUserId;
        this.userDirectory = userDirectory;
        this.statusResolver = statusResolver;
        this.scheduler = scheduler;
        this.directoryExecutor = directoryExecutor;
        this.properties = properties;
    }

    public long submit(String query, SearchListener listener) {
        return submit(query, SearchMode.GENERAL, listener);
    }

    /**
     * 새 검색어 제출
     *
     * @param query    검색어 (비어 있으면 즉시 빈 결과로 완료)
     * @param mode     디바운스 종류
     * @param listener 이 세대의 이벤트 수신자
     * @return 이 검색에 부여된 세대 번호
     */
    public long submit(String query, SearchMode mode, SearchListener listener) {
        String trimmed = query == null ? "" : query.trim();
        Pipeline superseded;
        long nextGeneration;

        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Search coordinator is closed: " + currentUserId);
            }
            superseded = detachCurrent();
            nextGeneration = generation.incrementAndGet();

            if (trimmed.isEmpty()) {
                phase = SearchPhase.IDLE;
                log.debug("빈 검색어, 즉시 종료: currentUserId={}, generation={}", currentUserId, nextGeneration);
            } else {
                Pipeline pipeline = new Pipeline(nextGeneration, trimmed, listener);
                current = pipeline;
                phase = SearchPhase.DEBOUNCING;
                try {
                    pipeline.debounce = scheduler.schedule(
                            () -> search(pipeline), debounceFor(mode).toMillis(), TimeUnit.MILLISECONDS);
                    log.debug("검색 디바운스 시작: currentUserId={}, generation={}, query={}, mode={}",
                            currentUserId, nextGeneration, trimmed, mode);
                } catch (RejectedExecutionException e) {
                    fail(pipeline, new StoreUnavailableException("Search scheduler rejected debounce", e));
                }
            }
        }

        release(superseded);

        if (trimmed.isEmpty()) {
            synchronized (lock) {
                if (generation.get() == nextGeneration) {
                    notify(listener, l -> l.onCandidates(nextGeneration, List.of()));
                    notify(listener, l -> l.onComplete(nextGeneration));
                }
            }
        }
        return nextGeneration;
    }

    /**
     * 진행 중인 파이프라인을 버리고 IDLE로 돌아간다.
     */
    public void cancel() {
        Pipeline cancelled;
        synchronized (lock) {
            cancelled = detachCurrent();
            phase = SearchPhase.IDLE;
        }
        release(cancelled);
    }

    /**
     * 해당 세대가 아직 진행 중일 때만 취소 (클라이언트 연결 종료 등)
     */
    public void cancel(long targetGeneration) {
        Pipeline cancelled = null;
        synchronized (lock) {
            if (current != null && current.generation == targetGeneration) {
                cancelled = detachCurrent();
                phase = SearchPhase.IDLE;
            }
        }
        release(cancelled);
    }

    @Override
    public void close() {
        synchronized (lock) {
            closed = true;
        }
        cancel();
    }

    public SearchPhase getPhase() {
        synchronized (lock) {
            return phase;
        }
    }

    public long currentGeneration() {
        return generation.get();
    }

    public boolean isCurrent(long candidateGeneration) {
        return generation.get() == candidateGeneration;
    }

    public UserId getCurrentUserId() {
        return currentUserId;
    }

    private void search(Pipeline pipeline) {
        if (!transition(pipeline, SearchPhase.SEARCHING)) {
            return;
        }

        CompletableFuture<List<UserSummary>> call;
        try {
            call = CompletableFuture.supplyAsync(
                    () -> userDirectory.search(pipeline.query, currentUserId, properties.getSearchResultLimit()),
                    directoryExecutor);
        } catch (RejectedExecutionException e) {
            fail(pipeline, new StoreUnavailableException("Directory search rejected by executor", e));
            return;
        }

        pipeline.directoryCall = call;
        if (pipeline.cancelled) {
            call.cancel(true);
            return;
        }

        call.orTimeout(properties.getDirectoryTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((users, error) -> onDirectoryResult(pipeline, users, error));
    }

    private void onDirectoryResult(Pipeline pipeline, List<UserSummary> users, Throwable error) {
        if (pipeline.cancelled) {
            return;
        }
        if (error != null) {
            fail(pipeline, translate(error));
            return;
        }

        List<UserSummary> candidates = users.stream()
                .filter(user -> !user.getId().equals(currentUserId))
                .collect(Collectors.toList());
        deliver(pipeline, l -> l.onCandidates(pipeline.generation, candidates));

        if (candidates.isEmpty()) {
            finish(pipeline);
            return;
        }
        if (!transition(pipeline, SearchPhase.RESOLVING)) {
            return;
        }

        Map<UserId, UserSummary> candidatesById = new LinkedHashMap<>();
        candidates.forEach(candidate -> candidatesById.putIfAbsent(candidate.getId(), candidate));

        ResolutionHandle handle = statusResolver.resolve(
                currentUserId,
                candidatesById.keySet(),
                properties.getConcurrencyLimit(),
                (candidateId, status) -> deliver(pipeline, l -> l.onResult(
                        new SearchResult(pipeline.generation, candidatesById.get(candidateId), status))));

        pipeline.handle = handle;
        if (pipeline.cancelled) {
            handle.cancel();
            return;
        }
        handle.completion().thenRun(() -> {
            if (!handle.isCancelled()) {
                finish(pipeline);
            }
        });
    }

    private RelationshipException translate(Throwable error) {
        Throwable cause = error;
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RelationshipException) {
            return (RelationshipException) cause;
        }
        if (cause instanceof TimeoutException) {
            return new StoreTimeoutException("Directory search", properties.getDirectoryTimeout());
        }
        if (cause instanceof CancellationException) {
            return new StoreUnavailableException("Directory search cancelled", cause);
        }
        return new StoreUnavailableException("Directory search failed: " + cause.getMessage(), cause);
    }

    private boolean transition(Pipeline pipeline, SearchPhase next) {
        synchronized (lock) {
            if (current != pipeline || pipeline.cancelled) {
                return false;
            }
            log.debug("검색 단계 전환: currentUserId={}, generation={}, {} -> {}",
                    currentUserId, pipeline.generation, phase, next);
            phase = next;
            return true;
        }
    }

    private void deliver(Pipeline pipeline, Consumer<SearchListener> event) {
        synchronized (lock) {
            if (current != pipeline || pipeline.cancelled) {
                return;
            }
            notify(pipeline.listener, event);
        }
    }

    private void finish(Pipeline pipeline) {
        synchronized (lock) {
            if (current != pipeline || pipeline.cancelled) {
                return;
            }
            current = null;
            phase = SearchPhase.IDLE;
            log.debug("검색 완료: currentUserId={}, generation={}", currentUserId, pipeline.generation);
            notify(pipeline.listener, l -> l.onComplete(pipeline.generation));
        }
    }

    private void fail(Pipeline pipeline, RelationshipException error) {
        synchronized (lock) {
            if (current != pipeline || pipeline.cancelled) {
                return;
            }
            current = null;
            phase = SearchPhase.IDLE;
            log.warn("사용자 검색 실패: currentUserId={}, generation={}, error={}",
                    currentUserId, pipeline.generation, error.getMessage());
            notify(pipeline.listener, l -> l.onError(pipeline.generation, error));
        }
    }

    private Pipeline detachCurrent() {
        Pipeline detached = current;
        current = null;
        if (detached != null) {
            detached.cancelled = true;
        }
        return detached;
    }

    /**
     * 잠금 밖에서 호출해야 한다 (조회 배치의 전달 잠금과 순서가 엇갈리지 않도록)
     */
    private void release(Pipeline pipeline) {
        if (pipeline == null) {
            return;
        }
        ScheduledFuture<?> debounce = pipeline.debounce;
        if (debounce != null) {
            debounce.cancel(false);
        }
        CompletableFuture<List<UserSummary>> directoryCall = pipeline.directoryCall;
        if (directoryCall != null) {
            directoryCall.cancel(true);
        }
        ResolutionHandle handle = pipeline.handle;
        if (handle != null) {
            handle.cancel();
        }
        log.debug("이전 검색 파이프라인 폐기: currentUserId={}, generation={}", currentUserId, pipeline.generation);
        notify(pipeline.listener, l -> l.onSuperseded(pipeline.generation));
    }

    private void notify(SearchListener listener, Consumer<SearchListener> event) {
        try {
            event.accept(listener);
        } catch (RuntimeException e) {
            log.warn("검색 이벤트 처리 실패: currentUserId={}, error={}", currentUserId, e.getMessage());
        }
    }

    private Duration debounceFor(SearchMode mode) {
        return mode == SearchMode.FIELD_CHECK
                ? properties.getFieldCheckDebounce()
                : properties.getSearchDebounce();
    }

    private static final class Pipeline {

        private final long generation;
        private final String query;
        private final SearchListener listener;

        private volatile boolean cancelled;
        private volatile ScheduledFuture<?> debounce;
        private volatile CompletableFuture<List<UserSummary>> directoryCall;
        private volatile ResolutionHandle handle;

        private Pipeline(long generation, String query, SearchListener listener) {
            this.generation = generation;
            this.query = query;
            this.listener = listener;
        }
    }
}
