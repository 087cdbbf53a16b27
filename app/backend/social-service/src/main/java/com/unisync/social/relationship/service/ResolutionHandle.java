package com.unisync.social.relationship.service;

import java.util.concurrent.CompletableFuture;

/**
 * 진행 중인 상태 조회 배치의 취소 핸들
 */
public interface ResolutionHandle {

    /**
     * 새 조회를 중단하고, 반환 이후에는 이 배치의 어떤 결과도 전달하지 않는다.
     */
    void cancel();

    boolean isCancelled();

    /**
     * 배치가 모두 끝나거나 취소되면 완료되는 Future
     */
    CompletableFuture<Void> completion();
}
