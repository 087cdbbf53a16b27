package com.unisync.social.relationship;

import com.unisync.social.common.entity.User;
import com.unisync.social.common.repository.UserRepository;
import com.unisync.social.relationship.exception.RelationshipException;
import com.unisync.social.relationship.model.RelationshipStatus;
import com.unisync.social.relationship.model.UserId;
import com.unisync.social.relationship.model.UserSummary;
import com.unisync.social.relationship.search.SearchCoordinator;
import com.unisync.social.relationship.search.SearchListener;
import com.unisync.social.relationship.search.SearchResult;
import com.unisync.social.relationship.search.SearchSessionRegistry;
import com.unisync.social.relationship.service.MutationResult;
import com.unisync.social.relationship.service.RelationshipGraphFacade;
import com.unisync.social.relationship.store.GuardedRelationshipStore;
import com.unisync.social.relationship.store.RelationshipStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 관계 엔진 통합 테스트 (H2, 실제 스레드 풀)
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("관계 엔진 통합 테스트")
class RelationshipEngineIntegrationTest {

    @Autowired
    private RelationshipGraphFacade relationshipGraphFacade;

    @Autowired
    private SearchSessionRegistry searchSessionRegistry;

    @Autowired
    private RelationshipStore relationshipStore;

    @Autowired
    private UserRepository userRepository;

    @Test
    @DisplayName("엔진에 주입되는 저장소는 제한 시간이 적용된 저장소")
    void relationshipStore_IsGuarded() {
        assertThat(relationshipStore).isInstanceOf(GuardedRelationshipStore.class);
    }

    @Test
    @DisplayName("요청 → 수락 → 삭제 → 재요청 - 저장소 기준 상태와 새 요청 ID")
    void relationshipLifecycle() {
        UserId alice = UserId.of("it-alice");
        UserId bob = UserId.of("it-bob");

        MutationResult sent = relationshipGraphFacade.sendRequest(alice, bob);
        assertThat(sent.isSuccess()).isTrue();
        Long firstRequestId = sent.getStatus().getRequestId();
        assertThat(relationshipGraphFacade.sendRequest(alice, bob).getStatus())
                .isEqualTo(RelationshipStatus.outgoingRequest(firstRequestId));

        assertThat(relationshipGraphFacade.checkStatus(bob, alice))
                .isEqualTo(RelationshipStatus.incomingRequest(firstRequestId));

        MutationResult accepted = relationshipGraphFacade.acceptRequest(bob, alice, firstRequestId);
        assertThat(accepted.getStatus()).isEqualTo(RelationshipStatus.friends());

        MutationResult lateCancel = relationshipGraphFacade.cancelRequest(alice, bob, firstRequestId);
        assertThat(lateCancel.isSuccess()).isTrue();
        assertThat(lateCancel.getStatus()).isEqualTo(RelationshipStatus.friends());

        MutationResult removed = relationshipGraphFacade.removeFriend(alice, bob);
        assertThat(removed.getStatus()).isEqualTo(RelationshipStatus.none());

        MutationResult resent = relationshipGraphFacade.sendRequest(alice, bob);
        assertThat(resent.getStatus().getRequestId()).isNotNull().isNotEqualTo(firstRequestId);
    }

    @Test
    @DisplayName("검색 세션 - 디렉터리 결과마다 관계 상태 전달")
    void searchSession_ResolvesStatuses() throws Exception {
        // given
        UserId me = UserId.of("it-searcher");
        userRepository.save(User.builder().cognitoSub("it-searcher").username("searcher").displayName("Searcher").build());
        userRepository.save(User.builder().cognitoSub("it-zed-1").username("zedkim").displayName("Zed Kim").build());
        userRepository.save(User.builder().cognitoSub("it-zed-2").username("zedlee").displayName("Zed Lee").build());
        relationshipGraphFacade.sendRequest(me, UserId.of("it-zed-1"));

        Map<UserId, RelationshipStatus> results = new ConcurrentHashMap<>();
        CountDownLatch done = new CountDownLatch(1);
        AtomicInteger candidateCount = new AtomicInteger(-1);
        SearchCoordinator coordinator = searchSessionRegistry.acquire(me);

        // when
        coordinator.submit("ZED", new SearchListener() {
            @Override
            public void onResult(SearchResult result) {
                results.put(result.getUserId(), result.getStatus());
            }

            @Override
            public void onComplete(long generation) {
                done.countDown();
            }

            @Override
            public void onError(long generation, RelationshipException error) {
                done.countDown();
            }

            @Override
            public void onCandidates(long generation, List<UserSummary> candidates) {
                candidateCount.set(candidates.size());
            }
        });

        // then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(candidateCount.get()).isEqualTo(2);
        assertThat(results).hasSize(2);
        assertThat(results.get(UserId.of("it-zed-1")).is(RelationshipStatus.Kind.OUTGOING_REQUEST)).isTrue();
        assertThat(results.get(UserId.of("it-zed-2"))).isEqualTo(RelationshipStatus.none());

        searchSessionRegistry.release(me, coordinator);
        assertThat(searchSessionRegistry.activeSessions()).isZero();
    }
}
