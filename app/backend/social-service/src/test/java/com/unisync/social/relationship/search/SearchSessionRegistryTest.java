package com.unisync.social.relationship.search;

import com.unisync.social.relationship.model.UserId;
import com.unisync.social.relationship.service.RelationshipGraphFacade;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.*;
import static org.mockito.Mockito.mock;

@ExtendWith(MockitoExtension.class)
@DisplayName("SearchSessionRegistry 단위 테스트")
class SearchSessionRegistryTest {

    private static final UserId ALICE = UserId.of("alice-sub");
    private static final UserId BOB = UserId.of("bob-sub");

    @Mock
    private RelationshipGraphFacade relationshipGraphFacade;

    @InjectMocks
    private SearchSessionRegistry registry;

    @Test
    @DisplayName("같은 사용자는 같은 코디네이터를 공유")
    void acquire_ReusesPerUser() {
        // given
        SearchCoordinator aliceCoordinator = mock(SearchCoordinator.class);
        SearchCoordinator bobCoordinator = mock(SearchCoordinator.class);
        given(relationshipGraphFacade.openSearch(ALICE)).willReturn(aliceCoordinator);
        given(relationshipGraphFacade.openSearch(BOB)).willReturn(bobCoordinator);

        // when & then
        assertThat(registry.acquire(ALICE)).isSameAs(aliceCoordinator);
        assertThat(registry.acquire(ALICE)).isSameAs(aliceCoordinator);
        assertThat(registry.acquire(BOB)).isSameAs(bobCoordinator);
        assertThat(registry.activeSessions()).isEqualTo(2);
        then(relationshipGraphFacade).should(times(1)).openSearch(ALICE);
    }

    @Test
    @DisplayName("마지막 스트림이 반납되면 세션을 닫고 제거")
    void release_LastStream_RemovesSession() {
        // given
        SearchCoordinator coordinator = mock(SearchCoordinator.class);
        given(relationshipGraphFacade.openSearch(ALICE)).willReturn(coordinator);
        registry.acquire(ALICE);
        registry.acquire(ALICE);

        // when
        registry.release(ALICE, coordinator);

        // then
        then(coordinator).should(never()).close();
        assertThat(registry.activeSessions()).isEqualTo(1);

        // when
        registry.release(ALICE, coordinator);

        // then
        then(coordinator).should().close();
        assertThat(registry.activeSessions()).isZero();
    }

    @Test
    @DisplayName("세션 해제 후 다음 스트림은 새 코디네이터 사용")
    void acquire_AfterRelease_OpensNewCoordinator() {
        // given
        SearchCoordinator first = mock(SearchCoordinator.class);
        SearchCoordinator second = mock(SearchCoordinator.class);
        given(relationshipGraphFacade.openSearch(ALICE)).willReturn(first, second);
        registry.acquire(ALICE);
        registry.release(ALICE, first);

        // when
        SearchCoordinator next = registry.acquire(ALICE);

        // then
        assertThat(next).isSameAs(second);
        assertThat(registry.activeSessions()).isEqualTo(1);
    }

    @Test
    @DisplayName("이미 교체된 코디네이터 반납은 새 세션에 영향 없음")
    void release_StaleCoordinator_KeepsNewSession() {
        // given
        SearchCoordinator first = mock(SearchCoordinator.class);
        SearchCoordinator second = mock(SearchCoordinator.class);
        given(relationshipGraphFacade.openSearch(ALICE)).willReturn(first, second);
        registry.acquire(ALICE);
        registry.release(ALICE, first);
        registry.acquire(ALICE);

        // when
        registry.release(ALICE, first);

        // then
        then(second).should(never()).close();
        assertThat(registry.activeSessions()).isEqualTo(1);
    }

    @Test
    @DisplayName("종료 시 모든 세션 닫기")
    void closeAll() {
        // given
        SearchCoordinator coordinator = mock(SearchCoordinator.class);
        given(relationshipGraphFacade.openSearch(ALICE)).willReturn(coordinator);
        registry.acquire(ALICE);

        // when
        registry.closeAll();

        // then
        then(coordinator).should().close();
        assertThat(registry.activeSessions()).isZero();
    }
}
