package com.unisync.social.common.repository;

import com.unisync.social.common.entity.FriendRequestEntity;
import com.unisync.social.relationship.model.FriendRequestState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FriendRequestRepository extends JpaRepository<FriendRequestEntity, Long> {

    /**
     * 한 쌍의 대기 중인 요청 조회 (방향 무관)
     *
     * @param pendingPairKey 정규화된 쌍 키
     * @return 대기 요청
     */
    Optional<FriendRequestEntity> findByPendingPairKey(String pendingPairKey);

    /**
     * 받은 요청 목록 (최신순)
     */
    List<FriendRequestEntity> findByToUserIdAndStateOrderByCreatedAtDesc(String toUserId, FriendRequestState state);

    /**
     * 보낸 요청 목록 (최신순)
     */
    List<FriendRequestEntity> findByFromUserIdAndStateOrderByCreatedAtDesc(String fromUserId, FriendRequestState state);

    /**
     * 상태 변경을 위한 잠금 조회
     * 수락과 취소가 동시에 들어와도 한쪽만 PENDING을 관찰한다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM FriendRequestEntity r WHERE r.id = :id")
    Optional<FriendRequestEntity> findByIdForUpdate(@Param("id") Long id);
}
