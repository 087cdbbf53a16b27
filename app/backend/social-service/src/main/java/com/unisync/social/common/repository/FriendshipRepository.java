package com.unisync.social.common.repository;

import com.unisync.social.common.entity.Friendship;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FriendshipRepository extends JpaRepository<Friendship, Long> {

    /**
     * 정규화된 쌍으로 친구 관계 존재 여부 확인
     */
    boolean existsByUserAAndUserB(String userA, String userB);

    /**
     * 정규화된 쌍의 친구 관계 삭제
     *
     * @return 삭제된 행 수
     */
    long deleteByUserAAndUserB(String userA, String userB);

    /**
     * 사용자의 친구 ID 목록
     *
     * @param userId 사용자 Cognito Sub
     * @return 친구 Cognito Sub 목록
     */
    @Query("SELECT CASE WHEN f.userA = :userId THEN f.userB ELSE f.userA END FROM Friendship f " +
           "WHERE f.userA = :userId OR f.userB = :userId ORDER BY f.createdAt DESC")
    List<String> findFriendIds(@Param("userId") String userId);
}
