package com.unisync.social.common.repository;

import com.unisync.social.common.entity.User;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByCognitoSub(String cognitoSub);

    /**
     * 사용자명 또는 표시 이름 부분 일치 검색 (대소문자 무시, 활성 사용자만)
     *
     * @param query             LIKE 이스케이프된 검색어 (이스케이프 문자 '!')
     * @param excludedCognitoSub 제외할 사용자
     * @param pageable          결과 수 제한
     * @return 사용자명 오름차순 목록
     */
    @Query("SELECT u FROM User u " +
           "WHERE u.isActive = true AND u.cognitoSub <> :excluded " +
           "AND (LOWER(u.username) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '!' " +
           "OR LOWER(u.displayName) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '!') " +
           "ORDER BY u.username ASC")
    List<User> searchActive(@Param("query") String query,
                            @Param("excluded") String excludedCognitoSub,
                            Pageable pageable);
}
