package com.unisync.social.relationship.store;

import com.unisync.social.common.entity.User;
import com.unisync.social.common.repository.UserRepository;
import com.unisync.social.relationship.model.UserId;
import com.unisync.social.relationship.model.UserSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * users 테이블 기반 사용자 디렉터리
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaUserDirectory implements UserDirectory {

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public List<UserSummary> search(String query, UserId excludingUserId, int limit) {
        List<User> users = userRepository.searchActive(
                escapeLike(query), excludingUserId.getValue(), PageRequest.of(0, limit));
        log.debug("사용자 검색: query={}, excluding={}, results={}", query, excludingUserId, users.size());

        return users.stream()
                .map(user -> UserSummary.builder()
                        .id(UserId.of(user.getCognitoSub()))
                        .username(user.getUsername())
                        .displayName(user.getDisplayName())
                        .build())
                .collect(Collectors.toList());
    }

    static String escapeLike(String query) {
        return query.replace("!", "!!")
                .replace("%", "!%")
                .replace("_", "!_");
    }
}
