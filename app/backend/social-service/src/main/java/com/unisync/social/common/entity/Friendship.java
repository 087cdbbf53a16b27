package com.unisync.social.common.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 친구 관계 (대칭)
 * 한 쌍당 한 행만 저장하며 userA < userB 순서로 정규화한다.
 */
@Entity
@Table(
    name = "friendships",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_friendship_pair",
        columnNames = {"user_a", "user_b"}
    ),
    indexes = {
        @Index(name = "idx_friendship_user_a", columnList = "user_a"),
        @Index(name = "idx_friendship_user_b", columnList = "user_b")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Friendship {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_a", nullable = false, length = 255)
    private String userA;

    @Column(name = "user_b", nullable = false, length = 255)
    private String userB;

    /**
     * 관계를 성립시킨 친구 요청 ID
     */
    @Column(name = "request_id")
    private Long requestId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static Friendship between(String user1, String user2, Long requestId) {
        boolean ordered = user1.compareTo(user2) < 0;
        return Friendship.builder()
                .userA(ordered ? user1 : user2)
                .userB(ordered ? user2 : user1)
                .requestId(requestId)
                .build();
    }

    @PrePersist
    private void validateUsers() {
        if (userA != null && userA.equals(userB)) {
            throw new IllegalArgumentException("Cannot create friendship with yourself");
        }
    }
}
