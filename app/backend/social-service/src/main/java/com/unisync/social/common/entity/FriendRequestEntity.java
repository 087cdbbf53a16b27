package com.unisync.social.common.entity;

import com.unisync.social.relationship.model.FriendRequestState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 친구 요청
 *
 * pendingPairKey는 PENDING 상태일 때만 값을 가지며 유니크 제약이 걸려 있어
 * 한 쌍(방향 무관)에 대기 요청이 둘 이상 생기지 않는다.
 */
@Entity
@Table(
    name = "friend_requests",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_friend_request_pending_pair",
        columnNames = {"pending_pair_key"}
    ),
    indexes = {
        @Index(name = "idx_friend_request_from", columnList = "from_user_id, state"),
        @Index(name = "idx_friend_request_to", columnList = "to_user_id, state")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FriendRequestEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 요청자 (Cognito Sub)
     */
    @Column(name = "from_user_id", nullable = false, length = 255)
    private String fromUserId;

    /**
     * 수신자 (Cognito Sub)
     */
    @Column(name = "to_user_id", nullable = false, length = 255)
    private String toUserId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private FriendRequestState state = FriendRequestState.PENDING;

    @Column(name = "pending_pair_key", length = 520)
    private String pendingPairKey;

    @Column(name = "responded_at")
    private LocalDateTime respondedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 종료 상태로 전이. 이후 pendingPairKey를 비워 같은 쌍의 새 요청을 허용한다.
     */
    public void close(FriendRequestState terminalState) {
        if (!terminalState.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminalState);
        }
        if (state.isTerminal()) {
            throw new IllegalStateException("Friend request already closed: " + id);
        }
        this.state = terminalState;
        this.pendingPairKey = null;
        this.respondedAt = LocalDateTime.now();
    }

    /**
     * 자기 자신에게 친구 요청 불가
     */
    @PrePersist
    @PreUpdate
    private void validateUserIds() {
        if (fromUserId != null && fromUserId.equals(toUserId)) {
            throw new IllegalArgumentException("Cannot create friend request to yourself");
        }
    }
}
