package com.unisync.social.relationship.dto;

import com.unisync.social.relationship.model.FriendRequest;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 대기 중인 친구 요청
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "대기 중인 친구 요청")
public class FriendRequestResponse {

    @Schema(description = "친구 요청 ID", example = "1")
    private Long requestId;

    @Schema(description = "요청 보낸 사용자 ID")
    private String fromUserId;

    @Schema(description = "요청 받은 사용자 ID")
    private String toUserId;

    @Schema(description = "요청 일시", example = "2025-11-22T10:00:00")
    private LocalDateTime createdAt;

    public static FriendRequestResponse from(FriendRequest request) {
        return FriendRequestResponse.builder()
                .requestId(request.getId())
                .fromUserId(request.getFromUserId().getValue())
                .toUserId(request.getToUserId().getValue())
                .createdAt(request.getCreatedAt())
                .build();
    }
}
