package com.unisync.social.relationship.dto;

import com.unisync.social.relationship.model.RelationshipStatus;
import com.unisync.social.relationship.model.UserId;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 관계 상태 응답
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "상대방과의 관계 상태")
public class RelationshipStatusResponse {

    @Schema(description = "상대방 사용자 ID", example = "b2c3d4e5-f6a7-8901-bcde-f12345678901")
    private String userId;

    @Schema(description = "관계 상태", example = "OUTGOING_REQUEST",
            allowableValues = {"NONE", "OUTGOING_REQUEST", "INCOMING_REQUEST", "FRIENDS"})
    private String status;

    @Schema(description = "대기 중인 친구 요청 ID (요청 상태일 때만)", example = "12")
    private Long requestId;

    public static RelationshipStatusResponse from(UserId userId, RelationshipStatus status) {
        return RelationshipStatusResponse.builder()
                .userId(userId.getValue())
                .status(status.getKind().name())
                .requestId(status.getRequestId())
                .build();
    }
}
