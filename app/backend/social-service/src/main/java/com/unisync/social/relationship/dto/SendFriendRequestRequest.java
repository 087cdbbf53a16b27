package com.unisync.social.relationship.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 친구 요청 발송
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "친구 요청 발송")
public class SendFriendRequestRequest {

    @NotBlank(message = "대상 사용자 ID는 필수입니다")
    @Schema(description = "친구 요청을 받을 사용자 Cognito Sub", example = "a1b2c3d4-e5f6-7890-abcd-ef1234567890", requiredMode = Schema.RequiredMode.REQUIRED)
    private String targetUserId;
}
