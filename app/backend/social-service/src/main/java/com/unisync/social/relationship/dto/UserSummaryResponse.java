package com.unisync.social.relationship.dto;

import com.unisync.social.relationship.model.UserSummary;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "사용자 요약 정보")
public class UserSummaryResponse {

    @Schema(description = "사용자 ID (Cognito Sub)")
    private String userId;

    @Schema(description = "사용자명", example = "2021101234")
    private String username;

    @Schema(description = "표시 이름", example = "홍길동")
    private String displayName;

    public static UserSummaryResponse from(UserSummary user) {
        return UserSummaryResponse.builder()
                .userId(user.getId().getValue())
                .username(user.getUsername())
                .displayName(user.getDisplayName())
                .build();
    }
}
