package com.unisync.social.relationship.dto;

import com.unisync.social.relationship.model.UserId;
import com.unisync.social.relationship.service.MutationResult;
import com.unisync.social.relationship.service.RelationshipError;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 관계 변경 결과
 *
 * 실패한 경우에도 relationship에는 변경 시도 후 다시 조회한 상태가 담긴다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "관계 변경 결과")
public class MutationResponse {

    @Schema(description = "성공 여부", example = "true")
    private boolean success;

    @Schema(description = "변경 후 관계 상태")
    private RelationshipStatusResponse relationship;

    @Schema(description = "관계 상태가 저장소에서 확인된 값인지 여부", example = "true")
    private boolean verified;

    @Schema(description = "실패 정보 (성공 시 null)")
    private ErrorDetail error;

    public static MutationResponse from(UserId otherUserId, MutationResult result) {
        return MutationResponse.builder()
                .success(result.isSuccess())
                .relationship(RelationshipStatusResponse.from(otherUserId, result.getStatus()))
                .verified(result.isVerified())
                .error(result.isSuccess() ? null : ErrorDetail.from(result.getError()))
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "관계 변경 실패 정보")
    public static class ErrorDetail {

        @Schema(description = "오류 종류", example = "INVALID_TRANSITION")
        private String errorCode;

        @Schema(description = "오류 메시지")
        private String message;

        @Schema(description = "재시도 가능 여부", example = "false")
        private boolean retryable;

        @Schema(description = "후속 조치에 사용할 친구 요청 ID", example = "12")
        private Long requestId;

        public static ErrorDetail from(RelationshipError error) {
            return ErrorDetail.builder()
                    .errorCode(error.getType().name())
                    .message(error.getMessage())
                    .retryable(error.isRetryable())
                    .requestId(error.getRequestId())
                    .build();
        }
    }
}
