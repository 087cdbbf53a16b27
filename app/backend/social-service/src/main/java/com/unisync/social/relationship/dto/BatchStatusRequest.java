package com.unisync.social.relationship.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 여러 사용자와의 관계 상태 일괄 조회
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "관계 상태 일괄 조회")
public class BatchStatusRequest {

    @NotEmpty(message = "조회할 사용자 ID 목록은 필수입니다")
    @Size(max = 100, message = "한 번에 최대 100명까지 조회할 수 있습니다")
    @Schema(description = "조회할 사용자 ID 목록")
    private List<@NotBlank String> userIds;
}
