package com.unisync.social.relationship.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "관계 상태 일괄 조회 결과 (조회 실패한 사용자는 NONE)")
public class BatchStatusResponse {

    private List<RelationshipStatusResponse> statuses;
}
