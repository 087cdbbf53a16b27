package com.unisync.social.relationship.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.unisync.social.relationship.exception.RelationshipException;
import com.unisync.social.relationship.model.UserSummary;
import com.unisync.social.relationship.search.SearchResult;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 검색 스트림(SSE) 이벤트 데이터
 *
 * 클라이언트는 가장 최근에 받은 generation보다 오래된 이벤트를 무시해야 한다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "검색 스트림 이벤트")
public class SearchEvent {

    @Schema(description = "검색 세대 번호", example = "3")
    private long generation;

    @Schema(description = "candidates 이벤트: 디렉터리 검색 결과")
    private List<UserSummaryResponse> candidates;

    @Schema(description = "result 이벤트: 후보 사용자")
    private UserSummaryResponse user;

    @Schema(description = "result 이벤트: 관계 상태")
    private RelationshipStatusResponse relationship;

    @Schema(description = "error 이벤트: 오류 종류", example = "TIMEOUT")
    private String errorCode;

    @Schema(description = "error 이벤트: 오류 메시지")
    private String message;

    @Schema(description = "error 이벤트: 재시도 가능 여부")
    private Boolean retryable;

    public static SearchEvent candidates(long generation, List<UserSummary> users) {
        return SearchEvent.builder()
                .generation(generation)
                .candidates(users.stream().map(UserSummaryResponse::from).collect(Collectors.toList()))
                .build();
    }

    public static SearchEvent result(SearchResult result) {
        return SearchEvent.builder()
                .generation(result.getGeneration())
                .user(UserSummaryResponse.from(result.getCandidate()))
                .relationship(RelationshipStatusResponse.from(result.getUserId(), result.getStatus()))
                .build();
    }

    public static SearchEvent complete(long generation) {
        return SearchEvent.builder()
                .generation(generation)
                .build();
    }

    public static SearchEvent error(long generation, RelationshipException error) {
        return SearchEvent.builder()
                .generation(generation)
                .errorCode(error.getErrorType().name())
                .message(error.getMessage())
                .retryable(error.isRetryable())
                .build();
    }
}
