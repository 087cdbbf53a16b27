package com.unisync.social.relationship.dto;

import com.unisync.social.relationship.model.UserId;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "친구 목록")
public class FriendListResponse {

    @Schema(description = "친구 사용자 ID 목록")
    private List<String> friendIds;

    @Schema(description = "친구 수", example = "3")
    private int count;

    public static FriendListResponse from(List<UserId> friends) {
        List<String> ids = friends.stream().map(UserId::getValue).collect(Collectors.toList());
        return FriendListResponse.builder()
                .friendIds(ids)
                .count(ids.size())
                .build();
    }
}
