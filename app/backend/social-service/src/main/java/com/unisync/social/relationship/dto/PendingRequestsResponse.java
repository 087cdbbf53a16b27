package com.unisync.social.relationship.dto;

import com.unisync.social.relationship.model.PendingRequests;
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
@Schema(description = "받은/보낸 대기 중 친구 요청 목록")
public class PendingRequestsResponse {

    @Schema(description = "받은 요청 (최신순)")
    private List<FriendRequestResponse> incoming;

    @Schema(description = "보낸 요청 (최신순)")
    private List<FriendRequestResponse> outgoing;

    public static PendingRequestsResponse from(PendingRequests pending) {
        return PendingRequestsResponse.builder()
                .incoming(pending.getIncoming().stream().map(FriendRequestResponse::from).collect(Collectors.toList()))
                .outgoing(pending.getOutgoing().stream().map(FriendRequestResponse::from).collect(Collectors.toList()))
                .build();
    }
}
