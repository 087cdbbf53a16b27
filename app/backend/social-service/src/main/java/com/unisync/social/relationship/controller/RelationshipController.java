package com.unisync.social.relationship.controller;

import com.unisync.social.common.exception.GlobalExceptionHandler;
import com.unisync.social.relationship.dto.BatchStatusRequest;
import com.unisync.social.relationship.dto.BatchStatusResponse;
import com.unisync.social.relationship.dto.FriendListResponse;
import com.unisync.social.relationship.dto.MutationResponse;
import com.unisync.social.relationship.dto.PendingRequestsResponse;
import com.unisync.social.relationship.dto.RelationshipStatusResponse;
import com.unisync.social.relationship.dto.SendFriendRequestRequest;
import com.unisync.social.relationship.model.RelationshipStatus;
import com.unisync.social.relationship.model.UserId;
import com.unisync.social.relationship.service.MutationResult;
import com.unisync.social.relationship.service.RelationshipGraphFacade;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/v1/relationships")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "관계 API", description = "친구 요청 발송/취소/수락/거절, 친구 삭제, 관계 상태 조회")
public class RelationshipController {

    private final RelationshipGraphFacade relationshipGraphFacade;

    @GetMapping("/{otherUserId}/status")
    @Operation(summary = "관계 상태 조회", description = "상대방과의 현재 관계 상태를 조회합니다")
    public ResponseEntity<RelationshipStatusResponse> getStatus(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @PathVariable String otherUserId
    ) {
        UserId other = UserId.of(otherUserId);
        RelationshipStatus status = relationshipGraphFacade.checkStatus(UserId.of(cognitoSub), other);
        return ResponseEntity.ok(RelationshipStatusResponse.from(other, status));
    }

    @PostMapping("/statuses")
    @Operation(summary = "관계 상태 일괄 조회", description = "여러 사용자와의 관계 상태를 한 번에 조회합니다. 조회에 실패한 사용자는 NONE으로 표시됩니다")
    public ResponseEntity<BatchStatusResponse> getStatuses(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @Valid @RequestBody BatchStatusRequest request
    ) {
        UserId current = UserId.of(cognitoSub);
        List<UserId> candidates = request.getUserIds().stream()
                .map(UserId::of)
                .filter(candidate -> !candidate.equals(current))
                .collect(Collectors.toList());
        log.info("관계 상태 일괄 조회: candidates={}", candidates.size());

        Map<UserId, RelationshipStatus> statuses = relationshipGraphFacade.checkStatuses(current, candidates);
        List<RelationshipStatusResponse> body = statuses.entrySet().stream()
                .map(entry -> RelationshipStatusResponse.from(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
        return ResponseEntity.ok(new BatchStatusResponse(body));
    }

    @PostMapping("/requests")
    @Operation(summary = "친구 요청 발송", description = "이미 보낸 요청이 있으면 새로 만들지 않고 기존 요청 상태를 반환합니다")
    public ResponseEntity<MutationResponse> sendRequest(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @Valid @RequestBody SendFriendRequestRequest request
    ) {
        log.info("친구 요청 발송: targetUserId={}", request.getTargetUserId());
        UserId other = UserId.of(request.getTargetUserId());
        MutationResult result = relationshipGraphFacade.sendRequest(UserId.of(cognitoSub), other);
        return respond(other, result, HttpStatus.CREATED);
    }

    @PostMapping("/{otherUserId}/requests/{requestId}/cancel")
    @Operation(summary = "보낸 친구 요청 취소", description = "상대방이 먼저 수락했다면 FRIENDS 상태가 반환됩니다")
    public ResponseEntity<MutationResponse> cancelRequest(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @PathVariable String otherUserId,
            @PathVariable Long requestId
    ) {
        log.info("친구 요청 취소: otherUserId={}, requestId={}", otherUserId, requestId);
        UserId other = UserId.of(otherUserId);
        return respond(other, relationshipGraphFacade.cancelRequest(UserId.of(cognitoSub), other, requestId), HttpStatus.OK);
    }

    @PostMapping("/{otherUserId}/requests/{requestId}/accept")
    @Operation(summary = "받은 친구 요청 수락", description = "요청자가 먼저 취소했다면 NONE 상태가 반환됩니다")
    public ResponseEntity<MutationResponse> acceptRequest(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @PathVariable String otherUserId,
            @PathVariable Long requestId
    ) {
        log.info("친구 요청 수락: otherUserId={}, requestId={}", otherUserId, requestId);
        UserId other = UserId.of(otherUserId);
        return respond(other, relationshipGraphFacade.acceptRequest(UserId.of(cognitoSub), other, requestId), HttpStatus.OK);
    }

    @PostMapping("/{otherUserId}/requests/{requestId}/reject")
    @Operation(summary = "받은 친구 요청 거절")
    public ResponseEntity<MutationResponse> rejectRequest(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @PathVariable String otherUserId,
            @PathVariable Long requestId
    ) {
        log.info("친구 요청 거절: otherUserId={}, requestId={}", otherUserId, requestId);
        UserId other = UserId.of(otherUserId);
        return respond(other, relationshipGraphFacade.rejectRequest(UserId.of(cognitoSub), other, requestId), HttpStatus.OK);
    }

    @DeleteMapping("/{otherUserId}/friendship")
    @Operation(summary = "친구 삭제", description = "친구 관계가 이미 없으면 NONE 상태를 반환합니다")
    public ResponseEntity<MutationResponse> removeFriend(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @PathVariable String otherUserId
    ) {
        log.info("친구 삭제: otherUserId={}", otherUserId);
        UserId other = UserId.of(otherUserId);
        return respond(other, relationshipGraphFacade.removeFriend(UserId.of(cognitoSub), other), HttpStatus.OK);
    }

    @GetMapping("/requests/pending")
    @Operation(summary = "대기 중인 친구 요청 목록", description = "받은 요청과 보낸 요청을 최신순으로 조회합니다")
    public ResponseEntity<PendingRequestsResponse> getPendingRequests(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub
    ) {
        log.info("대기 중인 친구 요청 목록 조회");
        return ResponseEntity.ok(PendingRequestsResponse.from(
                relationshipGraphFacade.listPendingRequests(UserId.of(cognitoSub))));
    }

    @GetMapping("/friends")
    @Operation(summary = "친구 목록 조회")
    public ResponseEntity<FriendListResponse> getFriends(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub
    ) {
        log.info("친구 목록 조회");
        return ResponseEntity.ok(FriendListResponse.from(relationshipGraphFacade.listFriends(UserId.of(cognitoSub))));
    }

    private ResponseEntity<MutationResponse> respond(UserId other, MutationResult result, HttpStatus successStatus) {
        HttpStatus status = result.isSuccess()
                ? successStatus
                : GlobalExceptionHandler.statusOf(result.getError().getType());
        return ResponseEntity.status(status).body(MutationResponse.from(other, result));
    }
}
