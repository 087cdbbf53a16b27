package com.unisync.social.relationship.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.unisync.social.relationship.dto.BatchStatusRequest;
import com.unisync.social.relationship.dto.SendFriendRequestRequest;
import com.unisync.social.relationship.exception.InvalidTransitionException;
import com.unisync.social.relationship.exception.StoreUnavailableException;
import com.unisync.social.relationship.model.FriendRequest;
import com.unisync.social.relationship.model.FriendRequestState;
import com.unisync.social.relationship.model.PendingRequests;
import com.unisync.social.relationship.model.RelationshipStatus;
import com.unisync.social.relationship.model.UserId;
import com.unisync.social.relationship.service.MutationResult;
import com.unisync.social.relationship.service.RelationshipGraphFacade;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * RelationshipController 단위 테스트
 *
 * API Gateway가 추가하는 X-Cognito-Sub 헤더를 직접 설정해 호출한다.
 */
@WebMvcTest(RelationshipController.class)
@DisplayName("RelationshipController 단위 테스트")
class RelationshipControllerTest {

    private static final String ALICE_SUB = "alice-sub";
    private static final String BOB_SUB = "bob-sub";
    private static final UserId ALICE = UserId.of(ALICE_SUB);
    private static final UserId BOB = UserId.of(BOB_SUB);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private RelationshipGraphFacade relationshipGraphFacade;

    @Test
    @DisplayName("관계 상태 조회 성공")
    void getStatus_Success() throws Exception {
        // given
        given(relationshipGraphFacade.checkStatus(ALICE, BOB)).willReturn(RelationshipStatus.incomingRequest(7L));

        // when & then
        mockMvc.perform(get("/v1/relationships/{otherUserId}/status", BOB_SUB)
                        .header("X-Cognito-Sub", ALICE_SUB))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(BOB_SUB))
                .andExpect(jsonPath("$.status").value("INCOMING_REQUEST"))
                .andExpect(jsonPath("$.requestId").value(7));
    }

    @Test
    @DisplayName("관계 상태 조회 - 저장소 장애 시 503")
    void getStatus_StoreUnavailable() throws Exception {
        // given
        given(relationshipGraphFacade.checkStatus(ALICE, BOB))
                .willThrow(new StoreUnavailableException("getStatus failed", null));

        // when & then
        mockMvc.perform(get("/v1/relationships/{otherUserId}/status", BOB_SUB)
                        .header("X-Cognito-Sub", ALICE_SUB))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("STORE_UNAVAILABLE"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("X-Cognito-Sub 헤더 누락 - 401")
    void missingHeader_Unauthorized() throws Exception {
        mockMvc.perform(get("/v1/relationships/{otherUserId}/status", BOB_SUB))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("MISSING_HEADER"));
    }

    @Test
    @DisplayName("친구 요청 발송 성공 - 201과 보낸 요청 상태")
    void sendRequest_Success() throws Exception {
        // given
        given(relationshipGraphFacade.sendRequest(ALICE, BOB))
                .willReturn(MutationResult.success(RelationshipStatus.outgoingRequest(12L)));
        SendFriendRequestRequest request = SendFriendRequestRequest.builder()
                .targetUserId(BOB_SUB)
                .build();

        // when & then
        mockMvc.perform(post("/v1/relationships/requests")
                        .header("X-Cognito-Sub", ALICE_SUB)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.verified").value(true))
                .andExpect(jsonPath("$.relationship.status").value("OUTGOING_REQUEST"))
                .andExpect(jsonPath("$.relationship.requestId").value(12))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    @DisplayName("친구 요청 발송 - 대상 누락 시 400")
    void sendRequest_ValidationFailure() throws Exception {
        mockMvc.perform(post("/v1/relationships/requests")
                        .header("X-Cognito-Sub", ALICE_SUB)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetUserId\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.targetUserId").exists());
    }

    @Test
    @DisplayName("받은 요청이 있는데 발송 - 409와 수락할 요청 ID, 현재 상태")
    void sendRequest_IncomingExists_Conflict() throws Exception {
        // given
        given(relationshipGraphFacade.sendRequest(ALICE, BOB)).willReturn(MutationResult.failure(
                InvalidTransitionException.incomingRequestExists(9L), RelationshipStatus.incomingRequest(9L), true));
        SendFriendRequestRequest request = SendFriendRequestRequest.builder()
                .targetUserId(BOB_SUB)
                .build();

        // when & then
        mockMvc.perform(post("/v1/relationships/requests")
                        .header("X-Cognito-Sub", ALICE_SUB)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.errorCode").value("INVALID_TRANSITION"))
                .andExpect(jsonPath("$.error.requestId").value(9))
                .andExpect(jsonPath("$.error.retryable").value(false))
                .andExpect(jsonPath("$.relationship.status").value("INCOMING_REQUEST"));
    }

    @Test
    @DisplayName("보낸 요청 취소 - 상대가 먼저 수락했으면 FRIENDS")
    void cancelRequest_AlreadyAccepted() throws Exception {
        // given
        given(relationshipGraphFacade.cancelRequest(ALICE, BOB, 12L))
                .willReturn(MutationResult.success(RelationshipStatus.friends()));

        // when & then
        mockMvc.perform(post("/v1/relationships/{otherUserId}/requests/{requestId}/cancel", BOB_SUB, 12L)
                        .header("X-Cognito-Sub", ALICE_SUB))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.relationship.status").value("FRIENDS"))
                .andExpect(jsonPath("$.relationship.requestId").doesNotExist());
    }

    @Test
    @DisplayName("받은 요청 수락 성공")
    void acceptRequest_Success() throws Exception {
        // given
        given(relationshipGraphFacade.acceptRequest(BOB, ALICE, 12L))
                .willReturn(MutationResult.success(RelationshipStatus.friends()));

        // when & then
        mockMvc.perform(post("/v1/relationships/{otherUserId}/requests/{requestId}/accept", ALICE_SUB, 12L)
                        .header("X-Cognito-Sub", BOB_SUB))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.relationship.userId").value(ALICE_SUB))
                .andExpect(jsonPath("$.relationship.status").value("FRIENDS"));
    }

    @Test
    @DisplayName("받은 요청 거절 - 저장소 장애, 재조회도 실패하면 503과 verified=false")
    void rejectRequest_StoreUnavailable() throws Exception {
        // given
        given(relationshipGraphFacade.rejectRequest(BOB, ALICE, 12L)).willReturn(MutationResult.failure(
                new StoreUnavailableException("rejectRequest failed", null), RelationshipStatus.incomingRequest(12L), false));

        // when & then
        mockMvc.perform(post("/v1/relationships/{otherUserId}/requests/{requestId}/reject", ALICE_SUB, 12L)
                        .header("X-Cognito-Sub", BOB_SUB))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.verified").value(false))
                .andExpect(jsonPath("$.error.retryable").value(true))
                .andExpect(jsonPath("$.relationship.status").value("INCOMING_REQUEST"));
    }

    @Test
    @DisplayName("친구 삭제 성공")
    void removeFriend_Success() throws Exception {
        // given
        given(relationshipGraphFacade.removeFriend(ALICE, BOB))
                .willReturn(MutationResult.success(RelationshipStatus.none()));

        // when & then
        mockMvc.perform(delete("/v1/relationships/{otherUserId}/friendship", BOB_SUB)
                        .header("X-Cognito-Sub", ALICE_SUB))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.relationship.status").value("NONE"));
    }

    @Test
    @DisplayName("대기 중인 친구 요청 목록 조회")
    void getPendingRequests() throws Exception {
        // given
        FriendRequest incoming = FriendRequest.builder()
                .id(3L)
                .fromUserId(BOB)
                .toUserId(ALICE)
                .state(FriendRequestState.PENDING)
                .createdAt(LocalDateTime.now())
                .build();
        given(relationshipGraphFacade.listPendingRequests(ALICE))
                .willReturn(PendingRequests.of(List.of(incoming), List.of()));

        // when & then
        mockMvc.perform(get("/v1/relationships/requests/pending")
                        .header("X-Cognito-Sub", ALICE_SUB))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.incoming.length()").value(1))
                .andExpect(jsonPath("$.incoming[0].requestId").value(3))
                .andExpect(jsonPath("$.incoming[0].fromUserId").value(BOB_SUB))
                .andExpect(jsonPath("$.outgoing").isEmpty());
    }

    @Test
    @DisplayName("친구 목록 조회")
    void getFriends() throws Exception {
        // given
        given(relationshipGraphFacade.listFriends(ALICE)).willReturn(List.of(BOB));

        // when & then
        mockMvc.perform(get("/v1/relationships/friends")
                        .header("X-Cognito-Sub", ALICE_SUB))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.friendIds[0]").value(BOB_SUB))
                .andExpect(jsonPath("$.count").value(1));
    }

    @Test
    @DisplayName("관계 상태 일괄 조회 - 본인은 제외")
    void getStatuses() throws Exception {
        // given
        Map<UserId, RelationshipStatus> statuses = new LinkedHashMap<>();
        statuses.put(BOB, RelationshipStatus.friends());
        given(relationshipGraphFacade.checkStatuses(eq(ALICE), anyCollection())).willReturn(statuses);
        BatchStatusRequest request = BatchStatusRequest.builder()
                .userIds(List.of(BOB_SUB, ALICE_SUB))
                .build();

        // when & then
        mockMvc.perform(post("/v1/relationships/statuses")
                        .header("X-Cognito-Sub", ALICE_SUB)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.statuses.length()").value(1))
                .andExpect(jsonPath("$.statuses[0].userId").value(BOB_SUB))
                .andExpect(jsonPath("$.statuses[0].status").value("FRIENDS"));
    }
}
