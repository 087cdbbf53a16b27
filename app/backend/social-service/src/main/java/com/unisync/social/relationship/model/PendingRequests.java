package com.unisync.social.relationship.model;

import lombok.Value;

import java.util.List;

/**
 * 대기 중인 친구 요청 목록 (받은 요청 / 보낸 요청, 최신순)
 */
@Value
public class PendingRequests {

    List<FriendRequest> incoming;
    List<FriendRequest> outgoing;

    public static PendingRequests of(List<FriendRequest> incoming, List<FriendRequest> outgoing) {
        return new PendingRequests(List.copyOf(incoming), List.copyOf(outgoing));
    }

    public static PendingRequests empty() {
        return new PendingRequests(List.of(), List.of());
    }
}
