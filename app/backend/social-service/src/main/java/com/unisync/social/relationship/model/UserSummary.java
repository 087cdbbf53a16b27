package com.unisync.social.relationship.model;

import lombok.Builder;
import lombok.Value;

/**
 * 사용자 디렉터리 검색 결과 항목
 */
@Value
@Builder
public class UserSummary {

    UserId id;
    String username;
    String displayName;
}
