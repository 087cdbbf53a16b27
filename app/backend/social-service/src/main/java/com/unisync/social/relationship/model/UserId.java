package com.unisync.social.relationship.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

/**
 * 사용자 식별자 (Cognito Sub)
 * 동등성 비교만 정의하며 순서 의미는 없음
 */
@EqualsAndHashCode
public final class UserId {

    private final String value;

    private UserId(String value) {
        this.value = value;
    }

    @JsonCreator
    public static UserId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("User id must not be blank");
        }
        return new UserId(value.trim());
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
