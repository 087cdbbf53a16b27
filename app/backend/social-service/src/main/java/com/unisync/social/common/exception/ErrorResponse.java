package com.unisync.social.common.exception;

import com.unisync.social.relationship.exception.RelationshipException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 공통 에러 응답 본문
 */
@Getter
@AllArgsConstructor
public class ErrorResponse {
    private final String errorCode;
    private final String message;
    private final LocalDateTime timestamp;

    public ErrorResponse(String errorCode, String message) {
        this(errorCode, message, LocalDateTime.now());
    }

    /**
     * 관계 엔진 예외의 오류 종류를 에러 코드로 사용
     */
    public static ErrorResponse from(RelationshipException e) {
        return new ErrorResponse(e.getErrorType().name(), e.getMessage());
    }
}
