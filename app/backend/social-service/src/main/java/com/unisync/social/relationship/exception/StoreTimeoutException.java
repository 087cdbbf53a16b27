package com.unisync.social.relationship.exception;

import java.time.Duration;

/**
 * 저장소 또는 디렉터리 호출이 제한 시간을 넘김 (재시도 가능)
 */
public class StoreTimeoutException extends RelationshipException {

    public StoreTimeoutException(String operation, Duration timeout) {
        super(RelationshipErrorType.TIMEOUT,
                String.format("%s timed out after %d ms", operation, timeout.toMillis()),
                (Throwable) null);
    }
}
