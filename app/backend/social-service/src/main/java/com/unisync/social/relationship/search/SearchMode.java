package com.unisync.social.relationship.search;

/**
 * 검색 디바운스 종류
 */
public enum SearchMode {
    /**
     * 일반 검색창 입력 (기본 300ms)
     */
    GENERAL,

    /**
     * 단일 입력 필드 확인 (기본 500ms)
     */
    FIELD_CHECK
}
