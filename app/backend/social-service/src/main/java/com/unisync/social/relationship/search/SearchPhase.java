package com.unisync.social.relationship.search;

/**
 * 검색 파이프라인 단계
 * IDLE -> DEBOUNCING -> SEARCHING -> RESOLVING -> IDLE
 */
public enum SearchPhase {
    IDLE,
    DEBOUNCING,
    SEARCHING,
    RESOLVING
}
