package com.my.inbox.domain.model;

/**
 * 주기적 pull 한 번의 결과.
 */
public enum PullResult {
    SKIPPED_BUSY,
    UP_TO_DATE,
    UPDATED,
    FAILED
}
