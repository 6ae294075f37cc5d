package com.my.inbox.domain.model;

/**
 * commit/push 한 번의 결과.
 */
public enum PublishResult {
    PUBLISHED,
    NOTHING_TO_PUBLISH,
    SKIPPED_BUSY
}
