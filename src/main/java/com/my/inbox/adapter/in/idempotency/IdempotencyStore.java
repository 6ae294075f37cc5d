package com.my.inbox.adapter.in.idempotency;

public interface IdempotencyStore {

    boolean isProcessed(String key);

    void markProcessed(String key);
}
