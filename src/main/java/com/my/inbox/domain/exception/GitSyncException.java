package com.my.inbox.domain.exception;

/**
 * 왜: git 커밋/푸시 실패를 처리기까지 올려 사용자에게 알리기 위함.
 */
public class GitSyncException extends RuntimeException {
    public GitSyncException(String message) {
        super(message);
    }

    public GitSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
