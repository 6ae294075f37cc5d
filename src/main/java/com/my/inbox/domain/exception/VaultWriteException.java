package com.my.inbox.domain.exception;

/**
 * 왜: vault 파일 기록 실패를 I/O 예외와 분리된 도메인 실패로 전달하기 위함.
 */
public class VaultWriteException extends RuntimeException {
    public VaultWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
