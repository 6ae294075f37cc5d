package com.my.inbox.domain.exception;

/**
 * 왜: 첨부 다운로드 실패를 작업 중단 사유로 명확히 표현하기 위함.
 */
public class MediaDownloadException extends RuntimeException {
    public MediaDownloadException(String message) {
        super(message);
    }

    public MediaDownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
