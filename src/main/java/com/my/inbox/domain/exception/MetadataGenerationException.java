package com.my.inbox.domain.exception;

/**
 * 왜: LLM 결과가 비었거나 형식이 맞지 않을 때 재시도 및 대체값 분기의 기준으로 삼기 위함.
 */
public class MetadataGenerationException extends RuntimeException {
    public MetadataGenerationException(String message) {
        super(message);
    }

    public MetadataGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
