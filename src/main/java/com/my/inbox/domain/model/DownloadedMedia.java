package com.my.inbox.domain.model;

import java.util.Base64;
import java.util.Objects;

/**
 * 왜: 한 작업 동안만 쓰이는 첨부 바이트를 파일명과 함께 묶어 저장 단계와 AI 단계가 공유하도록 하기 위함.
 */
public record DownloadedMedia(byte[] bytes, String fileName, boolean image) {

    public DownloadedMedia {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(fileName, "fileName");
    }

    public String base64() {
        return Base64.getEncoder().encodeToString(bytes);
    }

    public int size() {
        return bytes.length;
    }
}
