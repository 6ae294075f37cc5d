package com.my.inbox.domain.model;

import java.util.Objects;

/**
 * 왜: 다운로드 전의 첨부 파일 참조만 보관하여 큐에 바이트를 싣지 않기 위함.
 */
public record MediaRef(String remoteFileId, String fileName, String mimeType, MediaKind kind) {

    public MediaRef {
        Objects.requireNonNull(remoteFileId, "remoteFileId");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(kind, "kind");
        if (remoteFileId.isBlank()) {
            throw new IllegalArgumentException("remoteFileId는 비어 있을 수 없습니다.");
        }
    }

    public boolean isImage() {
        return kind == MediaKind.PHOTO || (mimeType != null && mimeType.startsWith("image/"));
    }

    /**
     * 로그용 사본. 원격 파일 ID는 가린다.
     */
    public MediaRef redacted() {
        return new MediaRef("REDACTED", fileName, mimeType, kind);
    }
}
