package com.my.inbox.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * 왜: AI 결과든 대체값이든 노트 제목과 해시태그를 같은 계약으로 다루기 위함.
 */
public record NoteMetadata(String title, List<String> hashtags) {

    public NoteMetadata {
        Objects.requireNonNull(title, "title");
        if (title.isBlank()) {
            throw new IllegalArgumentException("노트 제목은 비어 있을 수 없습니다.");
        }
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
    }

    public static NoteMetadata fallback(long messageId) {
        return new NoteMetadata("Uncategorized Note - " + messageId, List.of("#uncategorized", "#ai-error"));
    }
}
