package com.my.inbox.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 수신 메시지를 큐에 넣기 전에 불변 작업 단위로 고정해 처리 단계 전체가 같은 데이터를 보도록 하기 위함.
 *
 * <p>{@code text}, {@code media}, {@code forwardSourceLink}, {@code userId}, {@code username}은 없을 수 있다.
 */
public record IngestionTask(long chatId,
                            long messageId,
                            String text,
                            MediaRef media,
                            String forwardSourceLink,
                            Long userId,
                            String username,
                            Instant messageTimestamp) {

    public IngestionTask {
        Objects.requireNonNull(messageTimestamp, "messageTimestamp");
    }

    public Optional<String> textContent() {
        return Optional.ofNullable(text).filter(value -> !value.isBlank());
    }

    public Optional<MediaRef> mediaRef() {
        return Optional.ofNullable(media);
    }

    public boolean hasContent() {
        return textContent().isPresent() || media != null;
    }

    public IngestionTask redacted() {
        return new IngestionTask(chatId, messageId, text, media == null ? null : media.redacted(),
                forwardSourceLink, userId, username, messageTimestamp);
    }
}
