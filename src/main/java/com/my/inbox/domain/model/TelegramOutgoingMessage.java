package com.my.inbox.domain.model;

import java.util.Objects;

/**
 * 왜: 텔레그램 전송 메시지 계약을 고정하고 API 길이 제한을 넘지 않도록 하기 위함.
 */
public record TelegramOutgoingMessage(long chatId, String text) {

    public static final int MAX_TEXT_LENGTH = 4096;

    public TelegramOutgoingMessage {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            throw new IllegalArgumentException("text는 비어 있을 수 없습니다.");
        }
        if (text.length() > MAX_TEXT_LENGTH) {
            text = text.substring(0, MAX_TEXT_LENGTH);
        }
    }
}
