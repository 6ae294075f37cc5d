package com.my.inbox.domain.model;

import java.util.Objects;

/**
 * 왜: 텔레그램 업데이트 중 수집에 필요한 필드만 추려 HTTP DTO와 도메인 매핑 로직을 분리하기 위함.
 *
 * <p>{@code photo}는 가장 큰 해상도 하나만 담는다. 날짜 필드는 epoch 초이며 0은 값 없음.
 */
public record TelegramIncomingMessage(long updateId,
                                      long chatId,
                                      String chatType,
                                      long messageId,
                                      Sender from,
                                      String text,
                                      String caption,
                                      Attachment photo,
                                      Attachment video,
                                      Attachment document,
                                      ForwardOrigin forwardOrigin,
                                      long date,
                                      long editDate,
                                      long forwardDate) {

    public TelegramIncomingMessage {
        Objects.requireNonNull(chatType, "chatType");
    }

    public boolean isPrivateChat() {
        return "private".equals(chatType);
    }

    public record Sender(long id, String username, String firstName, String lastName) {

        public String displayName() {
            if (username != null && !username.isBlank()) {
                return username;
            }
            String first = firstName == null ? "" : firstName;
            String last = lastName == null ? "" : lastName;
            return (first + " " + last).trim();
        }
    }

    public record Attachment(String fileId, String fileName, String mimeType) {

        public Attachment {
            Objects.requireNonNull(fileId, "fileId");
        }
    }

    public record ForwardOrigin(String chatType,
                                long chatId,
                                String username,
                                String title,
                                String firstName,
                                String lastName,
                                long messageId) {
    }
}
