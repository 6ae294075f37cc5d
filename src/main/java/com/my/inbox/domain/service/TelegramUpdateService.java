package com.my.inbox.domain.service;

import com.my.inbox.domain.model.IngestionTask;
import com.my.inbox.domain.model.MediaKind;
import com.my.inbox.domain.model.MediaRef;
import com.my.inbox.domain.model.TelegramIncomingMessage;
import com.my.inbox.domain.model.TelegramIncomingMessage.Attachment;
import com.my.inbox.domain.model.TelegramIncomingMessage.ForwardOrigin;
import com.my.inbox.domain.model.TelegramOutgoingMessage;
import com.my.inbox.domain.port.in.EnqueueIngestionUseCase;
import com.my.inbox.domain.port.out.TelegramSendPort;
import com.my.inbox.domain.port.out.TelegramUpdatePort;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 왜: 텔레그램 업데이트 조회와 작업 변환, 큐 투입을 도메인 계층에서 조율해 중복/누락을 방지하기 위함.
 */
public class TelegramUpdateService {

    private static final Logger log = Logger.getLogger(TelegramUpdateService.class);

    private final TelegramUpdatePort telegramUpdatePort;
    private final EnqueueIngestionUseCase enqueueIngestionUseCase;
    private final TelegramSendPort telegramSendPort;
    private final Set<Long> allowedUserIds;
    private final String adminContact;

    /**
     * @param allowedUserIds 비어 있으면 모든 사용자를 허용한다
     */
    public TelegramUpdateService(TelegramUpdatePort telegramUpdatePort,
                                 EnqueueIngestionUseCase enqueueIngestionUseCase,
                                 TelegramSendPort telegramSendPort,
                                 Set<Long> allowedUserIds,
                                 String adminContact) {
        this.telegramUpdatePort = telegramUpdatePort;
        this.enqueueIngestionUseCase = enqueueIngestionUseCase;
        this.telegramSendPort = telegramSendPort;
        this.allowedUserIds = Set.copyOf(allowedUserIds);
        this.adminContact = adminContact;
    }

    public long fetchAndEnqueue(long offset, int timeoutSeconds) {
        List<TelegramIncomingMessage> updates = telegramUpdatePort.fetchUpdates(offset, timeoutSeconds);
        long nextOffset = offset;
        for (TelegramIncomingMessage update : updates) {
            nextOffset = Math.max(nextOffset, update.updateId() + 1);
            handle(update);
        }
        return nextOffset;
    }

    void handle(TelegramIncomingMessage message) {
        log.infof("채팅 %d 에서 메시지 %d 수신", message.chatId(), message.messageId());
        if (!message.isPrivateChat()) {
            log.infof("개인 채팅이 아닌 메시지는 무시합니다: chat=%d type=%s", message.chatId(), message.chatType());
            return;
        }
        Long userId = message.from() == null ? null : message.from().id();
        if (!isAllowed(userId)) {
            log.warnf("허용되지 않은 사용자의 접근: %s", userId);
            if (userId != null) {
                telegramSendPort.send(new TelegramOutgoingMessage(userId,
                        "접근 권한이 없습니다. 관리자(" + adminContact + ")에게 문의해주세요."));
            }
            return;
        }
        enqueueIngestionUseCase.enqueue(toTask(message));
    }

    private boolean isAllowed(Long userId) {
        if (allowedUserIds.isEmpty()) {
            return true;
        }
        return userId != null && allowedUserIds.contains(userId);
    }

    IngestionTask toTask(TelegramIncomingMessage message) {
        String text = message.text() != null ? message.text() : message.caption();
        return new IngestionTask(
                message.chatId(),
                message.messageId(),
                text,
                resolveMedia(message, text).orElse(null),
                resolveForwardSource(message.forwardOrigin()).orElse(null),
                message.from() == null ? null : message.from().id(),
                message.from() == null ? null : message.from().displayName(),
                Instant.ofEpochSecond(messageEpochSeconds(message))
        );
    }

    private Optional<MediaRef> resolveMedia(TelegramIncomingMessage message, String text) {
        long messageId = message.messageId();
        if (message.photo() != null) {
            return Optional.of(new MediaRef(message.photo().fileId(), "photo_" + messageId + ".jpg",
                    null, MediaKind.PHOTO));
        }
        if (message.video() != null) {
            Attachment video = message.video();
            String extension = Optional.ofNullable(video.mimeType())
                    .filter(mime -> mime.contains("/"))
                    .map(mime -> mime.substring(mime.indexOf('/') + 1))
                    .orElse("mp4");
            return Optional.of(new MediaRef(video.fileId(),
                    "video_" + messageId + "_" + video.fileId() + "." + extension,
                    video.mimeType(), MediaKind.VIDEO));
        }
        if (message.document() != null) {
            Attachment document = message.document();
            String mime = document.mimeType();
            boolean visual = mime != null && (mime.startsWith("image/") || mime.startsWith("video/"));
            if (text == null || text.isBlank() || visual) {
                String fileName = document.fileName() != null ? document.fileName() : "document_" + messageId;
                return Optional.of(new MediaRef(document.fileId(), fileName, mime, MediaKind.DOCUMENT));
            }
            log.infof("텍스트가 있어 문서 '%s' 는 저장하지 않습니다.", document.fileName());
        }
        return Optional.empty();
    }

    static Optional<String> resolveForwardSource(ForwardOrigin origin) {
        if (origin == null || origin.chatType() == null) {
            return Optional.empty();
        }
        switch (origin.chatType()) {
            case "channel":
                if (origin.username() != null && !origin.username().isBlank()) {
                    return Optional.of("https://t.me/" + origin.username() + "/" + origin.messageId());
                }
                return Optional.empty();
            case "private":
                String first = origin.firstName() == null ? "" : origin.firstName();
                String last = origin.lastName() == null ? "" : origin.lastName();
                String name = (first + " " + last).trim();
                String handle = origin.username() != null && !origin.username().isBlank()
                        ? "@" + origin.username()
                        : "private chat";
                return Optional.of(("Forwarded from " + name + " (" + handle + ")").trim());
            case "group":
            case "supergroup":
                String title = origin.title() != null ? origin.title() : String.valueOf(origin.chatId());
                return Optional.of("Forwarded from group " + title);
            default:
                return Optional.empty();
        }
    }

    private static long messageEpochSeconds(TelegramIncomingMessage message) {
        if (message.forwardDate() > 0) {
            return message.forwardDate();
        }
        if (message.editDate() > 0) {
            return message.editDate();
        }
        return message.date();
    }
}
