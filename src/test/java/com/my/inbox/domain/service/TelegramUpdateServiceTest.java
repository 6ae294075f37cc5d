package com.my.inbox.domain.service;

import com.my.inbox.domain.model.IngestionTask;
import com.my.inbox.domain.model.MediaKind;
import com.my.inbox.domain.model.TelegramIncomingMessage;
import com.my.inbox.domain.model.TelegramIncomingMessage.Attachment;
import com.my.inbox.domain.model.TelegramIncomingMessage.ForwardOrigin;
import com.my.inbox.domain.model.TelegramIncomingMessage.Sender;
import com.my.inbox.domain.model.TelegramOutgoingMessage;
import com.my.inbox.domain.port.in.EnqueueIngestionUseCase;
import com.my.inbox.domain.port.out.TelegramSendPort;
import com.my.inbox.domain.port.out.TelegramUpdatePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TelegramUpdateServiceTest {

    private static final Sender USER = new Sender(42L, "neo", "Thomas", "Anderson");

    private TelegramUpdatePort updatePort;
    private EnqueueIngestionUseCase enqueue;
    private TelegramSendPort sendPort;
    private TelegramUpdateService service;

    @BeforeEach
    void setUp() {
        updatePort = mock(TelegramUpdatePort.class);
        enqueue = mock(EnqueueIngestionUseCase.class);
        sendPort = mock(TelegramSendPort.class);
        service = new TelegramUpdateService(updatePort, enqueue, sendPort, Set.of(), "@admin");
    }

    @Test
    void fetch_enqueues_and_advances_offset() {
        when(updatePort.fetchUpdates(10L, 30)).thenReturn(List.of(
                message(10L, "private", USER, "first", null, null, null, null),
                message(11L, "private", USER, "second", null, null, null, null)));

        long next = service.fetchAndEnqueue(10L, 30);

        assertThat(next).isEqualTo(12L);
        verify(enqueue, times(2)).enqueue(any());
    }

    @Test
    void group_messages_are_ignored() {
        service.handle(message(1L, "group", USER, "hello", null, null, null, null));

        verifyNoInteractions(enqueue, sendPort);
    }

    @Test
    void unknown_user_gets_access_denied_reply() {
        service = new TelegramUpdateService(updatePort, enqueue, sendPort, Set.of(7L), "@admin");

        service.handle(message(1L, "private", USER, "hello", null, null, null, null));

        verifyNoInteractions(enqueue);
        ArgumentCaptor<TelegramOutgoingMessage> reply = ArgumentCaptor.forClass(TelegramOutgoingMessage.class);
        verify(sendPort).send(reply.capture());
        assertThat(reply.getValue().chatId()).isEqualTo(42L);
        assertThat(reply.getValue().text()).contains("@admin");
    }

    @Test
    void photo_with_caption_becomes_task() {
        IngestionTask task = service.toTask(message(1L, "private", USER, null,
                new Attachment("photo-id", null, null), null, null, null));

        assertThat(task.messageId()).isEqualTo(100L);
        assertThat(task.text()).isEqualTo("caption");
        assertThat(task.media().fileName()).isEqualTo("photo_100.jpg");
        assertThat(task.media().kind()).isEqualTo(MediaKind.PHOTO);
        assertThat(task.userId()).isEqualTo(42L);
        assertThat(task.username()).isEqualTo("neo");
    }

    @Test
    void video_name_uses_mime_subtype() {
        IngestionTask task = service.toTask(message(1L, "private", USER, "clip", null,
                new Attachment("vid", null, "video/quicktime"), null, null));

        assertThat(task.media().fileName()).isEqualTo("video_100_vid.quicktime");
    }

    @Test
    void document_is_skipped_when_text_is_present() {
        IngestionTask task = service.toTask(message(1L, "private", USER, "read this", null, null,
                new Attachment("doc", "report.pdf", "application/pdf"), null));

        assertThat(task.media()).isNull();
        assertThat(task.text()).isEqualTo("read this");
    }

    @Test
    void document_without_text_or_name_gets_default_name() {
        IngestionTask task = service.toTask(message(1L, "private", USER, null, null, null,
                new Attachment("doc", null, "application/pdf"), null));

        assertThat(task.media().fileName()).isEqualTo("document_100");
        assertThat(task.media().kind()).isEqualTo(MediaKind.DOCUMENT);
    }

    @Test
    void image_document_is_kept_even_with_text() {
        IngestionTask task = service.toTask(message(1L, "private", USER, "scan", null, null,
                new Attachment("doc", "scan.png", "image/png"), null));

        assertThat(task.media().fileName()).isEqualTo("scan.png");
        assertThat(task.media().isImage()).isTrue();
    }

    @Test
    void forwarded_channel_post_links_to_original() {
        ForwardOrigin origin = new ForwardOrigin("channel", -100L, "daily", "Daily", null, null, 77L);

        IngestionTask task = service.toTask(message(1L, "private", USER, "news", null, null, null, origin));

        assertThat(task.forwardSourceLink()).isEqualTo("https://t.me/daily/77");
        assertThat(task.messageTimestamp()).isEqualTo(Instant.ofEpochSecond(1_690_000_000L));
    }

    @Test
    void forward_source_for_users_and_groups() {
        assertThat(TelegramUpdateService.resolveForwardSource(
                new ForwardOrigin("private", 9L, null, null, "Trinity", null, 0L)))
                .contains("Forwarded from Trinity (private chat)");
        assertThat(TelegramUpdateService.resolveForwardSource(
                new ForwardOrigin("supergroup", -5L, null, "Zion", null, null, 0L)))
                .contains("Forwarded from group Zion");
        assertThat(TelegramUpdateService.resolveForwardSource(
                new ForwardOrigin("channel", -100L, null, "Private Channel", null, null, 1L)))
                .isEmpty();
    }

    private static TelegramIncomingMessage message(long updateId, String chatType, Sender from, String text,
                                                   Attachment photo, Attachment video, Attachment document,
                                                   ForwardOrigin origin) {
        String caption = photo != null ? "caption" : null;
        long forwardDate = origin != null ? 1_690_000_000L : 0L;
        return new TelegramIncomingMessage(updateId, 42L, chatType, 100L, from, text, caption,
                photo, video, document, origin, 1_700_000_000L, 0L, forwardDate);
    }
}
