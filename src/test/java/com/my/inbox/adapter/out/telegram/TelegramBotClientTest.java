package com.my.inbox.adapter.out.telegram;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.inbox.domain.exception.MediaDownloadException;
import com.my.inbox.domain.model.MediaKind;
import com.my.inbox.domain.model.MediaRef;
import com.my.inbox.domain.model.TelegramIncomingMessage;
import com.my.inbox.domain.model.TelegramOutgoingMessage;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class TelegramBotClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void mapsPhotoMessageUsingLargestSize() throws Exception {
        TelegramBotClient.TelegramUpdate update = objectMapper.readValue("""
                {"update_id": 900,
                 "message": {"message_id": 12, "date": 1700000000,
                   "chat": {"id": 5, "type": "private"},
                   "from": {"id": 42, "username": "neo", "first_name": "Thomas"},
                   "caption": "노을",
                   "photo": [{"file_id": "small", "width": 90, "height": 90},
                             {"file_id": "large", "width": 1280, "height": 960}],
                   "unknown_field": true}}
                """, TelegramBotClient.TelegramUpdate.class);

        TelegramIncomingMessage message = TelegramBotClient.mapToDomain(update).orElseThrow();

        assertThat(message.updateId()).isEqualTo(900L);
        assertThat(message.chatId()).isEqualTo(5L);
        assertThat(message.isPrivateChat()).isTrue();
        assertThat(message.caption()).isEqualTo("노을");
        assertThat(message.photo().fileId()).isEqualTo("large");
        assertThat(message.from().displayName()).isEqualTo("neo");
        assertThat(message.date()).isEqualTo(1700000000L);
        assertThat(message.editDate()).isZero();
    }

    @Test
    void mapsForwardedChannelPost() throws Exception {
        TelegramBotClient.TelegramUpdate update = objectMapper.readValue("""
                {"update_id": 1,
                 "message": {"message_id": 3, "date": 1700000100, "forward_date": 1690000000,
                   "chat": {"id": 5, "type": "private"},
                   "text": "news",
                   "forward_from_chat": {"id": -100, "type": "channel", "username": "daily", "title": "Daily"},
                   "forward_from_message_id": 77}}
                """, TelegramBotClient.TelegramUpdate.class);

        TelegramIncomingMessage message = TelegramBotClient.mapToDomain(update).orElseThrow();

        assertThat(message.forwardOrigin().chatType()).isEqualTo("channel");
        assertThat(message.forwardOrigin().username()).isEqualTo("daily");
        assertThat(message.forwardOrigin().messageId()).isEqualTo(77L);
        assertThat(message.forwardDate()).isEqualTo(1690000000L);
    }

    @Test
    void updateWithoutMessageIsDropped() throws Exception {
        TelegramBotClient.TelegramUpdate update = objectMapper.readValue("{\"update_id\": 2}",
                TelegramBotClient.TelegramUpdate.class);

        assertThat(TelegramBotClient.mapToDomain(update)).isEmpty();
    }

    @Test
    void withoutTokenNothingIsCalled() {
        HttpClient httpClient = mock(HttpClient.class);
        TelegramBotClient client = new TelegramBotClient(httpClient, objectMapper, "https://api.telegram.org", "");

        client.send(new TelegramOutgoingMessage(1L, "hi"));
        assertThat(client.fetchUpdates(0, 1)).isEmpty();
        assertThatThrownBy(() -> client.download(new MediaRef("f", "a.jpg", null, MediaKind.PHOTO)))
                .isInstanceOf(MediaDownloadException.class);
        verifyNoInteractions(httpClient);
    }
}
