package com.my.inbox.adapter.in.telegram;

import com.my.inbox.domain.service.TelegramUpdateService;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class TelegramUpdatePollerTest {

    private final TelegramUpdateService telegramUpdateService = mock(TelegramUpdateService.class);

    @Test
    void missing_token_does_not_start_polling() {
        TelegramUpdatePoller poller = new TelegramUpdatePoller(telegramUpdateService, 1, 30, false);

        poller.start();

        assertThat(poller.isRunning()).isFalse();
        poller.stop();
        verifyNoInteractions(telegramUpdateService);
    }

    @Test
    void offset_advances_after_each_successful_poll() {
        when(telegramUpdateService.fetchAndEnqueue(0L, 30)).thenReturn(101L);
        when(telegramUpdateService.fetchAndEnqueue(101L, 30)).thenReturn(101L);
        TelegramUpdatePoller poller = new TelegramUpdatePoller(telegramUpdateService, 1, 30, true);

        assertThat(poller.pollOnce()).isEqualTo(1);
        assertThat(poller.pollOnce()).isEqualTo(1);

        assertThat(poller.offset()).isEqualTo(101L);
        verify(telegramUpdateService).fetchAndEnqueue(0L, 30);
        verify(telegramUpdateService).fetchAndEnqueue(101L, 30);
        poller.stop();
    }

    @Test
    void consecutive_failures_back_off_until_cap_and_reset_on_success() {
        when(telegramUpdateService.fetchAndEnqueue(anyLong(), anyInt()))
                .thenThrow(new IllegalStateException("502 Bad Gateway"))
                .thenThrow(new IllegalStateException("502 Bad Gateway"))
                .thenThrow(new IllegalStateException("502 Bad Gateway"))
                .thenReturn(7L);
        TelegramUpdatePoller poller = new TelegramUpdatePoller(telegramUpdateService, 1, 30, true);

        assertThat(poller.pollOnce()).isEqualTo(2);
        assertThat(poller.pollOnce()).isEqualTo(4);
        assertThat(poller.pollOnce()).isEqualTo(8);
        assertThat(poller.offset()).isZero();

        assertThat(poller.pollOnce()).isEqualTo(1);
        assertThat(poller.offset()).isEqualTo(7L);
        poller.stop();
    }

    @Test
    void backoff_is_capped() {
        TelegramUpdatePoller poller = new TelegramUpdatePoller(telegramUpdateService, 1, 30, true);

        assertThat(poller.backoffSeconds(6)).isEqualTo(TelegramUpdatePoller.MAX_BACKOFF_SECONDS);
        assertThat(poller.backoffSeconds(1_000)).isEqualTo(TelegramUpdatePoller.MAX_BACKOFF_SECONDS);
        poller.stop();
    }

    @Test
    void started_poller_keeps_polling_until_stopped() {
        when(telegramUpdateService.fetchAndEnqueue(anyLong(), anyInt())).thenReturn(1L);
        TelegramUpdatePoller poller = new TelegramUpdatePoller(telegramUpdateService, 0, 0, true);

        poller.start();
        poller.start();

        try {
            assertThat(poller.isRunning()).isTrue();
            verify(telegramUpdateService, timeout(2000).atLeast(2)).fetchAndEnqueue(anyLong(), anyInt());
        } finally {
            poller.stop();
        }
        assertThat(poller.isRunning()).isFalse();
    }
}
