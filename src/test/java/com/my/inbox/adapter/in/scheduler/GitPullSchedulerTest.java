package com.my.inbox.adapter.in.scheduler;

import com.my.inbox.domain.model.PullResult;
import com.my.inbox.domain.port.in.SyncVaultUseCase;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class GitPullSchedulerTest {

    private final SyncVaultUseCase syncVaultUseCase = mock(SyncVaultUseCase.class);

    @Test
    void zero_interval_disables_periodic_pull() {
        GitPullScheduler scheduler = new GitPullScheduler(syncVaultUseCase, 0, 0);

        scheduler.start();

        assertThat(scheduler.isRunning()).isFalse();
        scheduler.stop();
        verifyNoInteractions(syncVaultUseCase);
    }

    @Test
    void pulls_after_initial_delay_and_flushes_pending() {
        when(syncVaultUseCase.pull()).thenReturn(PullResult.UP_TO_DATE);
        GitPullScheduler scheduler = new GitPullScheduler(syncVaultUseCase, 10, 60_000);

        scheduler.start();
        scheduler.start();

        try {
            assertThat(scheduler.isRunning()).isTrue();
            verify(syncVaultUseCase, timeout(2000)).flushPending();
            InOrder order = inOrder(syncVaultUseCase);
            order.verify(syncVaultUseCase).pull();
            order.verify(syncVaultUseCase).flushPending();
        } finally {
            scheduler.stop();
        }
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    void skipped_pull_does_not_flush() {
        when(syncVaultUseCase.pull()).thenReturn(PullResult.SKIPPED_BUSY);
        GitPullScheduler scheduler = new GitPullScheduler(syncVaultUseCase, 0, 60_000);

        scheduler.pullSafely();

        verify(syncVaultUseCase).pull();
        verify(syncVaultUseCase, never()).flushPending();
        scheduler.stop();
    }

    @Test
    void pull_exception_is_contained() {
        when(syncVaultUseCase.pull()).thenThrow(new IllegalStateException("boom"));
        GitPullScheduler scheduler = new GitPullScheduler(syncVaultUseCase, 0, 60_000);

        scheduler.pullSafely();

        verify(syncVaultUseCase, never()).flushPending();
        scheduler.stop();
    }
}
