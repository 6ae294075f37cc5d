package com.my.inbox.domain.service;

import com.my.inbox.domain.exception.GitSyncException;
import com.my.inbox.domain.model.PublishResult;
import com.my.inbox.domain.model.PullResult;
import com.my.inbox.domain.port.out.VersionControlPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class GitSyncServiceTest {

    @TempDir
    Path vault;

    private VersionControlPort git;
    private PendingPublishSet pending;
    private GitSyncService service;

    @BeforeEach
    void setUp() {
        git = mock(VersionControlPort.class);
        pending = new PendingPublishSet();
        service = new GitSyncService(git, vault, () -> Instant.ofEpochMilli(1_700_000_000_000L), pending);
    }

    @Test
    void commitAndPush_stages_relative_paths_then_commits_and_pushes() throws Exception {
        Path note = write("Inbox/Daily Log.md");
        Path asset = write("assets/1-a.png");
        when(git.hasStagedChanges()).thenReturn(true);
        when(git.commit("Add note: Daily Log")).thenReturn("abc123");

        PublishResult result = service.commitAndPush(List.of(note, asset), "Add note: Daily Log");

        assertThat(result).isEqualTo(PublishResult.PUBLISHED);
        InOrder order = inOrder(git);
        order.verify(git).add(List.of("Inbox/Daily Log.md", "assets/1-a.png"));
        order.verify(git).commit("Add note: Daily Log");
        order.verify(git).push();
        assertThat(service.pendingCount()).isZero();
        assertThat(service.isBusy()).isFalse();
    }

    @Test
    void commitAndPush_skips_commit_when_nothing_is_staged() throws Exception {
        Path note = write("Inbox/Same.md");
        when(git.hasStagedChanges()).thenReturn(false);

        PublishResult result = service.commitAndPush(List.of(note), "Add note: Same");

        assertThat(result).isEqualTo(PublishResult.NOTHING_TO_PUBLISH);
        verify(git, never()).commit(anyString());
        verify(git, never()).push();
        assertThat(service.pendingCount()).isZero();
    }

    @Test
    void failed_push_keeps_files_pending_and_retries_them_with_next_commit() throws Exception {
        Path first = write("Inbox/First.md");
        Path second = write("Inbox/Second.md");
        when(git.hasStagedChanges()).thenReturn(true);
        doThrow(new IllegalStateException("rejected")).doNothing().when(git).push();

        GitSyncException thrown = assertThrows(GitSyncException.class,
                () -> service.commitAndPush(List.of(first), "Add note: First"));
        assertThat(thrown.getMessage()).isEqualTo("Git operation failed: rejected");
        assertThat(service.pendingCount()).isEqualTo(1);

        service.commitAndPush(List.of(second), "Add note: Second");

        verify(git).add(List.of("Inbox/Second.md", "Inbox/First.md"));
        assertThat(service.pendingCount()).isZero();
    }

    @Test
    void commit_left_unpushed_is_pushed_by_the_next_flush() throws Exception {
        Path note = write("Inbox/Offline.md");
        when(git.hasStagedChanges()).thenReturn(true, false);
        doThrow(new IllegalStateException("Could not read from remote repository")).doNothing().when(git).push();

        assertThrows(GitSyncException.class, () -> service.commitAndPush(List.of(note), "Add note: Offline"));
        assertThat(service.pendingCount()).isEqualTo(1);

        when(git.hasUnpushedCommits()).thenReturn(true);
        service.flushPending();

        verify(git, times(1)).commit(anyString());
        verify(git, times(2)).push();
        assertThat(service.pendingCount()).isZero();
    }

    @Test
    void failed_retry_push_keeps_files_pending() throws Exception {
        pending.addAll(List.of(write("Inbox/Offline.md")));
        when(git.hasStagedChanges()).thenReturn(false);
        when(git.hasUnpushedCommits()).thenReturn(true);
        doThrow(new IllegalStateException("Could not read from remote repository")).when(git).push();

        service.flushPending();

        assertThat(service.pendingCount()).isEqualTo(1);
    }

    @Test
    void flush_message_counts_only_files_still_on_disk() throws Exception {
        Path kept = write("Inbox/Kept.md");
        Path gone = write("Inbox/Gone.md");
        pending.addAll(List.of(kept, gone));
        Files.delete(gone);
        when(git.hasStagedChanges()).thenReturn(true);

        service.flushPending();

        verify(git).add(List.of("Inbox/Kept.md"));
        verify(git).commit("Sync pending notes (1 files)");
    }

    @Test
    void commitAndPush_is_skipped_while_pull_is_running() throws Exception {
        Path note = write("Inbox/Busy.md");
        CountDownLatch pullStarted = new CountDownLatch(1);
        CountDownLatch releasePull = new CountDownLatch(1);
        when(git.hasUncommittedChanges()).thenReturn(false);
        when(git.pull()).thenAnswer(invocation -> {
            pullStarted.countDown();
            releasePull.await(5, TimeUnit.SECONDS);
            return false;
        });

        CompletableFuture<PullResult> pull = CompletableFuture.supplyAsync(service::pull);
        assertThat(pullStarted.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(service.isBusy()).isTrue();
        assertThat(service.commitAndPush(List.of(note), "Add note: Busy")).isEqualTo(PublishResult.SKIPPED_BUSY);
        assertThat(service.pull()).isEqualTo(PullResult.SKIPPED_BUSY);

        releasePull.countDown();
        assertThat(pull.get(5, TimeUnit.SECONDS)).isEqualTo(PullResult.UP_TO_DATE);
        verify(git, never()).add(anyList());
        assertThat(service.pendingCount()).isEqualTo(1);

        when(git.hasStagedChanges()).thenReturn(true);
        service.flushPending();

        verify(git).add(List.of("Inbox/Busy.md"));
        verify(git).commit("Sync pending notes (1 files)");
        assertThat(service.pendingCount()).isZero();
    }

    @Test
    void pull_stashes_local_changes_and_restores_them() {
        when(git.hasUncommittedChanges()).thenReturn(true);
        when(git.pull()).thenReturn(true);
        when(git.hasStash(GitSyncService.STASH_MARKER_PREFIX)).thenReturn(true);

        assertThat(service.pull()).isEqualTo(PullResult.UPDATED);

        InOrder order = inOrder(git);
        order.verify(git).stashPush("vault-inbox-autostash-1700000000000");
        order.verify(git).pull();
        order.verify(git).stashPop();
    }

    @Test
    void stash_pop_failure_is_logged_not_thrown() {
        when(git.hasUncommittedChanges()).thenReturn(true);
        when(git.pull()).thenReturn(false);
        when(git.hasStash(anyString())).thenReturn(true);
        doThrow(new IllegalStateException("conflict")).when(git).stashPop();

        assertThat(service.pull()).isEqualTo(PullResult.UP_TO_DATE);
        assertThat(service.isBusy()).isFalse();
    }

    @Test
    void pull_failure_reports_failed_and_releases_guard() {
        when(git.pull()).thenThrow(new IllegalStateException("network down"));

        assertThat(service.pull()).isEqualTo(PullResult.FAILED);
        assertThat(service.isBusy()).isFalse();
        verify(git, never()).stashPop();
    }

    @Test
    void flushPending_swallows_git_errors() throws Exception {
        pending.addAll(List.of(write("Inbox/Left.md")));
        when(git.hasStagedChanges()).thenReturn(true);
        when(git.commit(anyString())).thenThrow(new IllegalStateException("index.lock exists"));

        service.flushPending();

        assertThat(service.pendingCount()).isEqualTo(1);
        verify(git, never()).push();
    }

    @Test
    void flushPending_drops_files_deleted_from_disk() throws Exception {
        Path gone = write("Inbox/Gone.md");
        pending.addAll(List.of(gone));
        Files.delete(gone);

        service.flushPending();

        verify(git, never()).add(anyList());
        assertThat(service.pendingCount()).isZero();
    }

    private Path write(String relative) throws Exception {
        Path file = vault.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, relative);
        return file;
    }
}
