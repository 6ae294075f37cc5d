package com.my.inbox.domain.service;

import com.my.inbox.domain.exception.GitSyncException;
import com.my.inbox.domain.model.PublishResult;
import com.my.inbox.domain.model.PullResult;
import com.my.inbox.domain.port.in.SyncVaultUseCase;
import com.my.inbox.domain.port.out.ClockPort;
import com.my.inbox.domain.port.out.VersionControlPort;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Semaphore;

/**
 * 왜: vault 작업 트리를 변경하는 git 명령이 동시에 두 벌 실행되지 않도록 pull 과 commit/push 를 직렬화하기 위함.
 *
 * <p>이미 다른 작업이 실행 중이면 기다리지 않고 건너뛴다. 건너뛴 커밋 대상은 {@link PendingPublishSet}에 남는다.
 */
public class GitSyncService implements SyncVaultUseCase {

    private static final Logger log = Logger.getLogger(GitSyncService.class);

    public static final String STASH_MARKER_PREFIX = "vault-inbox-autostash";

    private final VersionControlPort versionControlPort;
    private final Path repositoryRoot;
    private final ClockPort clockPort;
    private final PendingPublishSet pending;
    private final Semaphore permit = new Semaphore(1);

    public GitSyncService(VersionControlPort versionControlPort,
                          Path repositoryRoot,
                          ClockPort clockPort,
                          PendingPublishSet pending) {
        this.versionControlPort = versionControlPort;
        this.repositoryRoot = repositoryRoot.toAbsolutePath().normalize();
        this.clockPort = clockPort;
        this.pending = pending;
    }

    @Override
    public PullResult pull() {
        if (!permit.tryAcquire()) {
            log.warn("[Git] 다른 작업이 진행 중이라 pull 을 건너뜁니다.");
            return PullResult.SKIPPED_BUSY;
        }
        log.info("[Git] 원격 변경 사항을 가져옵니다.");
        try {
            if (versionControlPort.hasUncommittedChanges()) {
                String marker = STASH_MARKER_PREFIX + "-" + clockPort.now().toEpochMilli();
                log.warnf("[Git] pull 전에 로컬 변경을 stash 합니다: %s", marker);
                versionControlPort.stashPush(marker);
            }

            boolean updated = versionControlPort.pull();
            log.info(updated ? "[Git] pull 완료." : "[Git] pull 완료. 변경 사항 없음.");

            restoreStash();
            return updated ? PullResult.UPDATED : PullResult.UP_TO_DATE;
        } catch (RuntimeException e) {
            log.errorf(e, "[Git] pull 실패: %s", e.getMessage());
            return PullResult.FAILED;
        } finally {
            permit.release();
        }
    }

    private void restoreStash() {
        try {
            if (versionControlPort.hasStash(STASH_MARKER_PREFIX)) {
                log.info("[Git] stash 한 변경을 되돌립니다.");
                versionControlPort.stashPop();
                log.info("[Git] stash pop 완료.");
            }
        } catch (RuntimeException e) {
            log.errorf(e, "[Git] pull 이후 stash pop 실패. 수동 복구가 필요할 수 있습니다: %s", e.getMessage());
        }
    }

    @Override
    public PublishResult commitAndPush(List<Path> files, String message) {
        if (!permit.tryAcquire()) {
            pending.addAll(files);
            log.warnf("[Git] 다른 작업이 진행 중이라 commit/push 를 건너뜁니다. 보류 파일 %d 개", pending.size());
            return PublishResult.SKIPPED_BUSY;
        }
        try {
            return publish(batchWithPending(files), message);
        } finally {
            permit.release();
        }
    }

    @Override
    public void flushPending() {
        if (pending.isEmpty()) {
            return;
        }
        if (!permit.tryAcquire()) {
            log.debug("[Git] 다른 작업이 진행 중이라 보류 파일 게시를 미룹니다.");
            return;
        }
        try {
            Set<Path> batch = batchWithPending(List.of());
            publish(batch, "Sync pending notes (" + batch.size() + " files)");
        } catch (GitSyncException e) {
            log.warnf("[Git] 보류 파일 게시 실패: %s", e.getMessage());
        } finally {
            permit.release();
        }
    }

    /**
     * 디스크에서 사라진 보류 파일은 빠진다.
     */
    private Set<Path> batchWithPending(List<Path> files) {
        Set<Path> batch = new LinkedHashSet<>();
        files.forEach(file -> batch.add(file.toAbsolutePath().normalize()));
        batch.addAll(pending.existing());
        return batch;
    }

    /**
     * 이전 push 가 실패해 커밋만 남아 있으면 stage 할 변경이 없어도 push 한다.
     */
    private PublishResult publish(Set<Path> batch, String message) {
        try {
            boolean staged = false;
            if (!batch.isEmpty()) {
                List<String> relativePaths = batch.stream().map(this::relativize).toList();
                log.infof("[Git] 커밋 대상: %s", relativePaths);
                versionControlPort.add(relativePaths);
                staged = versionControlPort.hasStagedChanges();
            }
            if (staged) {
                log.infof("[Git] 커밋 메시지: \"%s\"", message);
                String commit = versionControlPort.commit(message);
                log.infof("[Git] 커밋 완료: %s", commit);
            } else if (versionControlPort.hasUnpushedCommits()) {
                log.info("[Git] 새 변경은 없지만 push 되지 않은 커밋이 있어 push 합니다.");
            } else {
                log.warn("[Git] stage 된 변경이 없어 commit/push 를 건너뜁니다.");
                pending.removeAll(batch);
                return PublishResult.NOTHING_TO_PUBLISH;
            }

            versionControlPort.push();
            log.info("[Git] push 완료.");
            pending.removeAll(batch);
            return PublishResult.PUBLISHED;
        } catch (RuntimeException e) {
            pending.addAll(batch);
            log.errorf(e, "[Git] commit/push 실패: %s", e.getMessage());
            throw new GitSyncException("Git operation failed: " + e.getMessage(), e);
        }
    }

    private String relativize(Path file) {
        return repositoryRoot.relativize(file).toString().replace('\\', '/');
    }

    @Override
    public boolean isBusy() {
        return permit.availablePermits() == 0;
    }

    @Override
    public int pendingCount() {
        return pending.size();
    }
}
