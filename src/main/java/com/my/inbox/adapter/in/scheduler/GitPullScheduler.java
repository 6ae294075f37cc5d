package com.my.inbox.adapter.in.scheduler;

import com.my.inbox.config.AppConfig;
import com.my.inbox.domain.model.PullResult;
import com.my.inbox.domain.port.in.SyncVaultUseCase;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 다른 기기에서 vault 에 반영된 변경을 주기적으로 가져오고, 보류된 파일을 그 뒤에 게시하기 위함.
 */
@Startup
@ApplicationScoped
public class GitPullScheduler {

    private static final Logger log = Logger.getLogger(GitPullScheduler.class);

    private final SyncVaultUseCase syncVaultUseCase;
    private final long initialDelayMs;
    private final long intervalMs;
    private final ScheduledExecutorService executor;
    private ScheduledFuture<?> initialPull;
    private ScheduledFuture<?> periodicPull;

    @Inject
    public GitPullScheduler(SyncVaultUseCase syncVaultUseCase, AppConfig appConfig) {
        this(syncVaultUseCase, appConfig.git().initialDelayMs(), appConfig.git().pullIntervalMs());
    }

    GitPullScheduler(SyncVaultUseCase syncVaultUseCase, long initialDelayMs, long intervalMs) {
        this.syncVaultUseCase = syncVaultUseCase;
        this.initialDelayMs = initialDelayMs;
        this.intervalMs = intervalMs;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "vault-inbox-git-pull");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    synchronized void start() {
        if (periodicPull != null) {
            log.warn("[Git] 주기적 pull 이 이미 실행 중입니다.");
            return;
        }
        if (intervalMs <= 0) {
            log.info("[Git] 주기적 pull 이 꺼져 있습니다 (pull-interval-ms 가 0).");
            return;
        }
        log.infof("[Git] %d 초마다 pull 을 시작합니다.", intervalMs / 1000);
        initialPull = executor.schedule(this::pullSafely, initialDelayMs, TimeUnit.MILLISECONDS);
        periodicPull = executor.scheduleWithFixedDelay(this::pullSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    void pullSafely() {
        try {
            PullResult result = syncVaultUseCase.pull();
            log.debugf("[Git] pull 결과: %s", result);
            if (result != PullResult.SKIPPED_BUSY) {
                syncVaultUseCase.flushPending();
            }
        } catch (Exception e) {
            log.errorf(e, "[Git] 주기적 pull 중 예외: %s", e.getMessage());
        }
    }

    public synchronized boolean isRunning() {
        return periodicPull != null;
    }

    @PreDestroy
    synchronized void stop() {
        if (periodicPull != null) {
            log.info("[Git] 주기적 pull 을 중지합니다.");
            periodicPull.cancel(false);
            initialPull.cancel(false);
            periodicPull = null;
            initialPull = null;
        }
        executor.shutdownNow();
    }
}
