package com.my.inbox.adapter.in.telegram;

import com.my.inbox.config.AppConfig;
import com.my.inbox.domain.service.TelegramUpdateService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 왜: long polling 으로 받은 업데이트를 수집 큐로 넘기고, 텔레그램 장애 중에는 요청 간격을 늘려 재시도하기 위함.
 *
 * <p>한 번의 조회가 끝나야 다음 조회를 예약한다. 연속 실패 시 대기 시간은 두 배씩 늘어나며 {@link #MAX_BACKOFF_SECONDS}에서 멈춘다.
 */
@Startup
@ApplicationScoped
public class TelegramUpdatePoller {

    private static final Logger log = Logger.getLogger(TelegramUpdatePoller.class);

    static final long MAX_BACKOFF_SECONDS = 60;

    private final TelegramUpdateService telegramUpdateService;
    private final long intervalSeconds;
    private final int timeoutSeconds;
    private final boolean enabled;
    private final ScheduledExecutorService executor;
    private volatile boolean running;
    private long offset;
    private int consecutiveFailures;

    @Inject
    public TelegramUpdatePoller(TelegramUpdateService telegramUpdateService, AppConfig appConfig) {
        this(telegramUpdateService,
                appConfig.telegram().pollIntervalSeconds(),
                appConfig.telegram().pollTimeoutSeconds(),
                appConfig.telegram().botToken().filter(token -> !token.isBlank()).isPresent());
    }

    TelegramUpdatePoller(TelegramUpdateService telegramUpdateService,
                         long intervalSeconds,
                         int timeoutSeconds,
                         boolean enabled) {
        this.telegramUpdateService = telegramUpdateService;
        this.intervalSeconds = Math.max(intervalSeconds, 0);
        this.timeoutSeconds = timeoutSeconds;
        this.enabled = enabled;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "vault-inbox-telegram-poll");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    synchronized void start() {
        if (!enabled) {
            log.warn("[Telegram] 봇 토큰이 없어 업데이트 폴링을 시작하지 않습니다.");
            return;
        }
        if (running) {
            log.warn("[Telegram] 업데이트 폴링이 이미 실행 중입니다.");
            return;
        }
        running = true;
        log.infof("[Telegram] 업데이트 폴링 시작 (timeout %d 초)", timeoutSeconds);
        executor.execute(this::pollAndReschedule);
    }

    private void pollAndReschedule() {
        if (!running) {
            return;
        }
        long delay = pollOnce();
        if (running && !executor.isShutdown()) {
            executor.schedule(this::pollAndReschedule, delay, TimeUnit.SECONDS);
        }
    }

    /**
     * @return 다음 조회까지 기다릴 초
     */
    long pollOnce() {
        try {
            long next = telegramUpdateService.fetchAndEnqueue(offset, timeoutSeconds);
            if (consecutiveFailures > 0) {
                log.infof("[Telegram] 폴링 복구 (연속 실패 %d 회 후)", consecutiveFailures);
            }
            offset = next;
            consecutiveFailures = 0;
            return intervalSeconds;
        } catch (Exception e) {
            consecutiveFailures++;
            long delay = backoffSeconds(consecutiveFailures);
            log.warnf("[Telegram] 폴링 실패 %d 회째, %d 초 후 재시도: %s", consecutiveFailures, delay, e.getMessage());
            return delay;
        }
    }

    long backoffSeconds(int failures) {
        long base = Math.max(intervalSeconds, 1);
        int shift = Math.min(failures, 30);
        return Math.min(base << shift, MAX_BACKOFF_SECONDS);
    }

    long offset() {
        return offset;
    }

    public boolean isRunning() {
        return running;
    }

    @PreDestroy
    synchronized void stop() {
        running = false;
        executor.shutdownNow();
        log.info("[Telegram] 업데이트 폴링 중지");
    }
}
