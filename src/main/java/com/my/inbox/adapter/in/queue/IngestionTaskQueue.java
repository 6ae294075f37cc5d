package com.my.inbox.adapter.in.queue;

import com.my.inbox.adapter.in.idempotency.IdempotencyStore;
import com.my.inbox.config.AppConfig;
import com.my.inbox.domain.model.IngestionTask;
import com.my.inbox.domain.port.in.EnqueueIngestionUseCase;
import com.my.inbox.domain.port.in.ProcessIngestionUseCase;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 수집 작업을 한 번에 하나씩 순서대로 처리해 vault 저장소 변경이 겹치지 않도록 하기 위함.
 *
 * <p>용량이 정해진 채널과 단일 소비 스레드로 구성된다. 작업 하나의 실패는 로그만 남기고 다음 작업으로 넘어간다.
 */
@Startup
@ApplicationScoped
public class IngestionTaskQueue implements EnqueueIngestionUseCase {

    private static final Logger log = Logger.getLogger(IngestionTaskQueue.class);
    private static final long POLL_MILLIS = 500;

    private final ProcessIngestionUseCase processIngestionUseCase;
    private final IdempotencyStore idempotencyStore;
    private final BlockingQueue<IngestionTask> channel;
    private final Duration shutdownGrace;
    private volatile boolean running;
    private Thread worker;

    @Inject
    public IngestionTaskQueue(ProcessIngestionUseCase processIngestionUseCase,
                              IdempotencyStore idempotencyStore,
                              AppConfig appConfig) {
        this(processIngestionUseCase, idempotencyStore, appConfig.queue().capacity(),
                Duration.ofSeconds(appConfig.queue().shutdownGraceSeconds()));
    }

    IngestionTaskQueue(ProcessIngestionUseCase processIngestionUseCase,
                       IdempotencyStore idempotencyStore,
                       int capacity,
                       Duration shutdownGrace) {
        this.processIngestionUseCase = processIngestionUseCase;
        this.idempotencyStore = idempotencyStore;
        this.channel = new LinkedBlockingQueue<>(capacity);
        this.shutdownGrace = shutdownGrace;
    }

    @PostConstruct
    synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        worker = new Thread(this::consume, "vault-inbox-queue");
        worker.setDaemon(true);
        worker.start();
        log.info("수집 큐 작업자를 시작했습니다.");
    }

    @Override
    public boolean enqueue(IngestionTask task) {
        if (!task.hasContent()) {
            log.warnf("텍스트와 첨부가 모두 없어 메시지 %d 를 건너뜁니다.", task.messageId());
            return false;
        }
        if (!running) {
            log.warnf("큐가 중지되어 메시지 %d 를 받지 않습니다.", task.messageId());
            return false;
        }
        String key = task.chatId() + ":" + task.messageId();
        if (idempotencyStore.isProcessed(key)) {
            log.infof("중복 메시지를 건너뜁니다: %s", key);
            return false;
        }
        if (!channel.offer(task)) {
            log.errorf("큐가 가득 차 메시지 %d 를 받지 못했습니다. 대기 %d 개", task.messageId(), channel.size());
            return false;
        }
        idempotencyStore.markProcessed(key);
        log.infof("메시지 %d 를 큐에 추가했습니다. 대기 %d 개", task.messageId(), channel.size());
        return true;
    }

    @Override
    public int length() {
        return channel.size();
    }

    private void consume() {
        while (running) {
            IngestionTask task;
            try {
                task = channel.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("수집 큐 작업자가 인터럽트되어 종료합니다.");
                return;
            }
            if (task != null) {
                processSafely(task);
                if (channel.isEmpty()) {
                    log.info("큐가 비었고 처리가 끝났습니다.");
                }
            }
        }
    }

    private void processSafely(IngestionTask task) {
        MDC.put("chatId", String.valueOf(task.chatId()));
        MDC.put("messageId", String.valueOf(task.messageId()));
        log.infof("메시지 %d (chat %d) 처리 시작", task.messageId(), task.chatId());
        try {
            processIngestionUseCase.process(task);
            log.infof("메시지 %d 처리 완료", task.messageId());
        } catch (Exception e) {
            log.errorf(e, "메시지 %d 처리 실패: %s, task=%s", task.messageId(), e.getMessage(), task.redacted());
        } finally {
            MDC.remove("chatId");
            MDC.remove("messageId");
        }
    }

    @PreDestroy
    synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        int abandoned = channel.size();
        if (abandoned > 0) {
            log.warnf("처리되지 않은 작업 %d 개를 남기고 큐를 종료합니다.", abandoned);
        }
        try {
            worker.join(shutdownGrace.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (worker.isAlive()) {
            log.warnf("%d 초 안에 진행 중인 작업이 끝나지 않아 작업자를 중단합니다.", shutdownGrace.toSeconds());
            worker.interrupt();
        }
    }
}
