package com.my.inbox.config;

import com.my.inbox.adapter.out.clock.SystemClockAdapter;
import com.my.inbox.domain.port.in.EnqueueIngestionUseCase;
import com.my.inbox.domain.port.in.ProcessIngestionUseCase;
import com.my.inbox.domain.port.in.SyncVaultUseCase;
import com.my.inbox.domain.port.out.ClockPort;
import com.my.inbox.domain.port.out.MediaDownloadPort;
import com.my.inbox.domain.port.out.MetadataPort;
import com.my.inbox.domain.port.out.TelegramSendPort;
import com.my.inbox.domain.port.out.TelegramUpdatePort;
import com.my.inbox.domain.port.out.VaultPort;
import com.my.inbox.domain.port.out.VersionControlPort;
import com.my.inbox.domain.service.GitSyncService;
import com.my.inbox.domain.service.IngestionTaskProcessor;
import com.my.inbox.domain.service.NoteFormatter;
import com.my.inbox.domain.service.PendingPublishSet;
import com.my.inbox.domain.service.TelegramUpdateService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.nio.file.Path;
import java.util.Set;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public SyncVaultUseCase syncVaultUseCase(VersionControlPort versionControlPort,
                                             AppConfig appConfig,
                                             ClockPort clockPort) {
        return new GitSyncService(versionControlPort, Path.of(appConfig.vault().path()), clockPort, new PendingPublishSet());
    }

    @Produces
    @ApplicationScoped
    public ProcessIngestionUseCase processIngestionUseCase(MediaDownloadPort mediaDownloadPort,
                                                           VaultPort vaultPort,
                                                           MetadataPort metadataPort,
                                                           SyncVaultUseCase syncVaultUseCase,
                                                           TelegramSendPort telegramSendPort,
                                                           ClockPort clockPort,
                                                           AppConfig appConfig) {
        return new IngestionTaskProcessor(mediaDownloadPort, vaultPort, metadataPort, syncVaultUseCase,
                telegramSendPort, new NoteFormatter(clockPort), appConfig.queue().notifyOnSuccess());
    }

    @Produces
    @ApplicationScoped
    public TelegramUpdateService telegramUpdateService(TelegramUpdatePort telegramUpdatePort,
                                                       EnqueueIngestionUseCase enqueueIngestionUseCase,
                                                       TelegramSendPort telegramSendPort,
                                                       AppConfig appConfig) {
        Set<Long> allowed = appConfig.telegram().allowedUserIds().orElse(Set.of());
        return new TelegramUpdateService(telegramUpdatePort, enqueueIngestionUseCase, telegramSendPort,
                allowed, appConfig.telegram().adminContact());
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort() {
        return SystemClockAdapter.system();
    }
}
