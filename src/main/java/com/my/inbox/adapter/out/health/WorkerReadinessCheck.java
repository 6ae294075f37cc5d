package com.my.inbox.adapter.out.health;

import com.my.inbox.config.AppConfig;
import com.my.inbox.domain.port.in.EnqueueIngestionUseCase;
import com.my.inbox.domain.port.in.SyncVaultUseCase;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;

@Readiness
@ApplicationScoped
public class WorkerReadinessCheck implements HealthCheck {

    private final AppConfig appConfig;
    private final EnqueueIngestionUseCase queue;
    private final SyncVaultUseCase syncVaultUseCase;

    public WorkerReadinessCheck(AppConfig appConfig, EnqueueIngestionUseCase queue, SyncVaultUseCase syncVaultUseCase) {
        this.appConfig = appConfig;
        this.queue = queue;
        this.syncVaultUseCase = syncVaultUseCase;
    }

    @Override
    public HealthCheckResponse call() {
        Path vault = Path.of(appConfig.vault().path());
        boolean notesOk = Files.isDirectory(vault.resolve(appConfig.vault().notesFolder()));
        boolean assetsOk = Files.isDirectory(vault.resolve(appConfig.vault().assetsFolder()));
        boolean gitOk = Files.exists(vault.resolve(".git"));
        return HealthCheckResponse.named("vault-inbox-readiness")
                .withData("vaultPath", vault.toString())
                .withData("notesFolderExists", notesOk)
                .withData("assetsFolderExists", assetsOk)
                .withData("gitRepository", gitOk)
                .withData("queueLength", queue.length())
                .withData("gitBusy", syncVaultUseCase.isBusy())
                .withData("pendingPublish", syncVaultUseCase.pendingCount())
                .status(notesOk && assetsOk && gitOk)
                .build();
    }
}
