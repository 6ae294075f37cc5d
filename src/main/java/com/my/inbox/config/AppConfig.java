package com.my.inbox.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;
import java.util.Set;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    OpenAiConfig openai();

    VaultConfig vault();

    GitConfig git();

    QueueConfig queue();

    TelegramConfig telegram();

    IdempotencyConfig idempotency();

    interface OpenAiConfig {
        @WithName("api-key")
        Optional<String> apiKey();

        @WithDefault("gpt-4o-mini")
        String model();

        @WithDefault("0.5")
        double temperature();

        @WithName("timeout-seconds")
        @WithDefault("60")
        int timeoutSeconds();
    }

    interface VaultConfig {
        @WithName("path")
        @WithDefault("./data/vault")
        String path();

        @WithName("notes-folder")
        @WithDefault("Inbox")
        String notesFolder();

        @WithName("assets-folder")
        @WithDefault("assets")
        String assetsFolder();
    }

    interface GitConfig {
        @WithName("binary")
        @WithDefault("git")
        String binary();

        /**
         * 0 이면 주기적 pull 을 끈다.
         */
        @WithName("pull-interval-ms")
        @WithDefault("300000")
        long pullIntervalMs();

        @WithName("initial-delay-ms")
        @WithDefault("5000")
        long initialDelayMs();

        @WithName("command-timeout-seconds")
        @WithDefault("120")
        int commandTimeoutSeconds();
    }

    interface QueueConfig {
        @WithName("capacity")
        @WithDefault("1000")
        int capacity();

        @WithName("shutdown-grace-seconds")
        @WithDefault("10")
        int shutdownGraceSeconds();

        @WithName("notify-on-success")
        @WithDefault("false")
        boolean notifyOnSuccess();
    }

    interface TelegramConfig {
        @WithName("bot-token")
        Optional<String> botToken();

        @WithName("allowed-user-ids")
        Optional<Set<Long>> allowedUserIds();

        @WithName("admin-contact")
        @WithDefault("the administrator")
        String adminContact();

        @WithName("poll-interval-seconds")
        @WithDefault("1")
        int pollIntervalSeconds();

        @WithName("poll-timeout-seconds")
        @WithDefault("30")
        int pollTimeoutSeconds();
    }

    interface IdempotencyConfig {
        @WithName("ttl-hours")
        @WithDefault("24")
        int ttlHours();
    }
}
