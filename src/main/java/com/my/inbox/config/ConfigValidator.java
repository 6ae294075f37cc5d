package com.my.inbox.config;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 왜: 필수 설정과 vault 경로를 기동 시점에 검증해 잘못된 설정으로 작업을 받지 않도록 하기 위함.
 */
@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = LaunchMode.current() == LaunchMode.NORMAL;
        validateRequired("OPENAI_API_KEY", appConfig.openai().apiKey().orElse(null), isProd);
        validateRequired("TELEGRAM_BOT_TOKEN", appConfig.telegram().botToken().orElse(null), isProd);
        Path vault = validateVault(appConfig.vault().path());
        ensureFolder(vault.resolve(appConfig.vault().notesFolder()));
        ensureFolder(vault.resolve(appConfig.vault().assetsFolder()));
    }

    void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            String message = "필수 설정이 비어 있습니다: " + name;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }

    static Path validateVault(String path) {
        Path resolved = Path.of(path);
        if (!Files.isDirectory(resolved)) {
            throw new IllegalStateException("vault 경로가 없거나 디렉터리가 아닙니다: VAULT_PATH=" + path);
        }
        return resolved;
    }

    static void ensureFolder(Path folder) {
        if (Files.isDirectory(folder)) {
            return;
        }
        log.warnf("폴더가 없어 생성합니다: %s", folder);
        try {
            Files.createDirectories(folder);
        } catch (IOException e) {
            throw new IllegalStateException("폴더 생성 실패: " + folder, e);
        }
    }
}
