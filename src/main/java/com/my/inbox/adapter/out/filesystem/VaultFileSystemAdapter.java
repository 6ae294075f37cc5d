package com.my.inbox.adapter.out.filesystem;

import com.my.inbox.config.AppConfig;
import com.my.inbox.domain.exception.VaultWriteException;
import com.my.inbox.domain.model.SavedAsset;
import com.my.inbox.domain.port.out.ClockPort;
import com.my.inbox.domain.port.out.VaultPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 왜: Obsidian vault 파일 생성을 중앙집중식으로 처리하여 파일명 충돌 없이 노트와 첨부를 기록하기 위함.
 */
@ApplicationScoped
public class VaultFileSystemAdapter implements VaultPort {

    private static final Logger log = Logger.getLogger(VaultFileSystemAdapter.class);

    static final int MAX_NAME_ATTEMPTS = 100;
    private static final String NOTE_EXTENSION = ".md";
    private static final String UNKNOWN_EXTENSION = ".unknown";

    private final Path notesPath;
    private final Path assetsPath;
    private final String assetsFolder;
    private final ClockPort clockPort;
    private final FilenameSanitizer sanitizer;

    @Inject
    public VaultFileSystemAdapter(AppConfig appConfig, ClockPort clockPort) {
        this(Path.of(appConfig.vault().path()), appConfig.vault().notesFolder(), appConfig.vault().assetsFolder(), clockPort);
    }

    VaultFileSystemAdapter(Path vaultRoot, String notesFolder, String assetsFolder, ClockPort clockPort) {
        Path root = vaultRoot.toAbsolutePath().normalize();
        this.notesPath = root.resolve(notesFolder);
        this.assetsPath = root.resolve(assetsFolder);
        this.assetsFolder = assetsFolder;
        this.clockPort = clockPort;
        this.sanitizer = new FilenameSanitizer(clockPort);
    }

    @Override
    public SavedAsset saveAsset(byte[] bytes, String originalName) {
        String baseName = stripExtension(originalName);
        String extension = extensionOf(originalName).orElse(UNKNOWN_EXTENSION);
        String fileName = clockPort.now().toEpochMilli() + "-" + sanitizer.sanitize(baseName, false) + extension;
        Path fullPath = assetsPath.resolve(fileName);
        try {
            log.infof("첨부 저장: %s", fullPath);
            Files.write(fullPath, bytes);
        } catch (IOException e) {
            log.errorf(e, "첨부 \"%s\" 를 %s 에 저장하지 못했습니다.", fileName, assetsPath);
            throw new VaultWriteException("Failed to write asset file: " + e.getMessage(), e);
        }
        return new SavedAsset(assetsFolder + "/" + fileName, fullPath);
    }

    @Override
    public Path saveNote(String title, String content) {
        String fileName;
        try {
            fileName = uniqueNoteFileName(title);
        } catch (IllegalStateException e) {
            fileName = "fallback-note-" + clockPort.now().toEpochMilli() + NOTE_EXTENSION;
            log.errorf("제목 \"%s\" 의 고유 파일명을 찾지 못해 %s 를 사용합니다.", title, fileName);
        }
        Path fullPath = notesPath.resolve(fileName);
        try {
            log.infof("노트 저장: %s", fullPath);
            Files.writeString(fullPath, content, StandardCharsets.UTF_8);
            return fullPath;
        } catch (IOException e) {
            log.errorf(e, "노트 \"%s\" 를 %s 에 저장하지 못했습니다.", fileName, notesPath);
            throw new VaultWriteException("Failed to write note file: " + e.getMessage(), e);
        }
    }

    String uniqueNoteFileName(String title) {
        String sanitized = sanitizer.sanitize(title, true);
        String candidate = sanitized + NOTE_EXTENSION;
        int counter = 0;
        while (Files.exists(notesPath.resolve(candidate))) {
            counter++;
            if (counter > MAX_NAME_ATTEMPTS) {
                throw new IllegalStateException("Failed to find unique filename for " + sanitized);
            }
            candidate = sanitized + "-" + counter + NOTE_EXTENSION;
        }
        log.debugf("노트 파일명 결정: %s", candidate);
        return candidate;
    }

    private static String stripExtension(String name) {
        int dot = extensionIndex(name);
        return dot < 0 ? name : name.substring(0, dot);
    }

    private static Optional<String> extensionOf(String name) {
        int dot = extensionIndex(name);
        return dot < 0 ? Optional.empty() : Optional.of(name.substring(dot));
    }

    /**
     * 선행 마침표(숨김 파일)와 끝 마침표는 확장자로 보지 않는다.
     */
    private static int extensionIndex(String name) {
        int dot = name.lastIndexOf('.');
        return dot <= 0 || dot == name.length() - 1 ? -1 : dot;
    }
}
