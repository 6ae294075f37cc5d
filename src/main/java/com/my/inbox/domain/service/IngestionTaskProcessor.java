package com.my.inbox.domain.service;

import com.my.inbox.domain.model.DownloadedMedia;
import com.my.inbox.domain.model.IngestionTask;
import com.my.inbox.domain.model.MediaRef;
import com.my.inbox.domain.model.NoteMetadata;
import com.my.inbox.domain.model.PublishResult;
import com.my.inbox.domain.model.SavedAsset;
import com.my.inbox.domain.model.TelegramOutgoingMessage;
import com.my.inbox.domain.port.in.ProcessIngestionUseCase;
import com.my.inbox.domain.port.in.SyncVaultUseCase;
import com.my.inbox.domain.port.out.MediaDownloadPort;
import com.my.inbox.domain.port.out.MetadataPort;
import com.my.inbox.domain.port.out.TelegramSendPort;
import com.my.inbox.domain.port.out.VaultPort;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 왜: 다운로드, 첨부 저장, AI 분류, 노트 저장, 커밋/푸시를 정해진 순서로 묶고 단계별 실패 정책을 한 곳에서 적용하기 위함.
 *
 * <p>AI 분류 실패만 대체값으로 복구하고 나머지 실패는 사용자에게 한 번 알린 뒤 다시 던진다.
 * 이미 기록된 파일은 되돌리지 않는다.
 */
public class IngestionTaskProcessor implements ProcessIngestionUseCase {

    private static final Logger log = Logger.getLogger(IngestionTaskProcessor.class);

    static final int COMMIT_TITLE_LIMIT = 50;
    static final int ERROR_PREVIEW_LIMIT = 100;

    private final MediaDownloadPort mediaDownloadPort;
    private final VaultPort vaultPort;
    private final MetadataPort metadataPort;
    private final SyncVaultUseCase syncVaultUseCase;
    private final TelegramSendPort telegramSendPort;
    private final NoteFormatter noteFormatter;
    private final boolean notifyOnSuccess;

    public IngestionTaskProcessor(MediaDownloadPort mediaDownloadPort,
                                  VaultPort vaultPort,
                                  MetadataPort metadataPort,
                                  SyncVaultUseCase syncVaultUseCase,
                                  TelegramSendPort telegramSendPort,
                                  NoteFormatter noteFormatter,
                                  boolean notifyOnSuccess) {
        this.mediaDownloadPort = mediaDownloadPort;
        this.vaultPort = vaultPort;
        this.metadataPort = metadataPort;
        this.syncVaultUseCase = syncVaultUseCase;
        this.telegramSendPort = telegramSendPort;
        this.noteFormatter = noteFormatter;
        this.notifyOnSuccess = notifyOnSuccess;
    }

    @Override
    public void process(IngestionTask task) {
        List<Path> assetFiles = new ArrayList<>();
        try {
            DownloadedMedia media = task.mediaRef().map(this::download).orElse(null);

            String assetLink = null;
            if (media != null) {
                SavedAsset asset = vaultPort.saveAsset(media.bytes(), media.fileName());
                assetFiles.add(asset.absolutePath());
                assetLink = asset.linkTarget();
            }

            NoteMetadata metadata = generateMetadata(task, media);

            String content = noteFormatter.format(task, assetLink, metadata.hashtags());
            Path notePath = vaultPort.saveNote(metadata.title(), content);
            log.infof("노트를 로컬에 저장했습니다: %s", notePath);

            List<Path> files = new ArrayList<>();
            files.add(notePath);
            files.addAll(assetFiles);
            PublishResult published = syncVaultUseCase.commitAndPush(files, commitMessage(metadata.title()));
            logPublish(metadata.title(), published);

            if (notifyOnSuccess) {
                String deferred = published == PublishResult.SKIPPED_BUSY ? " 게시는 다음 동기화 때 이루어집니다." : "";
                reply(task.chatId(), "✅ 노트 \"" + metadata.title() + "\" 를 저장했습니다." + deferred);
            }
        } catch (RuntimeException e) {
            log.errorf(e, "메시지 %d 처리 실패: %s", task.messageId(), e.getMessage());
            reply(task.chatId(), "❌ 메시지 " + task.messageId() + " 를 노트로 저장하지 못했습니다. 오류: "
                    + preview(e) + "...");
            throw e;
        }
    }

    private DownloadedMedia download(MediaRef media) {
        log.infof("첨부 다운로드: fileName=%s, kind=%s", media.fileName(), media.kind());
        DownloadedMedia downloaded = mediaDownloadPort.download(media);
        log.infof("첨부 다운로드 완료: %s, %d bytes", downloaded.fileName(), downloaded.size());
        return downloaded;
    }

    private NoteMetadata generateMetadata(IngestionTask task, DownloadedMedia media) {
        String aiInput = task.textContent()
                .orElseGet(() -> "Media: " + task.mediaRef().map(MediaRef::fileName).orElse("attached file"));
        List<String> images = media != null && media.image() ? List.of(media.base64()) : List.of();
        try {
            return metadataPort.generate(aiInput, images);
        } catch (RuntimeException e) {
            log.errorf(e, "메시지 %d 의 AI 분류 실패, 기본 메타데이터를 사용합니다: %s", task.messageId(), e.getMessage());
            reply(task.chatId(), "⚠️ 메시지 " + task.messageId() + " 의 AI 분류에 실패해 미분류 노트로 저장합니다.");
            return NoteMetadata.fallback(task.messageId());
        }
    }

    private static void logPublish(String title, PublishResult published) {
        if (published == PublishResult.SKIPPED_BUSY) {
            log.warnf("git 작업이 진행 중이라 노트 \"%s\" 는 다음 동기화 때 게시됩니다.", title);
        } else if (published == PublishResult.NOTHING_TO_PUBLISH) {
            log.warnf("노트 \"%s\" 에 커밋할 변경이 없습니다.", title);
        } else {
            log.infof("노트 커밋/푸시 완료: %s", title);
        }
    }

    static String commitMessage(String title) {
        String shortTitle = title.length() > COMMIT_TITLE_LIMIT
                ? title.substring(0, COMMIT_TITLE_LIMIT) + "..."
                : title;
        return "Add note: " + shortTitle;
    }

    private static String preview(RuntimeException e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return message.length() > ERROR_PREVIEW_LIMIT ? message.substring(0, ERROR_PREVIEW_LIMIT) : message;
    }

    private void reply(long chatId, String text) {
        try {
            telegramSendPort.send(new TelegramOutgoingMessage(chatId, text));
        } catch (RuntimeException e) {
            log.warnf("채팅 %d 로 응답 전송 실패: %s", chatId, e.getMessage());
        }
    }
}
