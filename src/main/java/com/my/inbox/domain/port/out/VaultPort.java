package com.my.inbox.domain.port.out;

import com.my.inbox.domain.model.SavedAsset;

import java.nio.file.Path;

/**
 * 왜: 파일 시스템 작업을 추상화하여 도메인이 저장소나 경로 구조에 종속되지 않도록 하기 위함.
 */
public interface VaultPort {

    SavedAsset saveAsset(byte[] bytes, String originalName);

    /**
     * @return 저장된 노트의 절대 경로
     */
    Path saveNote(String title, String content);
}
