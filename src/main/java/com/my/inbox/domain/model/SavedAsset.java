package com.my.inbox.domain.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 왜: 노트 링크에 쓰는 vault 상대 경로와 커밋에 쓰는 절대 경로를 함께 돌려주기 위함.
 */
public record SavedAsset(String vaultRelativePath, Path absolutePath) {

    public SavedAsset {
        Objects.requireNonNull(vaultRelativePath, "vaultRelativePath");
        Objects.requireNonNull(absolutePath, "absolutePath");
    }

    public String linkTarget() {
        return vaultRelativePath.replace('\\', '/');
    }
}
