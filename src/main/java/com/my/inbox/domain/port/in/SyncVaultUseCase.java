package com.my.inbox.domain.port.in;

import com.my.inbox.domain.model.PublishResult;
import com.my.inbox.domain.model.PullResult;

import java.nio.file.Path;
import java.util.List;

/**
 * 왜: vault 저장소에 대한 pull 과 commit/push 를 한 곳에서 직렬화하기 위함.
 */
public interface SyncVaultUseCase {

    /**
     * 실패해도 예외를 던지지 않는다.
     */
    PullResult pull();

    /**
     * 다른 git 작업이 진행 중이면 건너뛰고 파일을 보류 목록에 남긴다.
     *
     * @throws com.my.inbox.domain.exception.GitSyncException 커밋 또는 푸시 실패 시
     */
    PublishResult commitAndPush(List<Path> files, String message);

    /**
     * 보류 중인 파일을 커밋/푸시한다. 실패는 로그로만 남긴다.
     */
    void flushPending();

    boolean isBusy();

    int pendingCount();
}
