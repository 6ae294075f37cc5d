package com.my.inbox.domain.port.out;

import java.util.List;

/**
 * 왜: git 명령 실행 방식을 숨겨 동기화 정책을 명령 실행과 분리하여 테스트하기 위함.
 *
 * <p>모든 경로는 저장소 루트 기준 상대 경로다. 실패는 {@link com.my.inbox.domain.exception.GitSyncException}.
 */
public interface VersionControlPort {

    boolean hasUncommittedChanges();

    void stashPush(String marker);

    boolean hasStash(String markerPrefix);

    void stashPop();

    /**
     * merge 전략으로 pull 한다.
     *
     * @return 원격 변경이 반영되었으면 true
     */
    boolean pull();

    void add(List<String> relativePaths);

    boolean hasStagedChanges();

    /**
     * @return 생성된 커밋 해시
     */
    String commit(String message);

    /**
     * @return 현재 브랜치에 upstream 으로 아직 push 되지 않은 커밋이 있으면 true
     */
    boolean hasUnpushedCommits();

    void push();
}
