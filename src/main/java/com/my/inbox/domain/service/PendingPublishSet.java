package com.my.inbox.domain.service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 왜: 커밋/푸시가 건너뛰어지거나 실패한 파일을 기억해 다음 커밋에서 함께 게시하기 위함.
 */
public class PendingPublishSet {

    private final Set<Path> files = new LinkedHashSet<>();

    public synchronized void addAll(Collection<Path> paths) {
        paths.forEach(path -> files.add(path.toAbsolutePath().normalize()));
    }

    public synchronized void removeAll(Collection<Path> paths) {
        paths.forEach(path -> files.remove(path.toAbsolutePath().normalize()));
    }

    /**
     * 디스크에서 사라진 파일은 목록에서 빼고 나머지를 돌려준다.
     */
    public synchronized List<Path> existing() {
        files.removeIf(path -> !Files.exists(path));
        return List.copyOf(files);
    }

    public synchronized int size() {
        return files.size();
    }

    public synchronized boolean isEmpty() {
        return files.isEmpty();
    }
}
