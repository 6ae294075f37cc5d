package com.my.inbox.domain.port.in;

import com.my.inbox.domain.model.IngestionTask;

/**
 * 왜: 큐에서 꺼낸 작업 하나를 다운로드부터 푸시까지 처리하는 단일 진입점을 두기 위함.
 */
public interface ProcessIngestionUseCase {
    void process(IngestionTask task);
}
