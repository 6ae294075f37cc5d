package com.my.inbox.domain.port.in;

import com.my.inbox.domain.model.IngestionTask;

/**
 * 왜: 수신 어댑터가 큐 구현을 모른 채 작업을 넘길 수 있도록 하기 위함.
 */
public interface EnqueueIngestionUseCase {

    /**
     * 내용이 없는 작업은 무시한다. 호출자는 처리 완료를 기다리지 않는다.
     *
     * @return 큐에 들어갔으면 true
     */
    boolean enqueue(IngestionTask task);

    int length();
}
