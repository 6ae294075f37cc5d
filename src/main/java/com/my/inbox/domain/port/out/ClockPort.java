package com.my.inbox.domain.port.out;

import java.time.Instant;

/**
 * 왜: 저장 시각과 파일명 타임스탬프를 테스트에서 고정할 수 있도록 하기 위함.
 */
public interface ClockPort {
    Instant now();
}
