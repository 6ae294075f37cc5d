package com.my.inbox.domain.port.out;

import com.my.inbox.domain.model.NoteMetadata;

import java.util.List;

/**
 * 왜: LLM 호출을 추상화하여 도메인이 공급자나 프로토콜에 의존하지 않도록 하기 위함.
 */
public interface MetadataPort {

    /**
     * @param content       분석할 본문
     * @param imagesBase64  함께 보낼 이미지(base64), 없으면 빈 목록
     * @throws com.my.inbox.domain.exception.MetadataGenerationException 재시도 후에도 실패하면
     */
    NoteMetadata generate(String content, List<String> imagesBase64);
}
