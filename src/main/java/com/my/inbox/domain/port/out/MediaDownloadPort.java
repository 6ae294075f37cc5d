package com.my.inbox.domain.port.out;

import com.my.inbox.domain.model.DownloadedMedia;
import com.my.inbox.domain.model.MediaRef;

/**
 * 왜: 채팅 플랫폼의 파일 조회 방식을 도메인에서 숨기기 위함.
 */
public interface MediaDownloadPort {

    /**
     * @throws com.my.inbox.domain.exception.MediaDownloadException 다운로드 실패 시
     */
    DownloadedMedia download(MediaRef media);
}
