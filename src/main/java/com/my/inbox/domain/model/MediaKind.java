package com.my.inbox.domain.model;

/**
 * 왜: 텔레그램 첨부 유형을 명시적으로 구분해 파일명 규칙과 이미지 분석 여부를 결정하기 위함.
 */
public enum MediaKind {
    PHOTO,
    VIDEO,
    DOCUMENT
}
