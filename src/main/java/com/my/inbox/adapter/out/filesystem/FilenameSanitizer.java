package com.my.inbox.adapter.out.filesystem;

import com.my.inbox.domain.port.out.ClockPort;

import java.util.regex.Pattern;

/**
 * 주요 파일 시스템에서 쓸 수 없는 문자를 걸러 파일명으로 만든다.
 */
public class FilenameSanitizer {

    static final int MAX_LENGTH = 100;

    private static final Pattern INVALID = Pattern.compile("[/\\\\?%*:|\"<>]");
    private static final Pattern DASH_RUN = Pattern.compile("-+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");

    private final ClockPort clockPort;

    public FilenameSanitizer(ClockPort clockPort) {
        this.clockPort = clockPort;
    }

    /**
     * @param note 노트 제목이면 끝의 마침표를 제거한다 (Windows)
     */
    public String sanitize(String name, boolean note) {
        String sanitized = INVALID.matcher(name == null ? "" : name).replaceAll("-");
        sanitized = DASH_RUN.matcher(sanitized).replaceAll("-");
        sanitized = EDGE_DASHES.matcher(sanitized).replaceAll("");
        if (sanitized.length() > MAX_LENGTH) {
            sanitized = sanitized.substring(0, MAX_LENGTH);
        }
        if (note && sanitized.endsWith(".")) {
            sanitized = sanitized.substring(0, sanitized.length() - 1);
        }
        if (sanitized.isEmpty()) {
            sanitized = "file-" + clockPort.now().toEpochMilli();
        }
        return sanitized;
    }
}
