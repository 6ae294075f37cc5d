package com.my.inbox.domain.service;

import com.my.inbox.domain.model.IngestionTask;
import com.my.inbox.domain.port.out.ClockPort;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 왜: 노트 본문 뒤에 붙는 메타데이터 블록의 줄 순서와 표기를 한 곳에서 고정하기 위함.
 */
public class NoteFormatter {

    static final String SEPARATOR = "---";
    private static final DateTimeFormatter DISPLAY = DateTimeFormatter
            .ofPattern("M/d/yyyy, h:mm:ss a", Locale.US)
            .withZone(ZoneOffset.UTC);

    private final ClockPort clockPort;

    public NoteFormatter(ClockPort clockPort) {
        this.clockPort = clockPort;
    }

    /**
     * @param assetLink vault 상대 경로, 첨부가 없으면 null
     */
    public String format(IngestionTask task, String assetLink, List<String> hashtags) {
        StringBuilder body = new StringBuilder(task.text() == null ? "" : task.text());
        if (assetLink != null) {
            body.append("\n\n![[").append(assetLink).append("]]");
        }
        body.append("\n\n").append(SEPARATOR).append('\n');
        body.append(String.join("\n", metadataLines(task, hashtags)));
        return body.toString();
    }

    List<String> metadataLines(IngestionTask task, List<String> hashtags) {
        List<String> lines = new ArrayList<>();
        lines.add("Saved At: " + display(clockPort.now()));
        if (task.userId() != null) {
            if (task.username() != null && !task.username().isBlank()) {
                lines.add("From User: @" + task.username() + " (ID: " + task.userId() + ")");
            } else {
                lines.add("From User: " + task.userId());
            }
        }
        lines.add("Original Date: " + display(task.messageTimestamp()));
        if (task.forwardSourceLink() != null && !task.forwardSourceLink().isBlank()) {
            lines.add("Source: " + task.forwardSourceLink());
        }
        if (hashtags != null && !hashtags.isEmpty()) {
            lines.add("Tags: " + String.join(" ", hashtags));
        }
        return lines;
    }

    private static String display(Instant instant) {
        return DISPLAY.format(instant);
    }
}
