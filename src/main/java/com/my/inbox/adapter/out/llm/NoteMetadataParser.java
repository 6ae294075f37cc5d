package com.my.inbox.adapter.out.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.inbox.domain.exception.MetadataGenerationException;
import com.my.inbox.domain.model.NoteMetadata;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: 모델 응답이 설명문에 감싸여 오더라도 JSON 객체를 건져 제목과 해시태그로 정규화하기 위함.
 */
public class NoteMetadataParser {

    private static final Logger log = Logger.getLogger(NoteMetadataParser.class);
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*}");

    private final ObjectMapper objectMapper;

    public NoteMetadataParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public NoteMetadata parse(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            throw new MetadataGenerationException("OpenAI response text was empty.");
        }
        JsonNode root = readTree(responseText);
        JsonNode title = root.get("title");
        JsonNode hashtags = root.get("hashtags");
        if (title == null || !title.isTextual() || hashtags == null || !hashtags.isArray()) {
            throw new MetadataGenerationException("Parsed OpenAI response did not match expected format.");
        }
        if (title.asText().isBlank()) {
            throw new MetadataGenerationException("Parsed OpenAI response has a blank title.");
        }
        return new NoteMetadata(title.asText().trim(), normalize(hashtags));
    }

    private JsonNode readTree(String responseText) {
        try {
            return objectMapper.readTree(responseText);
        } catch (JsonProcessingException e) {
            log.warnf("OpenAI 응답이 JSON 이 아닙니다. 객체 추출을 시도합니다: %s", responseText);
        }
        Matcher matcher = JSON_OBJECT.matcher(responseText);
        if (!matcher.find()) {
            throw new MetadataGenerationException("Response was not valid JSON: " + responseText);
        }
        try {
            JsonNode extracted = objectMapper.readTree(matcher.group());
            log.warnf("추출한 JSON 으로 파싱했습니다: %s", matcher.group());
            return extracted;
        } catch (JsonProcessingException e) {
            throw new MetadataGenerationException("Failed to parse extracted JSON: " + matcher.group(), e);
        }
    }

    static List<String> normalize(JsonNode hashtags) {
        List<String> normalized = new ArrayList<>();
        for (JsonNode tag : hashtags) {
            if (!tag.isTextual()) {
                continue;
            }
            String trimmed = tag.asText().trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            normalized.add(trimmed.startsWith("#") ? trimmed : "#" + trimmed);
        }
        return normalized;
    }
}
