package com.my.inbox.adapter.out.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.inbox.domain.exception.MetadataGenerationException;
import com.my.inbox.domain.model.NoteMetadata;
import com.my.inbox.domain.port.out.MetadataPort;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * 왜: LLM 호출을 도메인 포트 계약에 맞게 감싸 노트 제목과 해시태그를 안정적으로 제공하기 위함.
 *
 * <p>총 3회 시도하며 대기 시간은 1초부터 두 배씩 늘어난다.
 */
@ApplicationScoped
public class OpenAiMetadataAdapter implements MetadataPort {

    private static final Logger log = Logger.getLogger(OpenAiMetadataAdapter.class);

    static final int CONTENT_LIMIT = 5000;
    private static final String IMAGE_MIME_TYPE = "image/jpeg";

    private final ChatLanguageModel model;
    private final NoteMetadataParser parser;

    @Inject
    public OpenAiMetadataAdapter(ChatLanguageModel model, ObjectMapper objectMapper) {
        this(model, new NoteMetadataParser(objectMapper));
    }

    OpenAiMetadataAdapter(ChatLanguageModel model, NoteMetadataParser parser) {
        this.model = model;
        this.parser = parser;
    }

    @Override
    @Retry(maxRetries = 2, delay = 1000, jitter = 0, maxDuration = 10, durationUnit = ChronoUnit.MINUTES)
    @ExponentialBackoff(factor = 2)
    public NoteMetadata generate(String content, List<String> imagesBase64) {
        String prompt = buildPrompt(content);
        log.debugf("OpenAI 요청 프롬프트: %.100s...", prompt);
        try {
            Response<AiMessage> response = model.generate(List.<ChatMessage>of(buildMessage(prompt, imagesBase64)));
            String text = response == null || response.content() == null ? null : response.content().text();
            log.debugf("OpenAI 원문 응답: %s", text);
            NoteMetadata metadata = parser.parse(text);
            log.infof("메타데이터 생성 - 제목: \"%s\", 해시태그: %s", metadata.title(), String.join(", ", metadata.hashtags()));
            return metadata;
        } catch (MetadataGenerationException e) {
            log.warnf("OpenAI 응답 처리 실패: %s", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.warnf("OpenAI 호출 실패: %s", e.getMessage());
            throw new MetadataGenerationException("OpenAI call failed: " + e.getMessage(), e);
        }
    }

    static UserMessage buildMessage(String prompt, List<String> imagesBase64) {
        List<Content> contents = new ArrayList<>();
        contents.add(TextContent.from(prompt));
        if (imagesBase64 != null) {
            imagesBase64.forEach(image ->
                    contents.add(ImageContent.from(image, IMAGE_MIME_TYPE, ImageContent.DetailLevel.LOW)));
        }
        return UserMessage.from(contents);
    }

    static String buildPrompt(String content) {
        String truncated = content.length() > CONTENT_LIMIT ? content.substring(0, CONTENT_LIMIT) : content;
        return """
                Analyze the following content and generate a concise, filesystem-friendly title \
                (max 10 words, avoid special characters like /\\:*?"<>|) and a list of relevant hashtags \
                (e.g., ["#topic1", "#topic2"]).

                Content:
                \"""
                %s
                \"""

                Hashtags a.k.a categories should always be in English and start with a # symbol. \
                If companies, products, or people are mentioned, they should be included as hashtags.
                Title should be in the same language as the content and should be concise and descriptive.
                Respond ONLY with a valid JSON object in the following format:
                {"title": "Your Concise Title", "hashtags": ["#tag1", "#tag2", "#relevantHashtag"]}
                """.formatted(truncated);
    }
}
