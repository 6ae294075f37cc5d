package com.my.inbox.adapter.out.llm;

import com.my.inbox.config.AppConfig;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.time.Duration;

/**
 * 왜: 모델 클라이언트를 빈으로 분리해 재시도 정책이 걸린 어댑터를 그대로 두고 모델만 교체할 수 있도록 하기 위함.
 *
 * <p>재시도는 어댑터의 {@code @Retry}가 맡으므로 클라이언트 자체 재시도는 1회로 둔다.
 */
@ApplicationScoped
public class ChatModelProducer {

    @Produces
    @ApplicationScoped
    public ChatLanguageModel chatLanguageModel(AppConfig appConfig) {
        return OpenAiChatModel.builder()
                .apiKey(appConfig.openai().apiKey().orElse(""))
                .modelName(appConfig.openai().model())
                .temperature(appConfig.openai().temperature())
                .timeout(Duration.ofSeconds(appConfig.openai().timeoutSeconds()))
                .responseFormat("json_object")
                .maxRetries(1)
                .build();
    }
}
