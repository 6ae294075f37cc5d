package com.my.inbox.adapter.out.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.inbox.config.AppConfig;
import com.my.inbox.domain.exception.MediaDownloadException;
import com.my.inbox.domain.model.DownloadedMedia;
import com.my.inbox.domain.model.MediaRef;
import com.my.inbox.domain.model.TelegramIncomingMessage;
import com.my.inbox.domain.model.TelegramIncomingMessage.Attachment;
import com.my.inbox.domain.model.TelegramIncomingMessage.ForwardOrigin;
import com.my.inbox.domain.model.TelegramIncomingMessage.Sender;
import com.my.inbox.domain.model.TelegramOutgoingMessage;
import com.my.inbox.domain.port.out.MediaDownloadPort;
import com.my.inbox.domain.port.out.TelegramSendPort;
import com.my.inbox.domain.port.out.TelegramUpdatePort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 텔레그램 HTTP API 호출을 캡슐화해 수신, 응답, 첨부 다운로드 포트 구현을 단순화하기 위함.
 */
@ApplicationScoped
public class TelegramBotClient implements TelegramSendPort, TelegramUpdatePort, MediaDownloadPort {

    private static final Logger log = Logger.getLogger(TelegramBotClient.class);
    private static final String API_HOST = "https://api.telegram.org";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;
    private final String fileBase;

    @Inject
    public TelegramBotClient(AppConfig appConfig, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
                objectMapper, API_HOST, appConfig.telegram().botToken().orElse(""));
    }

    TelegramBotClient(HttpClient httpClient, ObjectMapper objectMapper, String host, String botToken) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiBase = botToken.isBlank() ? "" : host + "/bot" + botToken;
        this.fileBase = botToken.isBlank() ? "" : host + "/file/bot" + botToken;
    }

    @Override
    public void send(TelegramOutgoingMessage message) {
        if (apiBase.isBlank()) {
            log.warn("텔레그램 봇 토큰이 설정되지 않아 전송을 건너뜁니다.");
            return;
        }
        try {
            String body = objectMapper.writeValueAsString(new SendMessageRequest(message.chatId(), message.text()));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiBase + "/sendMessage"))
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofSeconds(10))
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                log.warnf("텔레그램 전송 실패 status=%d body=%s", response.statusCode(), response.body());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warnf("텔레그램 전송 중 인터럽트: %s", e.getMessage());
        } catch (Exception e) {
            log.warnf("텔레그램 전송 중 예외: %s", e.getMessage());
        }
    }

    @Override
    public List<TelegramIncomingMessage> fetchUpdates(long offset, int timeoutSeconds) {
        if (apiBase.isBlank()) {
            return Collections.emptyList();
        }
        try {
            String url = apiBase + "/getUpdates?timeout=" + timeoutSeconds + (offset > 0 ? "&offset=" + offset : "");
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(timeoutSeconds + 5L))
                    .GET()
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                log.warnf("텔레그램 업데이트 조회 실패 status=%d body=%s", response.statusCode(), response.body());
                return List.of();
            }
            ApiResponse<List<TelegramUpdate>> apiResponse = readResponse(response.body(),
                    objectMapper.getTypeFactory().constructCollectionType(List.class, TelegramUpdate.class));
            if (!apiResponse.ok()) {
                log.warn("텔레그램 업데이트 응답이 ok=false 입니다.");
                return List.of();
            }
            return Optional.ofNullable(apiResponse.result())
                    .orElse(List.of())
                    .stream()
                    .map(TelegramBotClient::mapToDomain)
                    .filter(Optional::isPresent)
                    .map(Optional::get)
                    .toList();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } catch (Exception e) {
            log.warnf("텔레그램 업데이트 조회 중 예외: %s", e.getMessage());
            return List.of();
        }
    }

    @Override
    public DownloadedMedia download(MediaRef media) {
        if (apiBase.isBlank()) {
            throw new MediaDownloadException("Failed to download media: bot token is not configured");
        }
        try {
            String filePath = resolveFilePath(media.remoteFileId());
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(fileBase + "/" + filePath))
                    .timeout(Duration.ofSeconds(60))
                    .GET()
                    .build();
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() >= 400) {
                throw new MediaDownloadException("Failed to download media: HTTP " + response.statusCode());
            }
            return new DownloadedMedia(response.body(), media.fileName(), media.isImage());
        } catch (MediaDownloadException e) {
            log.errorf("첨부 %s 다운로드 실패: %s", media.fileName(), e.getMessage());
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MediaDownloadException("Failed to download media: interrupted", e);
        } catch (IOException e) {
            log.errorf(e, "첨부 %s 다운로드 실패", media.fileName());
            throw new MediaDownloadException("Failed to download media: " + e.getMessage(), e);
        }
    }

    private String resolveFilePath(String fileId) throws IOException, InterruptedException {
        String url = apiBase + "/getFile?file_id=" + URLEncoder.encode(fileId, StandardCharsets.UTF_8);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(10))
                .GET()
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() >= 400) {
            throw new MediaDownloadException("Failed to resolve file: HTTP " + response.statusCode());
        }
        ApiResponse<TelegramFile> apiResponse = readResponse(response.body(),
                objectMapper.getTypeFactory().constructType(TelegramFile.class));
        if (!apiResponse.ok() || apiResponse.result() == null || apiResponse.result().filePath() == null) {
            throw new MediaDownloadException("Failed to resolve file: Telegram returned no file path");
        }
        return apiResponse.result().filePath();
    }

    private <T> ApiResponse<T> readResponse(String body, JavaType resultType) throws IOException {
        JavaType type = objectMapper.getTypeFactory().constructParametricType(ApiResponse.class, resultType);
        return objectMapper.readValue(body, type);
    }

    static Optional<TelegramIncomingMessage> mapToDomain(TelegramUpdate update) {
        if (update == null || update.message() == null || update.message().chat() == null) {
            return Optional.empty();
        }
        TelegramMessage message = update.message();
        Sender sender = Optional.ofNullable(message.from())
                .map(user -> new Sender(user.id(), user.username(), user.firstName(), user.lastName()))
                .orElse(null);
        Attachment photo = Optional.ofNullable(message.photo())
                .filter(sizes -> !sizes.isEmpty())
                .map(sizes -> sizes.get(sizes.size() - 1))
                .map(largest -> new Attachment(largest.fileId(), null, null))
                .orElse(null);
        Attachment video = Optional.ofNullable(message.video())
                .map(file -> new Attachment(file.fileId(), file.fileName(), file.mimeType()))
                .orElse(null);
        Attachment document = Optional.ofNullable(message.document())
                .map(file -> new Attachment(file.fileId(), file.fileName(), file.mimeType()))
                .orElse(null);
        ForwardOrigin forwardOrigin = Optional.ofNullable(message.forwardFromChat())
                .map(chat -> new ForwardOrigin(chat.type(), chat.id(), chat.username(), chat.title(),
                        chat.firstName(), chat.lastName(), orZero(message.forwardFromMessageId())))
                .orElse(null);
        return Optional.of(new TelegramIncomingMessage(
                update.updateId(),
                message.chat().id(),
                Optional.ofNullable(message.chat().type()).orElse("unknown"),
                message.messageId(),
                sender,
                message.text(),
                message.caption(),
                photo,
                video,
                document,
                forwardOrigin,
                orZero(message.date()),
                orZero(message.editDate()),
                orZero(message.forwardDate())));
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SendMessageRequest(@JsonProperty("chat_id") long chatId,
                                      @JsonProperty("text") String text) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ApiResponse<T>(@JsonProperty("ok") boolean ok,
                          @JsonProperty("result") T result) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TelegramUpdate(@JsonProperty("update_id") long updateId,
                          @JsonProperty("message") TelegramMessage message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TelegramMessage(@JsonProperty("message_id") long messageId,
                           @JsonProperty("from") TelegramUser from,
                           @JsonProperty("chat") TelegramChat chat,
                           @JsonProperty("text") String text,
                           @JsonProperty("caption") String caption,
                           @JsonProperty("photo") List<TelegramPhotoSize> photo,
                           @JsonProperty("video") TelegramFileRef video,
                           @JsonProperty("document") TelegramFileRef document,
                           @JsonProperty("forward_from_chat") TelegramChat forwardFromChat,
                           @JsonProperty("forward_from_message_id") Long forwardFromMessageId,
                           @JsonProperty("forward_date") Long forwardDate,
                           @JsonProperty("edit_date") Long editDate,
                           @JsonProperty("date") Long date) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TelegramChat(@JsonProperty("id") long id,
                        @JsonProperty("type") String type,
                        @JsonProperty("username") String username,
                        @JsonProperty("title") String title,
                        @JsonProperty("first_name") String firstName,
                        @JsonProperty("last_name") String lastName) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TelegramUser(@JsonProperty("id") long id,
                        @JsonProperty("username") String username,
                        @JsonProperty("first_name") String firstName,
                        @JsonProperty("last_name") String lastName) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TelegramPhotoSize(@JsonProperty("file_id") String fileId,
                             @JsonProperty("width") int width,
                             @JsonProperty("height") int height) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TelegramFileRef(@JsonProperty("file_id") String fileId,
                           @JsonProperty("file_name") String fileName,
                           @JsonProperty("mime_type") String mimeType) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TelegramFile(@JsonProperty("file_id") String fileId,
                        @JsonProperty("file_path") String filePath) {
    }
}
