package com.programmersdiary.taskdaemon.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;

@Component
@ConditionalOnProperty(name = "taskdaemon.telegram.enabled", havingValue = "true")
public class TelegramClient {

    private final RestClient restClient;

    @Autowired
    public TelegramClient(
            @Value("${taskdaemon.telegram.base-url:https://api.telegram.org}") String baseUrl,
            @Value("${taskdaemon.telegram.bot-token:}") String botToken) {
        this(RestClient.builder(), baseUrl, botToken);
    }

    TelegramClient(RestClient.Builder builder, String baseUrl, String botToken) {
        if (botToken == null || botToken.isBlank()) {
            throw new IllegalStateException("taskdaemon.telegram.bot-token must be set when Telegram is enabled");
        }
        this.restClient = builder
                .baseUrl(baseUrl + "/bot" + botToken.trim())
                .build();
    }

    public void sendMessage(String chatId, String text) {
        var response = restClient.post()
                .uri("/sendMessage")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("chat_id", chatId, "text", text))
                .retrieve()
                .body(SendMessageResponse.class);
        if (response == null || !response.ok()) {
            var description = response != null ? response.description() : "empty response";
            throw new TelegramException("sendMessage to " + chatId + " failed: " + description);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SendMessageResponse(
            @JsonProperty("ok") boolean ok,
            @JsonProperty("description") String description) {}

    public static class TelegramException extends RuntimeException {
        public TelegramException(String message) {
            super(message);
        }
    }
}
