package com.camingest.camingest.service.notify;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import com.camingest.camingest.config.CameraIngestProperties;
import com.camingest.camingest.model.dto.CameraEvent;
import com.camingest.camingest.model.dto.CameraEventType;
import com.camingest.camingest.service.events.EventSink;

/**
 * Chat notifications through the Telegram Bot API: the annotated alert frame for
 * person.detected, a text line for camera.disconnected. Other events are ignored.
 * Only active when both the bot token and the chat id are configured.
 */
@Service
@ConditionalOnExpression("!'${camera.telegram.bot-token:}'.isEmpty() and !'${camera.telegram.chat-id:}'.isEmpty()")
public class TelegramNotificationSink implements EventSink {

    private static final Logger logger = LoggerFactory.getLogger(TelegramNotificationSink.class);

    private final RestClient restClient;
    private final String chatId;

    public TelegramNotificationSink(RestClient.Builder builder, CameraIngestProperties properties) {
        CameraIngestProperties.Telegram telegram = properties.getTelegram();
        this.restClient = builder
                .baseUrl(telegram.getApiBaseUrl() + "/bot" + telegram.getBotToken())
                .build();
        this.chatId = telegram.getChatId();
        logger.info("Telegram notifications enabled for chat {}", chatId);
    }

    @Override
    public String getName() {
        return "telegram";
    }

    @Override
    public void deliver(String channel, CameraEvent event) throws IOException {
        if (event.getType() == CameraEventType.PERSON_DETECTED) {
            sendAlertFrame(event);
        } else if (event.getType() == CameraEventType.CAMERA_DISCONNECTED) {
            sendMessage("Camera " + event.getCameraId() + " disconnected: " + event.getData().get("reason"));
        }
    }

    private void sendAlertFrame(CameraEvent event) throws IOException {
        Object personCount = event.getData().get("person_count");
        String caption = "PERSON DETECTED on camera " + event.getCameraId() + "\nPeople found: " + personCount;

        Object framePath = event.getData().get("frame_path");
        if (framePath == null) {
            sendMessage(caption);
            return;
        }

        Path file = Paths.get(framePath.toString());
        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("chat_id", chatId);
        form.add("caption", caption);
        form.add("photo", new FileSystemResource(file));

        restClient.post()
                .uri("/sendPhoto")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(form)
                .retrieve()
                .toBodilessEntity();
        logger.debug("Sent alert frame {} to Telegram", file);

        // The notification was the frame's last consumer
        Files.deleteIfExists(file);
    }

    private void sendMessage(String text) {
        restClient.post()
                .uri("/sendMessage")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("chat_id", chatId, "text", text))
                .retrieve()
                .toBodilessEntity();
    }
}
