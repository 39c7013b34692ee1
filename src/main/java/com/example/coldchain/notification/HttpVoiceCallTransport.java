package com.example.coldchain.notification;

import com.example.coldchain.config.ColdChainProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Places text-to-speech calls through an HTTP voice provider, one request per
 * number. Any non-2xx answer aborts the batch with an {@link IOException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpVoiceCallTransport implements VoiceCallTransport {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ColdChainProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public boolean isConfigured() {
        ColdChainProperties.NotificationConfig.VoiceConfig voice = properties.getNotifications().getVoice();
        return notBlank(voice.getApiUrl()) && notBlank(voice.getApiKey()) && notBlank(voice.getFromNumber());
    }

    @Override
    public void placeCall(String message, List<String> phoneNumbers) throws IOException {
        ColdChainProperties.NotificationConfig.VoiceConfig voice = properties.getNotifications().getVoice();

        for (String phone : phoneNumbers) {
            Map<String, Object> payload = Map.of(
                    "to", phone,
                    "from", voice.getFromNumber(),
                    "text", message
            );

            Request request = new Request.Builder()
                    .url(voice.getApiUrl())
                    .header("Authorization", "Bearer " + voice.getApiKey())
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    throw new IOException("Voice provider returned HTTP " + response.code() + " for " + phone);
                }
                log.info("Voice call placed to {}", phone);
            }
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
