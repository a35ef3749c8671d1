package com.muji.integrations;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.muji.db.Json;
import com.muji.web.dto.NotifyRequest;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Публичный процесс не владеет Telegram-ботом: о новом сообщении пользователя он просит
 * админский процесс, который и рассылает уведомления операторам.
 */
public class AdminNotifyClient {
    private static final Logger log = LoggerFactory.getLogger(AdminNotifyClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    public static final String TOKEN_HEADER = "X-Internal-Token";

    private final OkHttpClient http;
    private final ObjectMapper om = Json.mapper();
    private final String baseUrl;
    private final String token;

    public AdminNotifyClient(String baseUrl, String token) {
        this(new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(3))
                .callTimeout(Duration.ofSeconds(10))
                .build(), baseUrl, token);
    }

    AdminNotifyClient(OkHttpClient http, String baseUrl, String token) {
        this.http = http;
        this.baseUrl = baseUrl;
        this.token = token;
    }

    public boolean hasConfig() { return baseUrl != null && !baseUrl.isBlank(); }

    /** false, если админка недоступна или ответила ошибкой; сообщение пользователя уже сохранено. */
    public boolean notifyNewMessage(NotifyRequest body) {
        if (!hasConfig()) return false;
        try {
            HttpUrl url = Objects.requireNonNull(HttpUrl.parse(baseUrl), "ADMIN_BASE_URL")
                    .newBuilder()
                    .addPathSegments("internal/notify")
                    .build();
            Request req = new Request.Builder()
                    .url(url)
                    .header(TOKEN_HEADER, token == null ? "" : token)
                    .post(RequestBody.create(om.writeValueAsBytes(body), JSON))
                    .build();
            try (Response resp = http.newCall(req).execute()) {
                if (!resp.isSuccessful()) {
                    log.warn("Admin notify for profile {} failed: HTTP {}", body.profileId, resp.code());
                    return false;
                }
                return true;
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Admin notify for profile {} failed: {}", body.profileId, e.getMessage());
            return false;
        }
    }
}
