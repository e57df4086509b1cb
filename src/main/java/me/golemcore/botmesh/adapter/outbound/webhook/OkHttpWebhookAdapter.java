package me.golemcore.botmesh.adapter.outbound.webhook;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.botmesh.port.outbound.WebhookPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;

/**
 * Calls webhook tools over HTTP with the shared {@link OkHttpClient}.
 *
 * <p>
 * The body is sent as JSON for every method but GET. Response bodies are
 * parsed as JSON when possible and returned as raw text otherwise.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OkHttpWebhookAdapter implements WebhookPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public WebhookResponse call(String url, String method, Map<String, String> headers, Map<String, Object> body) {
        String verb = method != null ? method.toUpperCase(Locale.ROOT) : "POST";
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Content-Type", "application/json");
        if (headers != null) {
            headers.forEach(builder::header);
        }
        if ("GET".equals(verb)) {
            builder.get();
        } else {
            builder.method(verb, RequestBody.create(serialize(body), JSON));
        }

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            log.debug("[Webhook] {} {} -> HTTP {}", verb, url, response.code());
            return new WebhookResponse(response.code(), parse(text));
        } catch (IOException e) {
            log.warn("[Webhook] {} {} failed: {}", verb, url, e.getMessage());
            throw new UncheckedIOException("Webhook call failed: " + e.getMessage(), e);
        }
    }

    private String serialize(Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body != null ? body : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook body is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Object parse(String text) {
        if (text.isBlank()) {
            return text;
        }
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            return text;
        }
    }
}
