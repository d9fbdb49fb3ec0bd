package com.phillippitts.enginecoordinator.service.provider.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.enginecoordinator.exception.ProviderUnavailableExceptionBuilder;
import com.phillippitts.enginecoordinator.service.provider.CompletionRequest;
import com.phillippitts.enginecoordinator.service.provider.CompletionResponse;
import com.phillippitts.enginecoordinator.service.provider.ModelProvider;
import com.phillippitts.enginecoordinator.util.LogSanitizer;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Adapter for backends speaking the OpenAI chat-completions protocol: local servers such as
 * Ollama or LM Studio as well as hosted cloud APIs.
 *
 * <p>Issues one non-streaming {@code POST {apiBase}/chat/completions} per call. The whole call,
 * including connect and body read, is bounded by the timeout the router passes in. Retrying is the
 * router's job, so this adapter fails fast.
 */
public final class OpenAiCompatibleProvider implements ModelProvider {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String id;
    private final HttpUrl apiBase;
    private final String model;
    private final String apiKey;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public OpenAiCompatibleProvider(String id, String apiBase, String model, String apiKey,
                                    OkHttpClient client, ObjectMapper mapper) {
        this.id = Objects.requireNonNull(id, "id");
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase"));
        this.model = Objects.requireNonNull(model, "model");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.client = Objects.requireNonNull(client, "client");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public CompletionResponse complete(CompletionRequest request, Duration timeout) {
        long t0 = System.nanoTime();
        Call call;
        try {
            call = client.newCall(buildRequest(request));
        } catch (IOException e) {
            throw failure("Could not encode request", t0).cause(e).build();
        }
        call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);

        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw failure("Provider returned HTTP error", t0)
                        .httpStatus(response.code())
                        .metadata("body", LogSanitizer.truncate(raw, 200))
                        .build();
            }
            return parse(raw, t0);
        } catch (InterruptedIOException e) {
            throw failure("Provider call timed out or was cancelled", t0).cause(e).build();
        } catch (IOException e) {
            throw failure("Provider call failed", t0).cause(e).build();
        }
    }

    private Request buildRequest(CompletionRequest request) throws IOException {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (request.hasContext()) {
            messages.add(message("system", request.context()));
        }
        messages.add(message("user", request.prompt()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", messages);
        payload.put("stream", false);
        if (request.maxTokens() > 0) {
            payload.put("max_tokens", request.maxTokens());
        }

        Request.Builder builder = new Request.Builder()
                .url(apiBase.newBuilder().addPathSegment("chat").addPathSegment("completions").build())
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                .header("Accept", "application/json");
        if (!apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    private CompletionResponse parse(String raw, long t0) {
        JsonNode root;
        try {
            root = mapper.readTree(raw);
        } catch (IOException e) {
            throw failure("Provider returned malformed JSON", t0).cause(e).build();
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw failure("Provider response has no completion content", t0).build();
        }
        JsonNode usage = root.path("usage");
        int tokensIn = Math.max(0, usage.path("prompt_tokens").asInt(0));
        int tokensOut = Math.max(0, usage.path("completion_tokens").asInt(0));
        return new CompletionResponse(content.asText(""), tokensIn, tokensOut);
    }

    private ProviderUnavailableExceptionBuilder failure(String message, long t0) {
        return ProviderUnavailableExceptionBuilder.create(message)
                .provider(id)
                .durationMs((System.nanoTime() - t0) / 1_000_000L)
                .metadata("endpoint", apiBase);
    }

    private static Map<String, Object> message(String role, String content) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("role", role);
        row.put("content", content);
        return row;
    }
}
