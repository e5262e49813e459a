package ru.aritmos.crmbridge.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Singleton;
import ru.aritmos.crmbridge.config.OpenAiProperties;
import ru.aritmos.crmbridge.model.AgentPersona;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Генератор ответов через OpenAI-совместимый Chat Completions API.
 * <p>
 * Используется стандартный JDK {@link HttpClient}: минимум зависимостей и асинхронный вызов
 * через {@link HttpClient#sendAsync}. Ключ API передаётся только в заголовке и не логируется.
 */
@Singleton
public class OpenAiReplyGenerator implements ReplyGenerator {

    private final OpenAiProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public OpenAiReplyGenerator(OpenAiProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getHttpTimeoutMs()))
                .build();
    }

    @Override
    public String id() {
        return "openai";
    }

    @Override
    public CompletableFuture<String> generate(String promptText, AgentPersona persona) {
        if (!properties.hasApiKey()) {
            return CompletableFuture.failedFuture(new GenerationException("Не задан ключ API (wacrm.generation.openai.api-key)"));
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(properties.getBaseUrl() + "/chat/completions"))
                    .timeout(Duration.ofMillis(properties.getHttpTimeoutMs()))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + properties.getApiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody(promptText, persona)))
                    .build();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(new GenerationException("Не удалось сформировать запрос: " + e.getMessage(), e));
        }

        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(this::extractReply);
    }

    String requestBody(String promptText, AgentPersona persona) throws Exception {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", properties.getModel());
        root.put("max_tokens", properties.getMaxTokens());
        root.put("temperature", properties.getTemperature());
        ArrayNode messages = root.putArray("messages");
        messages.addObject()
                .put("role", "system")
                .put("content", systemPrompt(persona));
        messages.addObject()
                .put("role", "user")
                .put("content", promptText == null ? "" : promptText);
        return objectMapper.writeValueAsString(root);
    }

    String extractReply(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new GenerationException("LLM API ответил статусом " + status);
        }
        try {
            JsonNode root = objectMapper.readTree(response.body());
            JsonNode content = root.at("/choices/0/message/content");
            if (content.isMissingNode() || content.isNull()) {
                throw new GenerationException("В ответе LLM API нет choices[0].message.content");
            }
            return content.asText();
        } catch (GenerationException e) {
            throw e;
        } catch (Exception e) {
            throw new GenerationException("Не удалось разобрать ответ LLM API: " + e.getMessage(), e);
        }
    }

    static String systemPrompt(AgentPersona persona) {
        String name = persona == null ? AgentPersona.DEFAULT_AGENT_NAME : persona.agentName();
        return "Eres " + name + ", un asistente inteligente especializado en atención al cliente. "
                + "Responde de manera profesional, útil y empática. Mantén las respuestas concisas pero completas.";
    }
}
