package ru.aritmos.crmbridge.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Настройки OpenAI-совместимого генератора ответов ({@code wacrm.generation.openai.*}).
 * <p>
 * Ключ API не логируется и не отдаётся через Admin API.
 */
@ConfigurationProperties("wacrm.generation.openai")
public class OpenAiProperties {

    private String baseUrl = "https://api.openai.com/v1";
    private String apiKey = "";
    private String model = "gpt-4o";
    private int maxTokens = 150;
    private double temperature = 0.7;
    private long httpTimeoutMs = 20_000;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return;
        }
        String t = baseUrl.trim();
        this.baseUrl = t.endsWith("/") ? t.substring(0, t.length() - 1) : t;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = (model == null || model.isBlank()) ? "gpt-4o" : model.trim();
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = Math.max(1, maxTokens);
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = Math.min(2.0, Math.max(0.0, temperature));
    }

    public long getHttpTimeoutMs() {
        return httpTimeoutMs;
    }

    public void setHttpTimeoutMs(long httpTimeoutMs) {
        this.httpTimeoutMs = Math.max(1000, httpTimeoutMs);
    }
}
