package com.infra.whatif.config;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.azure.AzureOpenAiChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the chat model behind the classification oracle. Exactly one provider is active,
 * selected by {@code oracle.provider}; with {@code none} no model is created.
 */
@Configuration
public class OracleModelConfig {

    private static final Logger log = LoggerFactory.getLogger(OracleModelConfig.class);

    static final String DEFAULT_OLLAMA_URL = "http://localhost:11434";

    @Bean
    @ConditionalOnProperty(prefix = "oracle", name = "provider", havingValue = "anthropic", matchIfMissing = true)
    public ChatModel anthropicChatModel(OracleConfig config) {
        return anthropic(config);
    }

    @Bean
    @ConditionalOnProperty(prefix = "oracle", name = "provider", havingValue = "azure-openai")
    public ChatModel azureOpenAiChatModel(OracleConfig config) {
        return azureOpenAi(config);
    }

    @Bean
    @ConditionalOnProperty(prefix = "oracle", name = "provider", havingValue = "ollama")
    public ChatModel ollamaChatModel(OracleConfig config) {
        return ollama(config);
    }

    static ChatModel anthropic(OracleConfig config) {
        String model = require(config.getModel(), "oracle.model", "anthropic");
        String apiKey = require(config.getApiKey(), "oracle.api-key", "anthropic");
        log.info("Oracle provider anthropic, model={}, timeout={}", model, config.getTimeout());
        return AnthropicChatModel.builder()
                .baseUrl(config.getBaseUrl())
                .apiKey(apiKey)
                .modelName(model)
                .maxTokens(config.getMaxTokens())
                .temperature(config.getTemperature())
                .timeout(config.getTimeout())
                .maxRetries(config.getMaxRetries())
                .build();
    }

    static ChatModel azureOpenAi(OracleConfig config) {
        String endpoint = require(config.getBaseUrl(), "oracle.base-url", "azure-openai");
        String apiKey = require(config.getApiKey(), "oracle.api-key", "azure-openai");
        String deployment = config.getDeployment() != null && !config.getDeployment().isBlank()
                ? config.getDeployment()
                : require(config.getModel(), "oracle.deployment", "azure-openai");
        log.info("Oracle provider azure-openai, endpoint={}, deployment={}, timeout={}",
                endpoint, deployment, config.getTimeout());
        return AzureOpenAiChatModel.builder()
                .endpoint(endpoint)
                .apiKey(apiKey)
                .deploymentName(deployment)
                .serviceVersion(config.getAzureApiVersion())
                .maxTokens(config.getMaxTokens())
                .temperature(config.getTemperature())
                .timeout(config.getTimeout())
                .maxRetries(config.getMaxRetries())
                .build();
    }

    static ChatModel ollama(OracleConfig config) {
        String model = require(config.getModel(), "oracle.model", "ollama");
        String baseUrl = config.getBaseUrl() != null && !config.getBaseUrl().isBlank()
                ? config.getBaseUrl() : DEFAULT_OLLAMA_URL;
        log.info("Oracle provider ollama, baseUrl={}, model={}, timeout={}", baseUrl, model, config.getTimeout());
        return OllamaChatModel.builder()
                .baseUrl(baseUrl)
                .modelName(model)
                .temperature(config.getTemperature())
                .timeout(config.getTimeout())
                .maxRetries(config.getMaxRetries())
                .build();
    }

    private static String require(String value, String property, String provider) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(property + " is not set for the " + provider + " provider");
        }
        return value;
    }
}
