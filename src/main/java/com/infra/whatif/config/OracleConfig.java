package com.infra.whatif.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "oracle")
public class OracleConfig {

    // "anthropic", "azure-openai", "ollama", or "none" when the oracle bean is supplied elsewhere
    private String provider = "anthropic";

    // Model name is always explicit configuration; see application.yml
    private String model;

    // Provider endpoint. Required for azure-openai, optional override otherwise.
    private String baseUrl;

    private String apiKey;

    // Azure OpenAI deployment name; falls back to the model name when unset
    private String deployment;

    private String azureApiVersion = "2024-02-15-preview";

    // Bound on each oracle call. A timeout on the first call is fatal, on re-classification it falls back.
    private Duration timeout = Duration.ofSeconds(120);

    // Retries inside a single oracle call. Zero: a failed call is reported to the caller as is.
    private int maxRetries = 0;

    private int maxTokens = 4096;

    private double temperature = 0.0;
}
