package com.infra.whatif.oracle;

import com.infra.whatif.config.MetricsConfig;
import com.infra.whatif.config.OracleConfig;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Classification oracle over a langchain4j {@link ChatModel}. Sends the fixed classifier
 * instructions as the system message and the request payload as the user message, and
 * translates model failures into {@link OracleException} and its subclasses.
 */
@Component
@ConditionalOnExpression("!'${oracle.provider:anthropic}'.equals('none')")
public class ChatModelClassificationOracle implements ClassificationOracle {

    private static final Logger log = LoggerFactory.getLogger(ChatModelClassificationOracle.class);

    private final ChatModel chatModel;
    private final OracleConfig config;
    private final ClassifierInstructions instructions;
    private final MetricsConfig metricsConfig;

    public ChatModelClassificationOracle(ChatModel chatModel, OracleConfig config,
                                         ClassifierInstructions instructions, MetricsConfig metricsConfig) {
        this.chatModel = chatModel;
        this.config = config;
        this.instructions = instructions;
        this.metricsConfig = metricsConfig;
    }

    @Override
    public String getProviderName() {
        return config.getProvider();
    }

    @Override
    public String classify(OracleRequest request) {
        ChatRequest chatRequest = ChatRequest.builder()
                .messages(SystemMessage.from(instructions.forRequest(request)),
                        UserMessage.from(request.toUserMessage()))
                .build();

        long start = System.currentTimeMillis();
        ChatResponse response;
        try {
            response = chatModel.chat(chatRequest);
        } catch (RuntimeException e) {
            if (isTimeout(e)) {
                metricsConfig.recordOracleCall(getProviderName(), "timeout");
                throw new OracleTimeoutException(String.format("%s call timed out after %s",
                        getProviderName(), config.getTimeout()), e);
            }
            metricsConfig.recordOracleCall(getProviderName(), "error");
            log.error("Oracle call to {} failed: {}", getProviderName(), e.getMessage());
            throw new OracleException(getProviderName() + " call failed: " + e.getMessage(), e);
        }

        AiMessage message = response != null ? response.aiMessage() : null;
        String text = message != null ? message.text() : null;
        if (text == null || text.isBlank()) {
            metricsConfig.recordOracleCall(getProviderName(), "error");
            throw new OracleResponseException(getProviderName() + " returned no text content",
                    response != null ? response.toString() : null);
        }

        metricsConfig.recordOracleCall(getProviderName(), "success");
        log.info("Oracle call to {} completed in {} ms, reclassification={}",
                getProviderName(), System.currentTimeMillis() - start, request.isReclassification());
        return text;
    }

    static boolean isTimeout(Throwable error) {
        int depth = 0;
        for (Throwable t = error; t != null && depth < 10; t = t.getCause(), depth++) {
            if (t instanceof dev.langchain4j.exception.TimeoutException
                    || t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException
                    || t instanceof java.util.concurrent.TimeoutException) {
                return true;
            }
        }
        return false;
    }
}
