package com.infra.whatif.oracle;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Fixed classifier instruction text, loaded once from the classpath.
 */
@Component
public class ClassifierInstructions {

    static final String BASE_RESOURCE = "prompts/classifier-instructions.txt";
    static final String INTENT_RESOURCE = "prompts/classifier-intent.txt";

    private final String base;
    private final String intent;

    public ClassifierInstructions() {
        this.base = read(BASE_RESOURCE);
        this.intent = read(INTENT_RESOURCE);
    }

    public String forRequest(OracleRequest request) {
        return request.hasIntentContext() ? base + "\n\n" + intent : base;
    }

    private static String read(String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load classifier instructions from " + path, e);
        }
    }
}
