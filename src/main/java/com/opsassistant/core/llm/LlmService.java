package com.opsassistant.core.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Wraps Spring AI's {@link ChatClient} behind the three call shapes the
 * pipeline needs: free text, a raw JSON object and a typed record.
 * <p>
 * Backend failures surface as {@link LlmUnavailableException}; blank
 * responses as {@link LlmEmptyResponseException}; unparseable responses as
 * {@link LlmParseException}. Markdown code fences around JSON are tolerated.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ObjectMapper objectMapper;

    @Autowired
    public LlmService(ChatClient.Builder builder, LlmProperties properties,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this(builder.build(), properties);
        log.info("LlmService initialized: provider={}, model={}, base-url={}",
                properties.getProvider(), properties.getModel(), baseUrl);
    }

    LlmService(ChatClient chatClient, LlmProperties properties) {
        this.chatClient = chatClient;
        this.properties = properties;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .registerModule(new ParameterNamesModule());
    }

    public String completeText(String systemPrompt, String userPrompt, int maxTokens) {
        return call(systemPrompt, userPrompt, maxTokens, "text");
    }

    /**
     * Asks for a JSON object and returns it as a map.
     */
    public Map<String, Object> completeJson(String systemPrompt, String userPrompt, int maxTokens) {
        String response = call(systemPrompt, userPrompt, maxTokens, "json");
        String cleaned = extractJsonObject(response);
        try {
            Map<String, Object> parsed = objectMapper.readValue(cleaned, JSON_OBJECT);
            if (parsed == null) {
                throw new LlmParseException("Model returned JSON null instead of an object", response, null);
            }
            return parsed;
        } catch (LlmParseException e) {
            throw e;
        } catch (Exception e) {
            log.debug("Raw model response: {}", response);
            throw new LlmParseException("Model response is not a JSON object: " + e.getMessage(), response, e);
        }
    }

    /**
     * Sends a system + user prompt and deserializes the response into {@code outputType},
     * using {@link BeanOutputConverter} format instructions and a lenient Jackson fallback.
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType, int maxTokens) {
        var converter = new BeanOutputConverter<>(outputType);
        String response = call(systemPrompt, userPrompt + "\n\n" + converter.getFormat(), maxTokens,
                outputType.getSimpleName());
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Converter could not parse {} ({}), trying lenient parse", outputType.getSimpleName(), e.getMessage());
            try {
                return objectMapper.readValue(extractJsonObject(response), outputType);
            } catch (Exception e2) {
                log.debug("Raw model response: {}", response);
                throw new LlmParseException("Failed to parse model response to " + outputType.getSimpleName()
                        + ": " + e2.getMessage(), response, e2);
            }
        }
    }

    private String call(String systemPrompt, String userPrompt, int maxTokens, String purpose) {
        log.info("LLM call started -> {}", purpose);
        long start = System.currentTimeMillis();
        String response;
        try {
            response = chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .options(options(maxTokens))
                    .call()
                    .content();
        } catch (RuntimeException e) {
            LlmFailure failure = classify(e);
            log.warn("LLM call failed ({}): {}", failure, e.getMessage());
            throw new LlmUnavailableException(failure, "Language model call failed (" + failure + "): "
                    + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete -> {} ({}s)", purpose, String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("Language model returned empty content for " + purpose);
        }
        return response;
    }

    private ChatOptions options(int maxTokens) {
        var builder = ChatOptions.builder()
                .temperature(properties.getTemperature())
                .maxTokens(maxTokens);
        if (properties.getModel() != null && !properties.getModel().isBlank()) {
            builder.model(properties.getModel());
        }
        return builder.build();
    }

    static LlmFailure classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException
                    || t instanceof TimeoutException) {
                return LlmFailure.TIMEOUT;
            }
            if (t instanceof ConnectException || t instanceof UnknownHostException) {
                return LlmFailure.UNAVAILABLE;
            }
            if (t instanceof NonTransientAiException) {
                String message = String.valueOf(t.getMessage());
                return message.contains("401") || message.contains("403")
                        || message.toLowerCase().contains("api key")
                        ? LlmFailure.AUTHENTICATION : LlmFailure.REJECTED;
            }
            if (t instanceof TransientAiException) {
                return LlmFailure.UNAVAILABLE;
            }
        }
        return LlmFailure.TRANSPORT;
    }

    /**
     * Strips markdown fences and any prose around the outermost JSON object.
     */
    static String extractJsonObject(String response) {
        String cleaned = response.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        int open = cleaned.indexOf('{');
        int close = cleaned.lastIndexOf('}');
        if (open > 0 && close > open) {
            cleaned = cleaned.substring(open, close + 1);
        }
        return cleaned;
    }
}
