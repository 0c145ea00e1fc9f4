package com.complypilot.service;

import com.complypilot.exception.AnalyzerException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.converter.BeanOutputConverter;

/**
 * Single-shot LLM call with structured JSON output and lenient parsing.
 * <p>
 * Tolerates the usual LLM JSON slips:
 * <ul>
 *   <li>trailing commas</li>
 *   <li>Java-style comments</li>
 *   <li>single quotes and unquoted field names</li>
 *   <li>unexpected fields</li>
 * </ul>
 * Makes exactly one attempt. Analysis retries are left to the caller, who re-invokes
 * the analysis explicitly.
 */
public final class StructuredLlmCaller {

    private static final Logger log = LoggerFactory.getLogger(StructuredLlmCaller.class);

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private StructuredLlmCaller() {
    }

    /**
     * Calls the LLM and parses the reply into {@code type}. The converter's JSON-schema
     * format instructions are appended to the user prompt.
     *
     * @param chatClient   the LLM client to use
     * @param systemPrompt the system prompt
     * @param userPrompt   the user prompt
     * @param type         target class for parsing
     * @param callerName   name used in log lines
     * @param <T>          target type
     * @return the parsed reply
     * @throws AnalyzerException on transport errors, empty replies or unparseable JSON
     */
    public static <T> T callEntity(ChatClient chatClient, String systemPrompt, String userPrompt,
                                   Class<T> type, String callerName) {
        var converter = new BeanOutputConverter<>(type, LENIENT_MAPPER);
        String fullUserPrompt = userPrompt + "\n\n" + converter.getFormat();

        ChatResponse chatResponse;
        try {
            chatResponse = chatClient.prompt()
                    .system(systemPrompt)
                    .user(fullUserPrompt)
                    .call()
                    .chatResponse();
        } catch (Exception e) {
            throw new AnalyzerException(callerName + ": LLM call failed: " + rootCauseMessage(e), e);
        }

        logTokenUsage(chatResponse, callerName);

        String content = (chatResponse != null && chatResponse.getResult() != null)
                ? chatResponse.getResult().getOutput().getText()
                : null;
        if (content == null || content.isBlank()) {
            throw new AnalyzerException(callerName + ": empty or null content in LLM response");
        }

        try {
            T parsed = converter.convert(content);
            if (parsed == null) {
                throw new AnalyzerException(callerName + ": LLM response parsed to null");
            }
            return parsed;
        } catch (AnalyzerException e) {
            throw e;
        } catch (Exception e) {
            throw new AnalyzerException(callerName + ": LLM response is not valid JSON for "
                    + type.getSimpleName() + ": " + rootCauseMessage(e), e);
        }
    }

    private static void logTokenUsage(ChatResponse chatResponse, String callerName) {
        if (chatResponse == null || chatResponse.getMetadata() == null) return;
        var usage = chatResponse.getMetadata().getUsage();
        if (usage == null || usage.getTotalTokens() == null) return;
        log.debug("{}: {} tokens (prompt {}, completion {}, model={})", callerName,
                usage.getTotalTokens(), usage.getPromptTokens(), usage.getCompletionTokens(),
                chatResponse.getMetadata().getModel());
    }

    private static String rootCauseMessage(Exception e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage();
        return msg != null && msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
