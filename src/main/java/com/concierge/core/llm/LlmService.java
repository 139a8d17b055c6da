package com.concierge.core.llm;

import com.concierge.core.model.ExecutionEntry;
import com.concierge.core.model.InteractionMessage;
import com.concierge.core.model.ToolCallRequest;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wraps Spring AI's {@link ChatClient} for the three kinds of model calls the
 * concierge makes: structured (typed) output, plain completion, and tool calling
 * with tool execution left to the caller.
 * <p>
 * Structured calls use {@link BeanOutputConverter} to generate a JSON schema from
 * the target Java class, append the format instructions to the prompt, and
 * deserialize the model's JSON response into the requested type.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private static final String REFUSAL_METADATA_KEY = "refusal";

    private final ChatClient chatClient;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        log.info("LlmService initialized, OpenAI base-url: {}", baseUrl);
    }

    /**
     * Sends a system + user prompt to the LLM and returns the response
     * deserialized into the given {@code outputType}.
     *
     * @param systemPrompt instructions for the LLM's role / behaviour
     * @param userPrompt   the request text
     * @param outputType   the Java class (record or POJO) to deserialize into
     * @param <T>          target type
     * @return an instance of {@code T} populated from the LLM's JSON response
     * @throws LlmRefusalException        if the model declined to answer
     * @throws LlmEmptyResponseException  if the model returned no content
     * @throws LlmParseException          if the content could not be parsed
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        log.info("LLM call started → {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        ChatResponse response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .chatResponse();
        logElapsed(outputType, start);
        return convert(response, converter, outputType);
    }

    /**
     * Like {@link #structuredCall(String, String, Class)}, but sends a whole
     * conversation instead of a single user prompt. The format instructions
     * are appended to the system prompt.
     */
    public <T> T structuredCall(String systemPrompt, List<InteractionMessage> history, Class<T> outputType) {
        log.info("LLM call started → {} ({} history messages)", outputType.getSimpleName(), history.size());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        ChatResponse response = chatClient.prompt()
                .system(systemPrompt + "\n\n" + converter.getFormat())
                .messages(toMessages(history))
                .call()
                .chatResponse();
        logElapsed(outputType, start);
        return convert(response, converter, outputType);
    }

    /**
     * Plain text completion. Returns an empty string when the model produced no text.
     */
    public String complete(String systemPrompt, String userPrompt) {
        ChatResponse response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .chatResponse();
        AssistantMessage output = output(response, "completion");
        String text = output.getText();
        return text != null ? text : "";
    }

    /**
     * Requests one assistant turn with the given tools available. Spring AI's
     * internal tool execution is disabled: the requested calls are returned in
     * model order for the caller to execute.
     *
     * @param systemPrompt executor instructions
     * @param userPrompt   the freshly built task context
     * @param history      the task's own execution history, appended after the user prompt
     * @param tools        tool declarations offered to the model
     */
    public ModelTurn toolCall(String systemPrompt, String userPrompt,
                              List<ExecutionEntry> history, List<ToolSpec> tools) {
        List<Message> messages = new ArrayList<>();
        messages.add(new UserMessage(userPrompt));
        history.forEach(entry -> messages.add(toMessage(entry)));

        var options = ToolCallingChatOptions.builder()
                .toolCallbacks(tools.stream().map(ToolSpec::toToolCallback).toList())
                .internalToolExecutionEnabled(false)
                .build();

        long start = System.currentTimeMillis();
        ChatResponse response = chatClient.prompt()
                .system(systemPrompt)
                .messages(messages)
                .options(options)
                .call()
                .chatResponse();
        AssistantMessage output = output(response, "tool call");
        List<ToolCallRequest> calls = output.getToolCalls() == null ? List.of()
                : output.getToolCalls().stream()
                        .map(tc -> new ToolCallRequest(tc.id(), tc.name(), tc.arguments()))
                        .toList();
        log.debug("Tool-enabled LLM call complete ({} tool calls, {} ms)",
                calls.size(), System.currentTimeMillis() - start);
        return new ModelTurn(output.getText(), calls);
    }

    private <T> T convert(ChatResponse response, BeanOutputConverter<T> converter, Class<T> outputType) {
        AssistantMessage output = output(response, outputType.getSimpleName());
        Object refusal = output.getMetadata().get(REFUSAL_METADATA_KEY);
        if (refusal instanceof String text && !text.isBlank()) {
            throw new LlmRefusalException(outputType.getSimpleName(), text);
        }
        String content = output.getText();
        if (content == null || content.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName()
                    + ". Check that the model is running and supports structured JSON output.");
        }
        try {
            T result = converter.convert(content);
            if (result == null) {
                throw new LlmParseException("LLM response converted to null " + outputType.getSimpleName());
            }
            return result;
        } catch (LlmParseException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to parse LLM response to {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", content);
            return parseWithJackson(content, outputType);
        }
    }

    /**
     * Fallback JSON parsing using Jackson ObjectMapper with lenient settings.
     */
    private <T> T parseWithJackson(String json, Class<T> outputType) {
        log.info("Attempting Jackson fallback parsing for {}", outputType.getSimpleName());
        try {
            var mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
            mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

            // Extract JSON from markdown code blocks if present
            String cleaned = json.trim();
            if (cleaned.startsWith("```json")) {
                cleaned = cleaned.substring(7);
            } else if (cleaned.startsWith("```")) {
                cleaned = cleaned.substring(3);
            }
            if (cleaned.endsWith("```")) {
                cleaned = cleaned.substring(0, cleaned.length() - 3);
            }
            cleaned = cleaned.trim();

            T result = mapper.readValue(cleaned, outputType);
            if (result == null) {
                throw new LlmParseException("LLM response parsed to null " + outputType.getSimpleName());
            }
            log.info("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (LlmParseException e) {
            throw e;
        } catch (Exception e2) {
            log.error("Jackson fallback parsing FAILED for {}: {}", outputType.getSimpleName(), e2.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e2.getMessage(), e2);
        }
    }

    private static AssistantMessage output(ChatResponse response, String purpose) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new LlmEmptyResponseException("LLM returned no generation for " + purpose);
        }
        return response.getResult().getOutput();
    }

    private static List<Message> toMessages(List<InteractionMessage> history) {
        List<Message> messages = new ArrayList<>(history.size());
        for (InteractionMessage message : history) {
            messages.add(message.isAssistant()
                    ? new AssistantMessage(message.content())
                    : new UserMessage(message.content()));
        }
        return messages;
    }

    private static Message toMessage(ExecutionEntry entry) {
        if (entry.isTool()) {
            return new ToolResponseMessage(List.of(new ToolResponseMessage.ToolResponse(
                    entry.toolCallId(), entry.toolName() != null ? entry.toolName() : "", entry.content())));
        }
        List<AssistantMessage.ToolCall> toolCalls = entry.toolCalls().stream()
                .map(tc -> new AssistantMessage.ToolCall(tc.callId(), "function", tc.name(), tc.arguments()))
                .toList();
        return new AssistantMessage(entry.content(), Map.of(), toolCalls);
    }

    private static void logElapsed(Class<?> outputType, long start) {
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete → {} ({}s)", outputType.getSimpleName(), String.format("%.1f", elapsed / 1000.0));
    }
}
