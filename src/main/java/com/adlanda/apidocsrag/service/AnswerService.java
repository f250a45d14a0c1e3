package com.adlanda.apidocsrag.service;

import com.adlanda.apidocsrag.config.AnswerProperties;
import com.adlanda.apidocsrag.exception.AnswerGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Generates a natural-language answer from retrieved endpoint context.
 *
 * Uses Spring AI's {@link ChatModel}, by default an OpenAI-compatible client pointed at Groq.
 * The model is optional: without one, or with {@code apidocs.answer.enabled=false},
 * callers fall back to retrieval-only responses.
 */
@Service
public class AnswerService {

    private static final Logger log = LoggerFactory.getLogger(AnswerService.class);

    static final String SYSTEM_PROMPT = "You are an expert on this API's documentation. "
            + "Provide accurate, helpful answers based on the given context.";

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final AnswerProperties properties;

    public AnswerService(ObjectProvider<ChatModel> chatModelProvider, AnswerProperties properties) {
        this.chatModelProvider = chatModelProvider;
        this.properties = properties;
    }

    /**
     * Returns true when a chat model is configured and answer generation is enabled.
     */
    public boolean isAvailable() {
        return properties.isEnabled() && chatModelProvider.getIfAvailable() != null;
    }

    /**
     * Asks the chat model to answer {@code question} from {@code context}.
     *
     * @return The trimmed answer text
     * @throws AnswerGenerationException if generation is unavailable, the call fails or the answer is empty
     */
    public String generate(String question, String context) {
        ChatModel chatModel = properties.isEnabled() ? chatModelProvider.getIfAvailable() : null;
        if (chatModel == null) {
            throw new AnswerGenerationException("Answer generation is not configured");
        }

        Prompt prompt = new Prompt(List.of(
                new SystemMessage(SYSTEM_PROMPT),
                new UserMessage(buildPrompt(question, context))
        ));

        ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (RuntimeException e) {
            throw new AnswerGenerationException("Chat model call failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new AnswerGenerationException("Chat model returned no result");
        }
        String answer = response.getResult().getOutput().getText();
        if (answer == null || answer.isBlank()) {
            throw new AnswerGenerationException("Chat model returned an empty answer");
        }
        log.debug("Generated answer of {} characters", answer.length());
        return answer.trim();
    }

    String buildPrompt(String question, String context) {
        return """
                You are a helpful assistant for API documentation. \
                Use the following context to answer the user's question. \
                If the context doesn't contain the answer, say so.

                CONTEXT:
                %s

                QUESTION: %s

                Please provide a clear, helpful answer based on the context above:""".formatted(context, question);
    }
}
