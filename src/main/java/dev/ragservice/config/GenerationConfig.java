package dev.ragservice.config;

import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the streaming chat model used for summaries.
 *
 * <p>All supported providers speak the OpenAI chat-completions protocol, so a single
 * {@link OpenAiStreamingChatModel} is pointed at the provider's endpoint:
 *
 * <ul>
 *   <li>{@code groq} - {@code https://api.groq.com/openai/v1}
 *   <li>{@code openai} - the client's default endpoint
 *   <li>{@code ollama} - {@code ${ragservice.llm.ollama-base-url}/v1}, no API key needed
 * </ul>
 *
 * <p>The HTTP timeout is tied to the summary budget so an abandoned request does not outlive it
 * by much.
 */
@Configuration
public class GenerationConfig {

    private static final Logger log = LoggerFactory.getLogger(GenerationConfig.class);

    static final String GROQ_BASE_URL = "https://api.groq.com/openai/v1";

    /**
     * Provides the streaming chat model for the configured provider.
     *
     * @param provider      one of {@code groq}, {@code openai}, {@code ollama}
     * @param apiKey        the provider API key (ignored for ollama)
     * @param model         the model name
     * @param ollamaBaseUrl base URL of a local Ollama server
     * @param maxTokens     upper bound on generated tokens
     * @param temperature   sampling temperature
     * @param budget        the summary generation budget
     * @return a streaming chat model
     */
    @Bean
    public StreamingChatModel streamingChatModel(
            @Value("${ragservice.llm.provider:groq}") String provider,
            @Value("${ragservice.llm.api-key:not-configured}") String apiKey,
            @Value("${ragservice.llm.model:llama3-8b-8192}") String model,
            @Value("${ragservice.llm.ollama-base-url:http://localhost:11434}") String ollamaBaseUrl,
            @Value("${ragservice.llm.max-tokens:200}") int maxTokens,
            @Value("${ragservice.llm.temperature:0.7}") double temperature,
            @Value("${ragservice.summary.budget:2s}") Duration budget) {
        var builder = OpenAiStreamingChatModel.builder()
                .modelName(model)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .timeout(budget.plusSeconds(1));

        switch (provider.toLowerCase(Locale.ROOT)) {
            case "groq" -> builder.baseUrl(GROQ_BASE_URL).apiKey(apiKey);
            case "openai" -> builder.apiKey(apiKey);
            case "ollama" -> builder.baseUrl(ollamaBaseUrl + "/v1").apiKey("ollama");
            default -> throw new IllegalStateException(
                    "ragservice.llm.provider must be one of groq, openai, ollama, got: " + provider);
        }

        log.info("Summary model configured: provider={}, model={}", provider, model);
        return builder.build();
    }
}
