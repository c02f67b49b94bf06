package com.gt.recall.generation;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "recall.generation.openai")
public record OpenAiProps(
        String baseUrl,
        String model,
        String apiKey,
        Integer maxTokens,
        Double temperature,
        Integer maxSentenceLength
) {
}
