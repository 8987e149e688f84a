package com.paperless.genai.config;

import com.paperless.genai.service.GeminiSummarizer;
import com.paperless.genai.service.TextSummarizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Slf4j
@Configuration
@EnableConfigurationProperties(GeminiProperties.class)
public class GeminiConfig {

    @Bean
    public WebClient geminiWebClient(WebClient.Builder builder) {
        return builder
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();
    }

    /**
     * Summarizer used by the GenAI worker. Swapping providers means swapping this bean.
     */
    @Bean
    public TextSummarizer textSummarizer(WebClient geminiWebClient, GeminiProperties properties) {
        log.info("Text summarization: Google Gemini ({}), {} retries, {}s timeout",
                properties.getModel(), properties.getMaxRetries(), properties.getTimeoutSeconds());
        return new GeminiSummarizer(geminiWebClient, properties);
    }
}
