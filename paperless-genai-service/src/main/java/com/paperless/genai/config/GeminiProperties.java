package com.paperless.genai.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Gemini summarization settings, bound from {@code gemini.*}. Invalid values fail startup.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "gemini")
public class GeminiProperties {

    @NotBlank(message = "Gemini API key is required")
    private String apiKey;

    @NotBlank
    private String model = "gemini-2.0-flash";

    @Min(value = 1, message = "maxRetries must be between 1 and 10")
    @Max(value = 10, message = "maxRetries must be between 1 and 10")
    private int maxRetries = 3;

    @Min(value = 5, message = "timeoutSeconds must be between 5 and 120")
    @Max(value = 120, message = "timeoutSeconds must be between 5 and 120")
    private int timeoutSeconds = 30;

    @NotBlank
    private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
}
