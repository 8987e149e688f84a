package com.paperless.rest.dto;

import jakarta.validation.constraints.NotBlank;

public record OcrJobRequest(
        @NotBlank(message = "fileName is required") String fileName,
        @NotBlank(message = "filePath is required") String filePath
) {
}
