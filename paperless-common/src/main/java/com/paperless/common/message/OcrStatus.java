package com.paperless.common.message;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum OcrStatus {
    @JsonProperty("Completed")
    COMPLETED,

    @JsonProperty("Failed")
    FAILED
}
