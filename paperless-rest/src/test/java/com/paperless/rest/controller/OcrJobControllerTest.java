package com.paperless.rest.controller;

import com.paperless.common.exception.GlobalExceptionHandler;
import com.paperless.common.exception.MessagePublishException;
import com.paperless.rest.dto.OcrJobRequest;
import com.paperless.rest.model.TrackedDocument;
import com.paperless.rest.service.OcrJobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class OcrJobControllerTest {

    @Mock
    private OcrJobService ocrJobService;

    @InjectMocks
    private OcrJobController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should accept a job and return its id")
    void submit_shouldReturnAccepted() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(ocrJobService.submit(new OcrJobRequest("scan.pdf", "uploads/scan.pdf")))
                .thenReturn(TrackedDocument.pending(jobId, "scan.pdf", "uploads/scan.pdf"));

        mockMvc.perform(post("/api/v1/ocr-jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileName\":\"scan.pdf\",\"filePath\":\"uploads/scan.pdf\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.jobId").value(jobId.toString()))
                .andExpect(jsonPath("$.data.status").value("OCR_PENDING"));
    }

    @Test
    @DisplayName("Should reject a request without a file path")
    void submit_shouldRejectBlankFields() throws Exception {
        mockMvc.perform(post("/api/v1/ocr-jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileName\":\"scan.pdf\",\"filePath\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verifyNoInteractions(ocrJobService);
    }

    @Test
    @DisplayName("Should answer 503 when the broker rejects the publish")
    void submit_shouldReturnServiceUnavailable() throws Exception {
        when(ocrJobService.submit(any()))
                .thenThrow(new MessagePublishException("Failed to queue OCR job", new IOException("down")));

        mockMvc.perform(post("/api/v1/ocr-jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileName\":\"scan.pdf\",\"filePath\":\"uploads/scan.pdf\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value(503));
    }
}
