package com.paperless.rest.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.paperless.common.exception.DocumentNotFoundException;
import com.paperless.common.exception.GlobalExceptionHandler;
import com.paperless.rest.model.TrackedDocument;
import com.paperless.rest.service.DocumentStatusService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DocumentStatusControllerTest {

    @Mock
    private DocumentStatusService documentStatusService;

    @InjectMocks
    private DocumentStatusController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
    }

    @Test
    @DisplayName("Should return the current state of a document")
    void getDocument_shouldReturnStatus() throws Exception {
        UUID id = UUID.randomUUID();
        TrackedDocument document = TrackedDocument.pending(id, "scan.pdf", "uploads/scan.pdf")
                .ocrCompleted("Hello", OffsetDateTime.now())
                .withSummary("Greeting", OffsetDateTime.now());
        when(documentStatusService.get(id)).thenReturn(document);

        mockMvc.perform(get("/api/v1/documents/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(id.toString()))
                .andExpect(jsonPath("$.data.status").value("OCR_COMPLETED"))
                .andExpect(jsonPath("$.data.summary").value("Greeting"));
    }

    @Test
    @DisplayName("Should return 404 for an unknown document")
    void getDocument_shouldReturnNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(documentStatusService.get(id)).thenThrow(new DocumentNotFoundException(id));

        mockMvc.perform(get("/api/v1/documents/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("Should return 400 for a malformed document id")
    void getDocument_shouldRejectMalformedId() throws Exception {
        mockMvc.perform(get("/api/v1/documents/not-a-uuid"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(documentStatusService);
    }
}
