package com.paperless.rest.controller;

import com.paperless.common.dto.ApiResponse;
import com.paperless.rest.dto.OcrJobRequest;
import com.paperless.rest.model.TrackedDocument;
import com.paperless.rest.service.OcrJobService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/ocr-jobs")
public class OcrJobController {

    @Autowired
    private OcrJobService ocrJobService;

    @PostMapping
    public ResponseEntity<ApiResponse<Map<String, Object>>> submit(@Valid @RequestBody OcrJobRequest request) {
        TrackedDocument document = ocrJobService.submit(request);

        Map<String, Object> data = Map.of(
                "jobId", document.id(),
                "fileName", document.fileName(),
                "status", document.status()
        );

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.accepted(data, "OCR job queued"));
    }
}
