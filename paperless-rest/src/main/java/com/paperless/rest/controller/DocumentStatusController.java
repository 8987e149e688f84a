package com.paperless.rest.controller;

import com.paperless.common.dto.ApiResponse;
import com.paperless.rest.model.TrackedDocument;
import com.paperless.rest.service.DocumentStatusService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Current state of a document. Clients that missed SSE events re-fetch through here.
 */
@RestController
@RequestMapping("/api/v1/documents")
public class DocumentStatusController {

    @Autowired
    private DocumentStatusService documentStatusService;

    @GetMapping("/{documentId}")
    public ResponseEntity<ApiResponse<TrackedDocument>> getDocument(
            @PathVariable(name = "documentId") UUID documentId) {
        return ResponseEntity.ok(ApiResponse.ok(documentStatusService.get(documentId)));
    }
}
