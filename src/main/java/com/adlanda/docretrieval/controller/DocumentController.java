package com.adlanda.docretrieval.controller;

import com.adlanda.docretrieval.model.ResetResponse;
import com.adlanda.docretrieval.model.UploadResponse;
import com.adlanda.docretrieval.service.IngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * REST controller for uploading documents and resetting the store.
 */
@RestController
@RequestMapping("/api/v1")
public class DocumentController {

    private static final Logger log = LoggerFactory.getLogger(DocumentController.class);

    private final IngestionService ingestionService;

    public DocumentController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> upload(@RequestParam("file") MultipartFile file) throws IOException {
        log.info("Received upload '{}' ({} bytes)", file.getOriginalFilename(), file.getSize());
        UploadResponse response = ingestionService.ingestFile(file.getOriginalFilename(), file.getBytes());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/reset-vector-store")
    public ResponseEntity<ResetResponse> reset() {
        return ResponseEntity.ok(ingestionService.resetStore());
    }
}
