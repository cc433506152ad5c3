package com.adlanda.docretrieval.controller;

import com.adlanda.docretrieval.model.QueryRequest;
import com.adlanda.docretrieval.model.QueryResponse;
import com.adlanda.docretrieval.service.RetrievalService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for querying the vector store.
 */
@RestController
@RequestMapping("/api/v1")
public class QueryController {

    private final RetrievalService retrievalService;

    public QueryController(RetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    /**
     * Retrieves the chunks closest to a question.
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        QueryResponse response = retrievalService.query(request.question(), request.maxResults());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/sources")
    public ResponseEntity<Map<String, Object>> getSources() {
        int total = retrievalService.getIndexSize();
        return ResponseEntity.ok(Map.of(
                "totalVectors", total,
                "documents", retrievalService.getDocumentNames(),
                "status", total > 0 ? "indexed" : "empty"
        ));
    }
}
