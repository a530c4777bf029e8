package com.adlanda.channelknowledge.controller;

import com.adlanda.channelknowledge.model.QueryRequest;
import com.adlanda.channelknowledge.model.RetrievalResponse;
import com.adlanda.channelknowledge.service.retrieval.RetrievalService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for querying the knowledge base.
 */
@RestController
@RequestMapping("/api/v1")
public class QueryController {

    private final RetrievalService retrievalService;

    public QueryController(RetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    /**
     * Query for snippets relevant to a question.
     *
     * @param request the question, result limit and optional category
     * @return snippets ranked by similarity plus freshness
     */
    @PostMapping("/query")
    public ResponseEntity<RetrievalResponse> query(@Valid @RequestBody QueryRequest request) {
        RetrievalResponse response = retrievalService.query(request.question(), request.category(), request.maxResults());
        return ResponseEntity.ok(response);
    }

    /**
     * Get index statistics.
     */
    @GetMapping("/sources")
    public ResponseEntity<Map<String, Object>> getSources() {
        long total = retrievalService.getIndexSize();
        return ResponseEntity.ok(Map.of(
                "totalEntries", total,
                "byCategory", retrievalService.getCategoryCounts(),
                "status", total > 0 ? "indexed" : "empty"
        ));
    }
}
