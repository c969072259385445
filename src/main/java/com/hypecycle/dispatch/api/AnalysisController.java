package com.hypecycle.dispatch.api;

import com.hypecycle.core.engine.ClassificationEngine;
import com.hypecycle.core.engine.ClassificationFailedException;
import com.hypecycle.core.engine.InsufficientDataException;
import com.hypecycle.core.model.ClassificationResult;
import com.hypecycle.core.model.InvalidKeywordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for keyword classification.
 */
@RestController
@RequestMapping("/api")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final ClassificationEngine classificationEngine;

    public AnalysisController(ClassificationEngine classificationEngine) {
        this.classificationEngine = classificationEngine;
    }

    /**
     * POST /api/analyze: classify a keyword, serving a cached result when one is live.
     * Runs synchronously; a fresh analysis can take up to the collector timeout plus LLM time.
     */
    @PostMapping("/analyze")
    public ResponseEntity<ClassificationResult> analyze(@RequestBody AnalyzeRequest request) {
        String keyword = request != null ? request.keyword() : null;
        log.info("Analysis requested for '{}'", keyword);
        return ResponseEntity.ok(classificationEngine.classify(keyword));
    }

    @ExceptionHandler(InvalidKeywordException.class)
    public ResponseEntity<Map<String, Object>> invalidKeyword(InvalidKeywordException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<Map<String, Object>> insufficientData(InsufficientDataException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("reasons", e.getReasons());
        body.put("collectors_succeeded", e.getCollectorsSucceeded());
        body.put("minimum_required", e.getMinimumRequired());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(ClassificationFailedException.class)
    public ResponseEntity<Map<String, Object>> classificationFailed(ClassificationFailedException e) {
        log.error("Analysis failed ({}): {}", e.getKind(), e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Analysis failed: " + e.getMessage());
        body.put("errors", e.getErrors());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }
}
