package com.phillippitts.culinara.presentation.controller;

import com.phillippitts.culinara.domain.QueryResponse;
import com.phillippitts.culinara.service.orchestration.QueryOrchestrator;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Thin HTTP entry point for recipe queries. Validation failures and invalid queries are mapped to
 * 400 by {@link com.phillippitts.culinara.presentation.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
class RecipeQueryController {

    private static final Logger LOG = LogManager.getLogger(RecipeQueryController.class);

    private final QueryOrchestrator orchestrator;

    RecipeQueryController(QueryOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/query")
    ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        LOG.debug("Query request received (diets={})", request.diets());
        return ResponseEntity.ok(orchestrator.answer(request.toQuery()));
    }
}
