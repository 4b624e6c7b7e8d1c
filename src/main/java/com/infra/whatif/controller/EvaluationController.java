package com.infra.whatif.controller;

import com.infra.whatif.model.EvaluationRequest;
import com.infra.whatif.model.EvaluationResult;
import com.infra.whatif.service.DeploymentEvaluationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/deployments")
@Tag(name = "Deployments", description = "Evaluate What-If output for deployment safety")
public class EvaluationController {

    private final DeploymentEvaluationService evaluationService;

    public EvaluationController(DeploymentEvaluationService evaluationService) {
        this.evaluationService = evaluationService;
    }

    @Operation(summary = "Evaluate a What-If report",
            description = "Classifies the What-If changes, marks changes matching noise phrases as noise, " +
                    "excludes low-confidence and noise changes, re-assesses risk over the retained changes, " +
                    "and compares the drift, intent and operations buckets to their thresholds. " +
                    "The intent bucket is only assessed when a PR title or description is supplied.")
    @PostMapping("/evaluate")
    public ResponseEntity<EvaluationResult> evaluate(@RequestBody EvaluationRequest request) {
        if (request.getWhatIfContent() == null || request.getWhatIfContent().isBlank()) {
            throw new InvalidRequestFieldException("whatIfContent", "No What-If output received. Input is empty.");
        }

        EvaluationResult result = evaluationService.evaluate(request);
        return ResponseEntity.ok(result);
    }
}
