package com.sentiment_retraining.controller;

import com.sentiment_retraining.dto.inference.BatchPredictionRequest;
import com.sentiment_retraining.dto.inference.BatchPredictionResponse;
import com.sentiment_retraining.dto.inference.HealthResponse;
import com.sentiment_retraining.dto.inference.ModelInfoResponse;
import com.sentiment_retraining.dto.inference.PredictionRequest;
import com.sentiment_retraining.dto.inference.PredictionResponse;
import com.sentiment_retraining.service.inference.InferenceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@Tag(name = "Inference", description = "Predict sentiment with the Production model")
public class InferenceController {

    private final InferenceService inferenceService;

    @Operation(summary = "Service health and model readiness")
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(inferenceService.health());
    }

    @Operation(summary = "Metadata of the loaded model")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Model metadata"),
            @ApiResponse(responseCode = "503", description = "No model loaded")
    })
    @GetMapping("/models/info")
    public ResponseEntity<ModelInfoResponse> modelInfo() {
        return ResponseEntity.ok(inferenceService.modelInfo());
    }

    @Operation(summary = "Reload the newest Production version")
    @PostMapping("/models/reload")
    public ResponseEntity<ModelInfoResponse> reload() {
        return ResponseEntity.ok(inferenceService.reload());
    }

    @Operation(summary = "Predict the sentiment of one text")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Prediction"),
            @ApiResponse(responseCode = "400", description = "Invalid text"),
            @ApiResponse(responseCode = "503", description = "No model loaded")
    })
    @PostMapping("/predict")
    public ResponseEntity<PredictionResponse> predict(@Valid @RequestBody PredictionRequest request) {
        return ResponseEntity.ok(inferenceService.predict(request.getText()));
    }

    @Operation(summary = "Predict the sentiment of a batch of texts")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Predictions in input order"),
            @ApiResponse(responseCode = "400", description = "Invalid or oversized batch"),
            @ApiResponse(responseCode = "503", description = "No model loaded")
    })
    @PostMapping("/predict_batch")
    public ResponseEntity<BatchPredictionResponse> predictBatch(@Valid @RequestBody BatchPredictionRequest request) {
        return ResponseEntity.ok(inferenceService.predictBatch(request.getTexts()));
    }
}
