package com.sentiment_retraining.controller;

import com.sentiment_retraining.dto.registry.ModelVersionDTO;
import com.sentiment_retraining.dto.response.GenericResponse;
import com.sentiment_retraining.enumeration.ModelStageEnum;
import com.sentiment_retraining.service.registry.ModelRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/registry/models")
@RequiredArgsConstructor
@Tag(name = "Model Registry", description = "Browse registered model versions")
public class ModelRegistryController {

    private final ModelRegistry modelRegistry;

    @Operation(summary = "List versions of a registered model, optionally filtered by stage")
    @GetMapping("/{name}/versions")
    public ResponseEntity<GenericResponse<List<ModelVersionDTO>>> listVersions(@PathVariable String name,
                                                                               @RequestParam(required = false) ModelStageEnum stage) {
        List<ModelVersionDTO> versions = stage == null
                ? modelRegistry.listVersions(name)
                : modelRegistry.getLatestVersions(name, stage);
        return ResponseEntity.ok(GenericResponse.success("Model versions retrieved successfully", versions));
    }

    @Operation(summary = "Get one version of a registered model")
    @GetMapping("/{name}/versions/{version}")
    public ResponseEntity<GenericResponse<ModelVersionDTO>> getVersion(@PathVariable String name, @PathVariable int version) {
        ModelVersionDTO found = modelRegistry.getVersion(name, version)
                .orElseThrow(() -> new EntityNotFoundException("Model version " + name + " v" + version + " not found"));
        return ResponseEntity.ok(GenericResponse.success("Model version retrieved successfully", found));
    }
}
