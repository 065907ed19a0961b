package com.sentiment_retraining.controller;

import com.sentiment_retraining.dto.pipeline.PipelineRunDTO;
import com.sentiment_retraining.dto.response.GenericResponse;
import com.sentiment_retraining.service.pipeline.AsyncPipelineLauncher;
import com.sentiment_retraining.service.pipeline.PipelineRunService;
import com.sentiment_retraining.service.pipeline.RetrainingOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/pipeline/runs")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Retraining Pipeline", description = "Trigger and follow retraining cycles")
public class PipelineController {

    private final PipelineRunService pipelineRunService;
    private final AsyncPipelineLauncher asyncPipelineLauncher;
    private final RetrainingOrchestrator retrainingOrchestrator;

    @Operation(summary = "Start a retraining cycle in the background")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Cycle accepted"),
            @ApiResponse(responseCode = "500", description = "Cycle could not be started")
    })
    @PostMapping
    public ResponseEntity<GenericResponse<PipelineRunDTO>> startRun(@RequestParam(defaultValue = "false") boolean forceRetrain) {
        String runId = pipelineRunService.initRun(forceRetrain);
        asyncPipelineLauncher.launch(runId, forceRetrain);
        log.info("Retraining cycle {} accepted (forceRetrain={})", runId, forceRetrain);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(GenericResponse.success("Retraining cycle started", pipelineRunService.getRun(runId)));
    }

    @Operation(summary = "Run a retraining cycle and wait for its outcome")
    @PostMapping("/sync")
    public ResponseEntity<GenericResponse<PipelineRunDTO>> runSync(@RequestParam(defaultValue = "false") boolean forceRetrain) {
        PipelineRunDTO result = retrainingOrchestrator.run(forceRetrain);
        return ResponseEntity.ok(GenericResponse.success("Retraining cycle finished", result));
    }

    @Operation(summary = "Get the state of a retraining cycle")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Cycle found"),
            @ApiResponse(responseCode = "404", description = "Cycle not found")
    })
    @GetMapping("/{runId}")
    public ResponseEntity<GenericResponse<PipelineRunDTO>> getRun(@PathVariable String runId) {
        return ResponseEntity.ok(GenericResponse.success("Pipeline run retrieved successfully", pipelineRunService.getRun(runId)));
    }

    @Operation(summary = "List the most recent retraining cycles")
    @GetMapping
    public ResponseEntity<GenericResponse<List<PipelineRunDTO>>> listRuns() {
        return ResponseEntity.ok(GenericResponse.success("Pipeline runs retrieved successfully", pipelineRunService.listRecentRuns()));
    }
}
