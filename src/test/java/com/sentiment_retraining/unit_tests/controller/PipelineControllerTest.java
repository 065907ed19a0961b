package com.sentiment_retraining.unit_tests.controller;

import com.sentiment_retraining.controller.PipelineController;
import com.sentiment_retraining.dto.pipeline.PipelineRunDTO;
import com.sentiment_retraining.enumeration.PipelineOutcomeEnum;
import com.sentiment_retraining.enumeration.PipelineStateEnum;
import com.sentiment_retraining.exception.GlobalExceptionHandler;
import com.sentiment_retraining.service.pipeline.AsyncPipelineLauncher;
import com.sentiment_retraining.service.pipeline.PipelineRunService;
import com.sentiment_retraining.service.pipeline.RetrainingOrchestrator;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PipelineControllerTest {

    @Mock
    private PipelineRunService pipelineRunService;
    @Mock
    private AsyncPipelineLauncher asyncPipelineLauncher;
    @Mock
    private RetrainingOrchestrator retrainingOrchestrator;

    @InjectMocks
    private PipelineController pipelineController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(pipelineController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should accept a forced cycle and launch it in the background")
    void startRun_Accepted() throws Exception {
        // Given
        when(pipelineRunService.initRun(true)).thenReturn("run-1");
        when(pipelineRunService.getRun("run-1")).thenReturn(PipelineRunDTO.builder()
                .runId("run-1").forceRetrain(true).state(PipelineStateEnum.PENDING).build());

        // When/Then
        mockMvc.perform(post("/api/pipeline/runs").param("forceRetrain", "true"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.runId").value("run-1"))
                .andExpect(jsonPath("$.data.state").value("PENDING"));

        verify(asyncPipelineLauncher).launch("run-1", true);
        verifyNoInteractions(retrainingOrchestrator);
    }

    @Test
    void runSync_ReturnsOutcome() throws Exception {
        when(retrainingOrchestrator.run(false)).thenReturn(PipelineRunDTO.builder()
                .runId("run-2").state(PipelineStateEnum.DONE).outcome(PipelineOutcomeEnum.SKIPPED).build());

        mockMvc.perform(post("/api/pipeline/runs/sync"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.outcome").value("SKIPPED"));
    }

    @Test
    void getRun_NotFound() throws Exception {
        when(pipelineRunService.getRun("missing")).thenThrow(new EntityNotFoundException("Pipeline run missing not found"));

        mockMvc.perform(get("/api/pipeline/runs/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    void listRuns() throws Exception {
        when(pipelineRunService.listRecentRuns()).thenReturn(List.of(
                PipelineRunDTO.builder().runId("a").build(),
                PipelineRunDTO.builder().runId("b").build()));

        mockMvc.perform(get("/api/pipeline/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2));
    }
}
