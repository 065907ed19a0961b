package com.sentiment_retraining.service.pipeline;

import com.sentiment_retraining.dto.pipeline.PipelineRunDTO;
import com.sentiment_retraining.entity.PipelineRun;
import com.sentiment_retraining.enumeration.DeploymentNotificationStatusEnum;
import com.sentiment_retraining.enumeration.PipelineOutcomeEnum;
import com.sentiment_retraining.enumeration.PipelineStateEnum;
import com.sentiment_retraining.repository.PipelineRunRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Persists the state of every retraining cycle so callers can follow it while it runs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineRunService {

    private final PipelineRunRepository pipelineRunRepository;
    private final ModelMapper modelMapper;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public String initRun(boolean forceRetrain) {
        String runId = UUID.randomUUID().toString();
        pipelineRunRepository.save(PipelineRun.builder()
                .runId(runId)
                .forceRetrain(forceRetrain)
                .state(PipelineStateEnum.PENDING)
                .startedAt(ZonedDateTime.now())
                .build());
        return runId;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void moveTo(String runId, PipelineStateEnum state) {
        PipelineRun run = getOrThrow(runId);
        if (run.getState() != null && run.getState().isTerminal()) {
            throw new IllegalStateException("Pipeline run " + runId + " already finished in state " + run.getState());
        }
        log.info("➡️ [{}] {} -> {}", runId, run.getState(), state);
        run.setState(state);
        pipelineRunRepository.save(run);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordTraining(String runId, String trainingRunId, Double candidateAccuracy) {
        PipelineRun run = getOrThrow(runId);
        run.setTrainingRunId(trainingRunId);
        run.setCandidateAccuracy(candidateAccuracy);
        pipelineRunRepository.save(run);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PipelineRunDTO complete(String runId, PipelineOutcomeEnum outcome, Integer registeredVersion,
                                   DeploymentNotificationStatusEnum notificationStatus) {
        PipelineRun run = getOrThrow(runId);
        run.setState(PipelineStateEnum.DONE);
        run.setOutcome(outcome);
        run.setRegisteredVersion(registeredVersion);
        run.setNotificationStatus(notificationStatus);
        run.setFinishedAt(ZonedDateTime.now());
        log.info("🏁 [{}] finished with outcome {}", runId, outcome);
        return toDto(pipelineRunRepository.save(run));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PipelineRunDTO fail(String runId, String errorCode, Integer registeredVersion) {
        PipelineRun run = getOrThrow(runId);
        run.setState(PipelineStateEnum.FAILED);
        run.setOutcome(PipelineOutcomeEnum.FAILED);
        run.setErrorCode(errorCode);
        run.setRegisteredVersion(registeredVersion);
        run.setFinishedAt(ZonedDateTime.now());
        log.warn("🛑 [{}] failed with {}", runId, errorCode);
        return toDto(pipelineRunRepository.save(run));
    }

    @Transactional(readOnly = true)
    public PipelineRunDTO getRun(String runId) {
        return toDto(getOrThrow(runId));
    }

    @Transactional(readOnly = true)
    public List<PipelineRunDTO> listRecentRuns() {
        return pipelineRunRepository.findTop50ByOrderByStartedAtDesc().stream().map(this::toDto).toList();
    }

    private PipelineRun getOrThrow(String runId) {
        return pipelineRunRepository.findById(runId)
                .orElseThrow(() -> new EntityNotFoundException("Pipeline run " + runId + " not found"));
    }

    private PipelineRunDTO toDto(PipelineRun run) {
        return modelMapper.map(run, PipelineRunDTO.class);
    }
}
