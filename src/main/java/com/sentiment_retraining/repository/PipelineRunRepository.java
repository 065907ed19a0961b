package com.sentiment_retraining.repository;

import com.sentiment_retraining.entity.PipelineRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PipelineRunRepository extends JpaRepository<PipelineRun, String> {

    List<PipelineRun> findTop50ByOrderByStartedAtDesc();
}
