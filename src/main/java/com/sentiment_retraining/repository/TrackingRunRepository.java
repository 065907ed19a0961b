package com.sentiment_retraining.repository;

import com.sentiment_retraining.entity.TrackingRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TrackingRunRepository extends JpaRepository<TrackingRun, String> {

    List<TrackingRun> findByExperimentNameOrderByStartedAtDesc(String experimentName);
}
