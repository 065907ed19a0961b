package com.sentiment_retraining.repository;

import com.sentiment_retraining.entity.ModelVersion;
import com.sentiment_retraining.enumeration.ModelStageEnum;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ModelVersionRepository extends JpaRepository<ModelVersion, Integer> {

    Optional<ModelVersion> findByNameAndVersionNumber(String name, Integer versionNumber);

    List<ModelVersion> findByNameAndStageOrderByVersionNumberDesc(String name, ModelStageEnum stage);

    List<ModelVersion> findByNameOrderByVersionNumberDesc(String name);

    /**
     * Locks every version of a registered model. Stage transitions and registrations for one
     * model name are serialized through this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM ModelVersion v WHERE v.name = :name ORDER BY v.versionNumber DESC")
    List<ModelVersion> lockAllByName(@Param("name") String name);
}
