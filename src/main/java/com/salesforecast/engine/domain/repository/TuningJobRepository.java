package com.salesforecast.engine.domain.repository;

import com.salesforecast.engine.domain.model.TuningJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TuningJobRepository extends JpaRepository<TuningJob, Long> {

    Optional<TuningJob> findFirstByCategoryAndStatusIn(String category, List<TuningJob.Status> statuses);

    @Query("SELECT j FROM TuningJob j " +
            "WHERE (:status IS NULL OR j.status = :status) " +
            "AND (:category IS NULL OR j.category = :category) " +
            "ORDER BY j.createdAt DESC")
    List<TuningJob> search(@Param("status") TuningJob.Status status,
                           @Param("category") String category);
}
