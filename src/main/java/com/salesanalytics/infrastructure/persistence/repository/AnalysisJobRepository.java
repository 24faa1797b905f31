package com.salesanalytics.infrastructure.persistence.repository;

import com.salesanalytics.infrastructure.persistence.entity.AnalysisJobEntity;
import com.salesanalytics.infrastructure.persistence.entity.AnalysisJobState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AnalysisJobRepository extends JpaRepository<AnalysisJobEntity, UUID> {

    /**
     * Oldest first, so uploads are analysed in submission order.
     */
    List<AnalysisJobEntity> findTop10ByStateOrderBySubmittedAtAsc(AnalysisJobState state);
}
