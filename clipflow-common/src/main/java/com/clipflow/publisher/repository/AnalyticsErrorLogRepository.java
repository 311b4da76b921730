package com.clipflow.publisher.repository;

import com.clipflow.publisher.model.AnalyticsErrorLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AnalyticsErrorLogRepository extends JpaRepository<AnalyticsErrorLog, Long> {
    List<AnalyticsErrorLog> findTop50ByResolvedFalseOrderByCreatedAtDesc();
}
