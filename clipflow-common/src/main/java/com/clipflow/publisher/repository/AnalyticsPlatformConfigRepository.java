package com.clipflow.publisher.repository;

import com.clipflow.publisher.model.AnalyticsPlatformConfig;
import com.clipflow.publisher.model.Platform;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AnalyticsPlatformConfigRepository extends JpaRepository<AnalyticsPlatformConfig, Platform> {
}
