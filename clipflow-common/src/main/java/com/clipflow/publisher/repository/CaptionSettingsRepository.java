package com.clipflow.publisher.repository;

import com.clipflow.publisher.model.CaptionSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CaptionSettingsRepository extends JpaRepository<CaptionSettings, Long> {
}
