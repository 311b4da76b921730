package com.clipflow.publisher.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@NoArgsConstructor
@Entity
@Table(name = "analytics_errors")
public class AnalyticsErrorLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    private Platform platform;

    private String errorType;

    @Column(length = 2000)
    private String errorMessage;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> errorDetails;

    private boolean resolved;

    private LocalDateTime createdAt;

    public AnalyticsErrorLog(Platform platform, String errorType, String errorMessage,
                             Map<String, Object> errorDetails, LocalDateTime createdAt) {
        this.platform = platform;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.errorDetails = errorDetails;
        this.createdAt = createdAt;
    }
}
