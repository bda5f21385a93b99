package com.graphrecall.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-user counters shown on the dashboard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsResponse {
    private String userId;
    private long totalStatements;
    private long totalQueries;
    private long thisWeekStatements;
    private long entityCount;
    private long relationshipCount;
}
