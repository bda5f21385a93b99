package com.graphrecall.model.dto;

import com.graphrecall.model.graph.IngestionReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Saved statement, plus the ingestion summary when it was just recorded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatementResponse {
    private String id;
    private String content;
    private String category;
    private String tags;
    private LocalDateTime createdAt;
    private IngestionReport ingestion;
}
