package com.graphrecall.model.dto;

import com.graphrecall.model.graph.RetrievalStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for an answered question.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerResponse {
    private String question;
    private RetrievalStatus status;
    private String answer;
    private List<String> statements;
    private List<String> matchedEntities;
    private List<String> entities;
    private String relationship;
    private String searchDescription;
}
