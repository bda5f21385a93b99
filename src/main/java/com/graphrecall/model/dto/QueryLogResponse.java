package com.graphrecall.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryLogResponse {
    private String id;
    private String question;
    private int resultCount;
    private List<String> entities;
    private String relationship;
    private String searchDescription;
    private LocalDateTime createdAt;
}
