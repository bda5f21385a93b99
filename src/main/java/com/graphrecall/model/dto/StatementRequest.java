package com.graphrecall.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for recording a statement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatementRequest {

    @NotBlank(message = "Content is required")
    @Size(max = 4000, message = "Content cannot exceed 4000 characters")
    private String content;

    private String category;

    private String tags;
}
