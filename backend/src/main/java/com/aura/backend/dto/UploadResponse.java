package com.aura.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadResponse {
    private boolean success;
    private String message;
    private int rowCount;
    private String idColumn;
    private List<String> columns;
    private List<String> warnings;
    private double qualityScore;
    private BatchResponse results;
}
