package com.aura.backend.dto;

import com.aura.backend.model.PipelineState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {
    private String status;
    private boolean scorerAvailable;
    private boolean scorerBusy;
    private boolean fallbackEnabled;
    private boolean batchAvailable;
    private PipelineState pipelineState;
    private String version;
}
