package com.aura.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelInfoResponse {
    private String name;
    private String type;
    private String version;
    private List<String> features;
    private boolean available;
    private String workingDirectory;
    private List<String> command;
}
