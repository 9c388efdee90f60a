package com.aura.backend.controller;

import com.aura.backend.config.PipelineProperties;
import com.aura.backend.dto.BatchResponse;
import com.aura.backend.dto.HealthResponse;
import com.aura.backend.dto.ModelInfoResponse;
import com.aura.backend.dto.PipelineStatusResponse;
import com.aura.backend.dto.UploadResponse;
import com.aura.backend.exception.NotFoundException;
import com.aura.backend.exception.ValidationException;
import com.aura.backend.model.PipelineRunStatus;
import com.aura.backend.model.PredictionBatch;
import com.aura.backend.model.RunMode;
import com.aura.backend.model.RunOutcome;
import com.aura.backend.model.ValidatedTable;
import com.aura.backend.service.CsvTableCodec;
import com.aura.backend.service.PredictionPipelineService;
import com.aura.backend.service.PredictionResultStore;
import com.aura.backend.service.scoring.ScoringProcessOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/api/predictions")
@RequiredArgsConstructor
@Tag(name = "Predictions")
public class PredictionController {

    private final PredictionPipelineService pipelineService;
    private final PredictionResultStore resultStore;
    private final ScoringProcessOrchestrator orchestrator;
    private final CsvTableCodec csvTableCodec;
    private final PipelineProperties properties;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Validate and stage a customer CSV, optionally scoring it right away")
    public ResponseEntity<UploadResponse> upload(@RequestParam("file") MultipartFile file,
                                                 @RequestParam(value = "run", defaultValue = "false") boolean run,
                                                 @RequestParam(value = "mode", required = false) String mode) throws IOException {
        RunMode runMode = parseMode(mode);
        ValidatedTable table;
        try (InputStream input = requireContent(file).getInputStream()) {
            table = pipelineService.upload(input);
        }
        UploadResponse response = UploadResponse.builder()
                .success(true)
                .message("Successfully processed " + table.size() + " customers")
                .rowCount(table.size())
                .idColumn(table.idColumn())
                .columns(table.columns())
                .warnings(table.warnings())
                .qualityScore(table.qualityScore())
                .build();
        if (run) {
            response.setResults(BatchResponse.from(pipelineService.run(table, runMode)));
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/run")
    @Operation(summary = "Score the attached or last uploaded table and publish the batch")
    public ResponseEntity<BatchResponse> run(@RequestParam(value = "file", required = false) MultipartFile file,
                                             @RequestParam(value = "mode", required = false) String mode) throws IOException {
        RunMode runMode = parseMode(mode);
        RunOutcome outcome;
        if (file == null) {
            outcome = pipelineService.runStaged(runMode);
        } else {
            try (InputStream input = requireContent(file).getInputStream()) {
                outcome = pipelineService.run(input, runMode);
            }
        }
        return ResponseEntity.ok(BatchResponse.from(outcome));
    }

    @GetMapping("/current")
    @Operation(summary = "Current batch as JSON")
    public ResponseEntity<BatchResponse> current() {
        return ResponseEntity.ok(BatchResponse.from(requireBatch()));
    }

    @GetMapping(value = "/download", produces = "text/csv")
    @Operation(summary = "Current batch as CSV with identifier, probability and risk level")
    public ResponseEntity<byte[]> download() throws IOException {
        PredictionBatch batch = requireBatch();
        String csv = csvTableCodec.writePredictions(batch, properties.getIngestion().getIdColumn());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=predictions_ai_output.csv")
                .header("X-Prediction-Source", batch.source().getTag())
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }

    @GetMapping("/health")
    @Operation(summary = "Scoring process availability")
    public ResponseEntity<HealthResponse> health() {
        boolean available = orchestrator.isAvailable();
        return ResponseEntity.ok(HealthResponse.builder()
                .status(available ? "healthy" : "degraded")
                .scorerAvailable(available)
                .scorerBusy(orchestrator.isBusy())
                .fallbackEnabled(properties.isFallbackEnabled())
                .batchAvailable(resultStore.getCurrent().isPresent())
                .pipelineState(pipelineService.status().state())
                .version(properties.getModel().getVersion())
                .build());
    }

    @GetMapping("/status")
    @Operation(summary = "State of the most recent run")
    public ResponseEntity<PipelineStatusResponse> status() {
        PipelineRunStatus status = pipelineService.status();
        return ResponseEntity.ok(PipelineStatusResponse.builder()
                .runId(status.runId())
                .state(status.state())
                .source(status.source())
                .startedAt(status.startedAt())
                .completedAt(status.completedAt())
                .failureReason(status.failureReason())
                .message(status.message())
                .currentVersion(resultStore.currentVersion())
                .build());
    }

    @GetMapping("/model-info")
    @Operation(summary = "Scoring model metadata")
    public ResponseEntity<ModelInfoResponse> modelInfo() {
        PipelineProperties.ModelInfo model = properties.getModel();
        return ResponseEntity.ok(ModelInfoResponse.builder()
                .name(model.getName())
                .type(model.getType())
                .version(model.getVersion())
                .features(model.getFeatures())
                .available(orchestrator.isAvailable())
                .workingDirectory(properties.getScorer().getWorkingDirectory())
                .command(properties.getScorer().getCommand())
                .build());
    }

    private PredictionBatch requireBatch() {
        return resultStore.getCurrent()
                .orElseThrow(() -> new NotFoundException("No predictions available. Please run the model first."));
    }

    private static MultipartFile requireContent(MultipartFile file) {
        if (file.isEmpty()) {
            throw new ValidationException("Uploaded file is empty");
        }
        return file;
    }

    private static RunMode parseMode(String mode) {
        try {
            return RunMode.fromParameter(mode);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("Unsupported mode: " + mode + " (expected model or demo)");
        }
    }
}
