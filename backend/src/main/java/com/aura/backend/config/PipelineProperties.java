package com.aura.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Data
@Validated
public class PipelineProperties {

    // When false an execution failure ends the run in FAILED instead of switching to the simulator
    private boolean fallbackEnabled = true;

    private Ingestion ingestion = new Ingestion();
    private Scorer scorer = new Scorer();
    private Simulation simulation = new Simulation();
    private ModelInfo model = new ModelInfo();

    @Data
    public static class Ingestion {
        @NotBlank
        private String idColumn = "customerID";

        private List<String> idAliases = new ArrayList<>(List.of("customer_id", "customerid", "id"));

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minQualityScore = 0.8;

        private List<String> numericColumns = new ArrayList<>(List.of("tenure", "MonthlyCharges", "TotalCharges"));
    }

    @Data
    public static class Scorer {
        @NotBlank
        private String workingDirectory = "./newai";

        @NotEmpty
        private List<String> command = new ArrayList<>(List.of("python3", "main.py"));

        @NotBlank
        private String inputFile = "customers.csv";

        @NotBlank
        private String outputFile = "predictions.csv";

        private String logFile = "scorer.log";

        private List<String> requiredFiles = new ArrayList<>(List.of("main.py"));

        private Duration timeout = Duration.ofMinutes(2);

        private Duration retryAfter = Duration.ofSeconds(5);
    }

    @Data
    public static class Simulation {
        private long seed = 42L;

        @DecimalMin("0.0")
        @DecimalMax("0.5")
        private double jitter = 0.05;
    }

    @Data
    public static class ModelInfo {
        private String name = "A.U.R.A Churn Prediction Model";
        private String type = "Machine Learning";
        private String version = "2.0.0";
        private List<String> features = new ArrayList<>(List.of(
                "Customer Demographics",
                "Service Usage Patterns",
                "Contract Information",
                "Payment History",
                "Billing Patterns"
        ));
    }
}
