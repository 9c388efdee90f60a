package com.aura.backend.service.scoring;

import com.aura.backend.model.ValidatedTable;
import com.aura.backend.service.CsvTableCodec;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Hands the table over as {@code customers.csv} in the scorer's working directory and picks up
 * {@code predictions.csv} from the same place.
 */
@Slf4j
public class FileExchangeChannel implements ExchangeChannel {

    private final Path workingDirectory;
    private final String inputFile;
    private final String outputFile;
    private final CsvTableCodec codec;

    public FileExchangeChannel(Path workingDirectory, String inputFile, String outputFile, CsvTableCodec codec) {
        this.workingDirectory = workingDirectory;
        this.inputFile = inputFile;
        this.outputFile = outputFile;
        this.codec = codec;
    }

    @Override
    public Path workingDirectory() {
        return workingDirectory;
    }

    @Override
    public void publishInput(ValidatedTable table) throws IOException {
        Files.createDirectories(workingDirectory);
        Path target = workingDirectory.resolve(inputFile);
        Path staging = Files.createTempFile(workingDirectory, "input-", ".csv.tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(staging, StandardCharsets.UTF_8)) {
                codec.writeTable(table, writer);
            }
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(staging);
        }
        log.debug("Published {} customer rows to {}", table.size(), target);
    }

    @Override
    public void resetOutput() throws IOException {
        if (Files.deleteIfExists(workingDirectory.resolve(outputFile))) {
            log.debug("Removed stale {}", outputFile);
        }
    }

    @Override
    public Optional<OutputHandle> collectOutput() {
        Path output = workingDirectory.resolve(outputFile);
        if (!Files.isRegularFile(output)) {
            return Optional.empty();
        }
        return Optional.of(new FileOutputHandle(output));
    }

    record FileOutputHandle(Path path) implements OutputHandle {

        @Override
        public String location() {
            return path.toString();
        }

        @Override
        public Reader openReader() throws IOException {
            return Files.newBufferedReader(path, StandardCharsets.UTF_8);
        }
    }
}
