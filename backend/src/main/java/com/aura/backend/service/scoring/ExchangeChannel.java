package com.aura.backend.service.scoring;

import com.aura.backend.model.ValidatedTable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Transport between the orchestrator and the external scoring process. Only the orchestrator touches the
 * channel, and only while it holds the single scoring permit.
 */
public interface ExchangeChannel {

    /**
     * Directory the scoring process runs in.
     */
    Path workingDirectory();

    void publishInput(ValidatedTable table) throws IOException;

    /**
     * Removes any artifact left by an earlier run so a stale file is never mistaken for fresh output.
     */
    void resetOutput() throws IOException;

    Optional<OutputHandle> collectOutput() throws IOException;
}
