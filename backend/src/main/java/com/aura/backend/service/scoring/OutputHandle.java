package com.aura.backend.service.scoring;

import java.io.IOException;
import java.io.Reader;

/**
 * Reference to an artifact produced by the scoring process.
 */
public interface OutputHandle {

    String location();

    Reader openReader() throws IOException;
}
