package com.aura.backend.service;

import com.aura.backend.model.ValidatedTable;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Last successfully validated upload, scored by a run request that does not carry its own file.
 */
@Component
public class UploadedTableStore {

    private final AtomicReference<ValidatedTable> staged = new AtomicReference<>();

    public void stage(ValidatedTable table) {
        staged.set(table);
    }

    public Optional<ValidatedTable> getStaged() {
        return Optional.ofNullable(staged.get());
    }
}
