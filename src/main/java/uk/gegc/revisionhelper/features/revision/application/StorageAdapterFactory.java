package uk.gegc.revisionhelper.features.revision.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.revisionhelper.features.revision.infra.storage.StorageBackend;
import uk.gegc.revisionhelper.shared.config.RevisionProperties;
import uk.gegc.revisionhelper.shared.security.CallerIdentity;

import java.time.Clock;

/**
 * Hands out a {@link StorageAdapter} bound to one caller over the active backend.
 */
@Component
@RequiredArgsConstructor
public class StorageAdapterFactory {

    private final StorageBackend backend;
    private final RunSummaryCalculator calculator;
    private final RevisionProperties properties;
    private final Clock clock;

    public StorageAdapter forCaller(CallerIdentity caller) {
        if (caller == null) {
            throw new IllegalArgumentException("Caller identity is required");
        }
        return new StorageAdapter(backend, caller, calculator, properties, clock);
    }

    public String backendName() {
        return backend.name();
    }
}
