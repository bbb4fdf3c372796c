package uk.gegc.revisionhelper.features.revision.domain.model;

import java.time.Instant;

public record UserAccount(String id, String email, String name, Instant createdAt) {
}
