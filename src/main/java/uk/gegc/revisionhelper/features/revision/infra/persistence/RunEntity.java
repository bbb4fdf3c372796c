package uk.gegc.revisionhelper.features.revision.infra.persistence;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.revisionhelper.features.revision.domain.model.RunStatus;

import java.time.Instant;

@Entity
@Getter
@Setter
@Table(name = "revision_runs")
public class RunEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "revision_id", nullable = false, updatable = false)
    private String revisionId;

    @Column(name = "user_id", updatable = false)
    private String userId;

    @Column(name = "session_id", updatable = false)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private RunStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
