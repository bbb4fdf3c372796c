package uk.gegc.revisionhelper.features.revision.infra.persistence;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import uk.gegc.revisionhelper.features.revision.domain.model.QuestionStyle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Entity
@Getter
@Setter
@Table(name = "revisions")
public class RevisionEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "user_id", updatable = false)
    private String userId;

    @Column(name = "session_id", updatable = false)
    private String sessionId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "subject", nullable = false)
    private String subject;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "topics")
    private List<String> topics = new ArrayList<>();

    @Lob
    @Column(name = "description")
    private String description;

    @Column(name = "desired_question_count", nullable = false)
    private Integer desiredQuestionCount;

    @Column(name = "accuracy_threshold", nullable = false)
    private Integer accuracyThreshold;

    @Enumerated(EnumType.STRING)
    @Column(name = "question_style", nullable = false, length = 30)
    private QuestionStyle questionStyle;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "extracted_texts")
    private Map<String, String> extractedTexts = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "uploaded_files")
    private List<String> uploadedFiles = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
