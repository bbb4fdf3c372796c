package uk.gegc.revisionhelper.features.revision.infra.persistence;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import uk.gegc.revisionhelper.features.revision.domain.model.QuestionStyle;

import java.util.ArrayList;
import java.util.List;

@Entity
@Getter
@Setter
@Table(name = "run_questions")
public class QuestionEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "run_id", nullable = false, updatable = false)
    private String runId;

    @Lob
    @Column(name = "question_text", nullable = false)
    private String questionText;

    @Column(name = "question_index", nullable = false)
    private Integer questionIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "question_style", nullable = false, length = 30)
    private QuestionStyle questionStyle;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "options")
    private List<String> options = new ArrayList<>();

    @Column(name = "correct_answer_index")
    private Integer correctAnswerIndex;

    @Lob
    @Column(name = "rationale")
    private String rationale;
}
