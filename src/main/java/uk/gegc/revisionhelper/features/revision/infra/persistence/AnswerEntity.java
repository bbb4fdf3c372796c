package uk.gegc.revisionhelper.features.revision.infra.persistence;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.revisionhelper.features.revision.domain.model.Score;

import java.time.Instant;

@Entity
@Getter
@Setter
@Table(name = "run_answers")
public class AnswerEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "run_id", nullable = false, updatable = false)
    private String runId;

    // No foreign key: a run's question batch can be replaced after answers exist.
    @Column(name = "question_id", nullable = false, updatable = false)
    private String questionId;

    @Lob
    @Column(name = "question_text")
    private String questionText;

    @Column(name = "answer_index", nullable = false)
    private Integer answerIndex;

    @Lob
    @Column(name = "student_answer", nullable = false)
    private String studentAnswer;

    @Enumerated(EnumType.STRING)
    @Column(name = "score", nullable = false, length = 20)
    private Score score;

    @Column(name = "is_correct", nullable = false)
    private Boolean isCorrect;

    @Lob
    @Column(name = "correct_answer")
    private String correctAnswer;

    @Lob
    @Column(name = "explanation")
    private String explanation;

    @Column(name = "error", length = 2000)
    private String error;

    @Column(name = "answered_at", nullable = false, updatable = false)
    private Instant answeredAt;
}
