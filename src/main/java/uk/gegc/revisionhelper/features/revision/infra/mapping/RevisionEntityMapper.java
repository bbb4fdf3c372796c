package uk.gegc.revisionhelper.features.revision.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.revisionhelper.features.revision.domain.model.Answer;
import uk.gegc.revisionhelper.features.revision.domain.model.Question;
import uk.gegc.revisionhelper.features.revision.domain.model.Revision;
import uk.gegc.revisionhelper.features.revision.domain.model.Run;
import uk.gegc.revisionhelper.features.revision.infra.persistence.AnswerEntity;
import uk.gegc.revisionhelper.features.revision.infra.persistence.QuestionEntity;
import uk.gegc.revisionhelper.features.revision.infra.persistence.RevisionEntity;
import uk.gegc.revisionhelper.features.revision.infra.persistence.RunEntity;

import java.util.ArrayList;
import java.util.HashMap;

/**
 * Converts between the persisted rows and the immutable domain records.
 */
@Component
public class RevisionEntityMapper {

    public RevisionEntity toEntity(Revision revision) {
        RevisionEntity entity = new RevisionEntity();
        entity.setId(revision.id());
        entity.setUserId(revision.userId());
        entity.setSessionId(revision.sessionId());
        entity.setName(revision.name());
        entity.setSubject(revision.subject());
        entity.setTopics(new ArrayList<>(revision.topics()));
        entity.setDescription(revision.description());
        entity.setDesiredQuestionCount(revision.desiredQuestionCount());
        entity.setAccuracyThreshold(revision.accuracyThreshold());
        entity.setQuestionStyle(revision.questionStyle());
        entity.setExtractedTexts(new HashMap<>(revision.extractedTexts()));
        entity.setUploadedFiles(new ArrayList<>(revision.uploadedFiles()));
        entity.setCreatedAt(revision.createdAt());
        return entity;
    }

    public Revision toDomain(RevisionEntity entity) {
        return new Revision(
                entity.getId(),
                entity.getName(),
                entity.getSubject(),
                entity.getTopics(),
                entity.getDescription(),
                entity.getDesiredQuestionCount(),
                entity.getAccuracyThreshold(),
                entity.getQuestionStyle(),
                entity.getExtractedTexts(),
                entity.getUploadedFiles(),
                entity.getUserId(),
                entity.getSessionId(),
                entity.getCreatedAt()
        );
    }

    public RunEntity toEntity(Run run) {
        RunEntity entity = new RunEntity();
        entity.setId(run.id());
        entity.setRevisionId(run.revisionId());
        entity.setUserId(run.userId());
        entity.setSessionId(run.sessionId());
        entity.setStatus(run.status());
        entity.setCreatedAt(run.createdAt());
        return entity;
    }

    public Run toDomain(RunEntity entity) {
        return new Run(
                entity.getId(),
                entity.getRevisionId(),
                entity.getStatus(),
                entity.getUserId(),
                entity.getSessionId(),
                entity.getCreatedAt()
        );
    }

    public QuestionEntity toEntity(Question question) {
        QuestionEntity entity = new QuestionEntity();
        entity.setId(question.id());
        entity.setRunId(question.runId());
        entity.setQuestionText(question.text());
        entity.setQuestionIndex(question.ordinal());
        entity.setQuestionStyle(question.style());
        entity.setOptions(new ArrayList<>(question.options()));
        entity.setCorrectAnswerIndex(question.correctAnswerIndex());
        entity.setRationale(question.rationale());
        return entity;
    }

    public Question toDomain(QuestionEntity entity) {
        return new Question(
                entity.getId(),
                entity.getRunId(),
                entity.getQuestionIndex(),
                entity.getQuestionText(),
                entity.getQuestionStyle(),
                entity.getOptions(),
                entity.getCorrectAnswerIndex(),
                entity.getRationale()
        );
    }

    public AnswerEntity toEntity(Answer answer, int answerIndex) {
        AnswerEntity entity = new AnswerEntity();
        entity.setId(answer.id());
        entity.setRunId(answer.runId());
        entity.setQuestionId(answer.questionId());
        entity.setQuestionText(answer.questionText());
        entity.setAnswerIndex(answerIndex);
        entity.setStudentAnswer(answer.studentAnswer());
        entity.setScore(answer.score());
        entity.setIsCorrect(answer.isCorrect());
        entity.setCorrectAnswer(answer.correctAnswer());
        entity.setExplanation(answer.explanation());
        entity.setError(answer.error());
        entity.setAnsweredAt(answer.answeredAt());
        return entity;
    }

    // is_correct is written for legacy readers only; the score decides correctness.
    public Answer toDomain(AnswerEntity entity) {
        return new Answer(
                entity.getId(),
                entity.getRunId(),
                entity.getQuestionId(),
                entity.getQuestionText(),
                entity.getStudentAnswer(),
                entity.getScore(),
                entity.getCorrectAnswer(),
                entity.getExplanation(),
                entity.getError(),
                entity.getAnsweredAt()
        );
    }
}
