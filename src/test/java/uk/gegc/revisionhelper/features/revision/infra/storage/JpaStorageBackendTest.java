package uk.gegc.revisionhelper.features.revision.infra.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import uk.gegc.revisionhelper.features.revision.application.StorageAdapterContractTest;
import uk.gegc.revisionhelper.features.revision.domain.model.Answer;
import uk.gegc.revisionhelper.features.revision.domain.model.Question;
import uk.gegc.revisionhelper.features.revision.domain.model.Revision;
import uk.gegc.revisionhelper.features.revision.domain.model.Run;
import uk.gegc.revisionhelper.features.revision.domain.model.Score;
import uk.gegc.revisionhelper.features.revision.infra.mapping.RevisionEntityMapper;
import uk.gegc.revisionhelper.features.revision.infra.persistence.AnswerEntity;
import uk.gegc.revisionhelper.features.revision.infra.persistence.AnswerJpaRepository;
import uk.gegc.revisionhelper.features.revision.infra.persistence.QuestionJpaRepository;
import uk.gegc.revisionhelper.features.revision.infra.persistence.RevisionJpaRepository;
import uk.gegc.revisionhelper.features.revision.infra.persistence.RunJpaRepository;
import uk.gegc.revisionhelper.features.revision.infra.persistence.UserAccountEntity;
import uk.gegc.revisionhelper.features.revision.infra.persistence.UserAccountJpaRepository;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@DisplayName("Relational storage backend")
class JpaStorageBackendTest extends StorageAdapterContractTest {

    @Autowired
    private UserAccountJpaRepository userAccountRepository;

    @Autowired
    private RevisionJpaRepository revisionRepository;

    @Autowired
    private RunJpaRepository runRepository;

    @Autowired
    private QuestionJpaRepository questionRepository;

    @Autowired
    private AnswerJpaRepository answerRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Override
    protected StorageBackend createBackend() {
        return new JpaStorageBackend(userAccountRepository, revisionRepository, runRepository,
                questionRepository, answerRepository, new RevisionEntityMapper());
    }

    @Test
    @DisplayName("creates a users row with the fallback email on the first authenticated write")
    void createsUserRow() {
        revision(ALICE, "First");
        revision(ALICE, "Second");
        entityManager.flush();

        UserAccountEntity account = entityManager.find(UserAccountEntity.class, "alice");
        assertThat(account).isNotNull();
        assertThat(account.getEmail()).isEqualTo("alice@auth.local");
        assertThat(userAccountRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("stamps the users row with the time of the first write")
    void stampsUserRowFromClock() {
        Revision first = revision(ALICE, "First");
        revision(ALICE, "Second");
        entityManager.flush();
        entityManager.clear();

        UserAccountEntity account = entityManager.find(UserAccountEntity.class, "alice");
        assertThat(account.getCreatedAt()).isEqualTo(first.createdAt());
    }

    @Test
    @DisplayName("stores a dense answer index and the legacy is_correct column")
    void storesAnswerIndexAndCorrectFlag() {
        Revision revision = revision(ALICE, "Indexes");
        Run run = runWithQuestions(ALICE, revision, "One?");
        String questionId = Question.idFor(run.id(), 1);
        storage(ALICE).storeAnswer(run.id(), answer(questionId, Score.PARTIAL_MARKS));
        storage(ALICE).storeAnswer(run.id(), answer(questionId, Score.FULL_MARKS));
        entityManager.flush();
        entityManager.clear();

        List<AnswerEntity> rows = answerRepository.findAllByRunIdOrderByAnswerIndexAscAnsweredAtAscIdAsc(run.id());
        assertThat(rows).extracting(AnswerEntity::getAnswerIndex).containsExactly(1, 2);
        assertThat(rows).extracting(AnswerEntity::getIsCorrect).containsExactly(false, true);
    }

    @Test
    @DisplayName("keeps the JSON option list of multiple-choice questions")
    void roundTripsOptions() {
        Revision revision = revision(ALICE, "Options");
        Run run = storage(ALICE).createRun(revision.id());
        storage(ALICE).storeQuestions(run.id(), List.of(
                Question.multipleChoice(run.id(), 1, "Largest planet?", List.of("Mars", "Jupiter", "Venus"), 1,
                        "Jupiter is a gas giant.")));
        entityManager.flush();
        entityManager.clear();

        Question stored = storage(ALICE).getQuestions(run.id()).get(0);
        assertThat(stored.options()).containsExactly("Mars", "Jupiter", "Venus");
        assertThat(stored.correctOption()).isEqualTo("Jupiter");
    }

    @Test
    @DisplayName("orders answers sharing an index by submission time, then id")
    void breaksAnswerIndexTies() {
        Revision revision = revision(ALICE, "Ties");
        Run run = runWithQuestions(ALICE, revision, "One?");
        String questionId = Question.idFor(run.id(), 1);
        entityManager.persist(answerRow("b-later", run.id(), questionId, Instant.parse("2024-03-01T10:00:05Z")));
        entityManager.persist(answerRow("c-earlier", run.id(), questionId, Instant.parse("2024-03-01T10:00:01Z")));
        entityManager.persist(answerRow("a-earlier", run.id(), questionId, Instant.parse("2024-03-01T10:00:01Z")));
        entityManager.flush();
        entityManager.clear();

        List<Answer> answers = storage(ALICE).getAnswers(run.id());

        assertThat(answers).extracting(Answer::id).containsExactly("a-earlier", "c-earlier", "b-later");
    }

    private AnswerEntity answerRow(String id, String runId, String questionId, Instant answeredAt) {
        AnswerEntity row = new AnswerEntity();
        row.setId(id);
        row.setRunId(runId);
        row.setQuestionId(questionId);
        row.setQuestionText("One?");
        row.setAnswerIndex(1);
        row.setStudentAnswer("answer " + id);
        row.setScore(Score.INCORRECT);
        row.setIsCorrect(false);
        row.setAnsweredAt(answeredAt);
        return row;
    }
}
