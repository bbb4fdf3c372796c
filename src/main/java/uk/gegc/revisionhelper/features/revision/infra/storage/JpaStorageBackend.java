package uk.gegc.revisionhelper.features.revision.infra.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.revisionhelper.features.revision.domain.model.Answer;
import uk.gegc.revisionhelper.features.revision.domain.model.Question;
import uk.gegc.revisionhelper.features.revision.domain.model.Revision;
import uk.gegc.revisionhelper.features.revision.domain.model.Run;
import uk.gegc.revisionhelper.features.revision.infra.mapping.RevisionEntityMapper;
import uk.gegc.revisionhelper.features.revision.infra.persistence.AnswerJpaRepository;
import uk.gegc.revisionhelper.features.revision.infra.persistence.QuestionEntity;
import uk.gegc.revisionhelper.features.revision.infra.persistence.QuestionJpaRepository;
import uk.gegc.revisionhelper.features.revision.infra.persistence.RevisionEntity;
import uk.gegc.revisionhelper.features.revision.infra.persistence.RevisionJpaRepository;
import uk.gegc.revisionhelper.features.revision.infra.persistence.RunEntity;
import uk.gegc.revisionhelper.features.revision.infra.persistence.RunJpaRepository;
import uk.gegc.revisionhelper.features.revision.infra.persistence.UserAccountEntity;
import uk.gegc.revisionhelper.features.revision.infra.persistence.UserAccountJpaRepository;
import uk.gegc.revisionhelper.shared.security.AccessScope;
import uk.gegc.revisionhelper.shared.security.AuthenticatedUser;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Relational backend over Spring Data JPA. Each method is one transaction.
 */
@Slf4j
@Transactional
@RequiredArgsConstructor
public class JpaStorageBackend implements StorageBackend {

    private final UserAccountJpaRepository userAccountRepository;
    private final RevisionJpaRepository revisionRepository;
    private final RunJpaRepository runRepository;
    private final QuestionJpaRepository questionRepository;
    private final AnswerJpaRepository answerRepository;
    private final RevisionEntityMapper mapper;

    @Override
    public String name() {
        return "database";
    }

    @Override
    public void ensureUser(AuthenticatedUser user, Instant createdAt) {
        if (userAccountRepository.existsById(user.userId())) {
            return;
        }
        UserAccountEntity account = new UserAccountEntity();
        account.setId(user.userId());
        account.setEmail(user.email() != null ? user.email() : user.userId() + "@auth.local");
        account.setName(user.name());
        account.setCreatedAt(createdAt);
        userAccountRepository.save(account);
        log.info("Created user account {} with email {}", account.getId(), account.getEmail());
    }

    @Override
    public Revision saveRevision(Revision revision) {
        RevisionEntity saved = revisionRepository.save(mapper.toEntity(revision));
        return mapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Revision> findRevisions(AccessScope scope) {
        List<RevisionEntity> rows = scope.isAuthenticated()
                ? revisionRepository.findAllByUserIdOrderByCreatedAtAsc(scope.ownerId())
                : revisionRepository.findAllBySessionIdOrderByCreatedAtAsc(scope.ownerId());
        return rows.stream().map(mapper::toDomain).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Revision> findRevision(String revisionId, AccessScope scope) {
        return findRevisionEntity(revisionId, scope).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Revision> findRevisionById(String revisionId) {
        return revisionRepository.findById(revisionId).map(mapper::toDomain);
    }

    @Override
    public boolean deleteRevision(String revisionId, AccessScope scope) {
        if (findRevisionEntity(revisionId, scope).isEmpty()) {
            return false;
        }
        int answers = answerRepository.deleteAllByRevisionId(revisionId);
        int questions = questionRepository.deleteAllByRevisionId(revisionId);
        int runs = runRepository.deleteAllByRevisionId(revisionId);
        revisionRepository.deleteRevisionById(revisionId);
        log.debug("Deleted revision {} with {} runs, {} questions and {} answers",
                revisionId, runs, questions, answers);
        return true;
    }

    @Override
    public Run saveRun(Run run) {
        RunEntity saved = runRepository.save(mapper.toEntity(run));
        return mapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Run> findRun(String runId, AccessScope scope) {
        Optional<RunEntity> row = scope.isAuthenticated()
                ? runRepository.findByIdAndUserId(runId, scope.ownerId())
                : runRepository.findByIdAndSessionId(runId, scope.ownerId());
        return row.map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Run> findRuns(AccessScope scope) {
        List<RunEntity> rows = scope.isAuthenticated()
                ? runRepository.findAllByUserIdOrderByCreatedAtDesc(scope.ownerId())
                : runRepository.findAllBySessionIdOrderByCreatedAtDesc(scope.ownerId());
        return rows.stream().map(mapper::toDomain).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Run> findRunsForRevision(String revisionId, AccessScope scope) {
        List<RunEntity> rows = scope.isAuthenticated()
                ? runRepository.findAllByRevisionIdAndUserIdOrderByCreatedAtDesc(revisionId, scope.ownerId())
                : runRepository.findAllByRevisionIdAndSessionIdOrderByCreatedAtDesc(revisionId, scope.ownerId());
        return rows.stream().map(mapper::toDomain).toList();
    }

    @Override
    public void replaceQuestions(String runId, List<Question> questions) {
        int removed = questionRepository.deleteAllByRunId(runId);
        List<QuestionEntity> rows = questions.stream().map(mapper::toEntity).toList();
        questionRepository.saveAll(rows);
        log.debug("Replaced {} questions with {} for run {}", removed, rows.size(), runId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Question> findQuestions(String runId) {
        return questionRepository.findAllByRunIdOrderByQuestionIndexAsc(runId).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    public Answer saveAnswer(Answer answer) {
        runRepository.findByIdForUpdate(answer.runId());
        int answerIndex = (int) answerRepository.countByRunId(answer.runId()) + 1;
        return mapper.toDomain(answerRepository.save(mapper.toEntity(answer, answerIndex)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Answer> findAnswers(String runId) {
        return answerRepository.findAllByRunIdOrderByAnswerIndexAscAnsweredAtAscIdAsc(runId).stream()
                .map(mapper::toDomain)
                .toList();
    }

    private Optional<RevisionEntity> findRevisionEntity(String revisionId, AccessScope scope) {
        return scope.isAuthenticated()
                ? revisionRepository.findByIdAndUserId(revisionId, scope.ownerId())
                : revisionRepository.findByIdAndSessionId(revisionId, scope.ownerId());
    }
}
