package uk.gegc.revisionhelper.features.revision.application;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.revisionhelper.features.revision.domain.model.Answer;
import uk.gegc.revisionhelper.features.revision.domain.model.NewAnswer;
import uk.gegc.revisionhelper.features.revision.domain.model.NewRevision;
import uk.gegc.revisionhelper.features.revision.domain.model.Question;
import uk.gegc.revisionhelper.features.revision.domain.model.QuestionStyle;
import uk.gegc.revisionhelper.features.revision.domain.model.Revision;
import uk.gegc.revisionhelper.features.revision.domain.model.Run;
import uk.gegc.revisionhelper.features.revision.domain.model.RunStatus;
import uk.gegc.revisionhelper.features.revision.domain.model.RunSummary;
import uk.gegc.revisionhelper.features.revision.infra.storage.StorageBackend;
import uk.gegc.revisionhelper.shared.config.RevisionProperties;
import uk.gegc.revisionhelper.shared.exception.ResourceNotFoundException;
import uk.gegc.revisionhelper.shared.exception.ValidationException;
import uk.gegc.revisionhelper.shared.security.AccessScope;
import uk.gegc.revisionhelper.shared.security.CallerIdentity;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * CRUD surface for revisions, runs, questions and answers, bound to one caller.
 * <p>
 * Every read and write is scoped: authenticated callers see rows stamped with their user id,
 * anonymous callers rows stamped with their session id. Rows of another identity look exactly
 * like missing rows. Deleting revisions and listing completed runs need an authenticated caller.
 */
@Slf4j
public class StorageAdapter {

    private final StorageBackend backend;
    private final CallerIdentity caller;
    private final AccessScope scope;
    private final RunSummaryCalculator calculator;
    private final RevisionProperties properties;
    private final Clock clock;

    public StorageAdapter(StorageBackend backend,
                          CallerIdentity caller,
                          RunSummaryCalculator calculator,
                          RevisionProperties properties,
                          Clock clock) {
        this.backend = backend;
        this.caller = caller;
        this.scope = caller.scope();
        this.calculator = calculator;
        this.properties = properties;
        this.clock = clock;
    }

    public AccessScope scope() {
        return scope;
    }

    public Revision createRevision(NewRevision data) {
        validate(data);
        Instant createdAt = now();
        ensureUserExists(createdAt);

        Revision revision = new Revision(
                data.id() != null && !data.id().isBlank() ? data.id() : UUID.randomUUID().toString(),
                data.name().trim(),
                data.subject().trim(),
                data.topics(),
                data.description(),
                data.desiredQuestionCount() != null ? data.desiredQuestionCount() : properties.getDefaultQuestionCount(),
                data.accuracyThreshold() != null ? data.accuracyThreshold() : properties.getDefaultAccuracyThreshold(),
                data.questionStyle() != null ? data.questionStyle() : QuestionStyle.FREE_TEXT,
                data.extractedTexts(),
                data.uploadedFiles(),
                scope.userId(),
                scope.sessionId(),
                createdAt
        );

        Revision saved = backend.saveRevision(revision);
        log.info("Created revision {} for {} in {} storage", saved.id(), scope, backend.name());
        return saved;
    }

    public List<Revision> listRevisions() {
        List<Revision> revisions = backend.findRevisions(scope);
        log.debug("Found {} revisions for {}", revisions.size(), scope);
        return revisions;
    }

    public Optional<Revision> getRevision(String revisionId) {
        if (revisionId == null) {
            return Optional.empty();
        }
        return backend.findRevision(revisionId, scope);
    }

    /**
     * Deletes a revision and everything under it.
     *
     * @return false for anonymous callers, always, and for revisions the caller cannot see
     */
    public boolean deleteRevision(String revisionId) {
        if (!scope.isAuthenticated()) {
            log.warn("Anonymous {} attempted to delete revision {}", scope, revisionId);
            return false;
        }
        if (revisionId == null || !backend.deleteRevision(revisionId, scope)) {
            log.warn("Revision {} not found for {}", revisionId, scope);
            return false;
        }
        log.info("Deleted revision {} for {}", revisionId, scope);
        return true;
    }

    /**
     * Starts a run on a revision the caller can see. The run is owned by the caller.
     *
     * @throws ResourceNotFoundException if the revision does not exist for this caller
     */
    public Run createRun(String revisionId) {
        Revision revision = getRevision(revisionId)
                .orElseThrow(() -> new ResourceNotFoundException("Revision " + revisionId + " not found"));
        Instant createdAt = now();
        ensureUserExists(createdAt);

        Run run = new Run(
                UUID.randomUUID().toString(),
                revision.id(),
                RunStatus.RUNNING,
                scope.userId(),
                scope.sessionId(),
                createdAt
        );
        Run saved = backend.saveRun(run);
        log.info("Created run {} on revision {} for {}", saved.id(), revision.id(), scope);
        return saved;
    }

    public Optional<Run> getRun(String runId) {
        if (runId == null) {
            return Optional.empty();
        }
        return backend.findRun(runId, scope);
    }

    public List<Run> listRuns() {
        return backend.findRuns(scope);
    }

    public List<Run> listRunsForRevision(String revisionId) {
        if (revisionId == null) {
            return List.of();
        }
        return backend.findRunsForRevision(revisionId, scope);
    }

    /**
     * Replaces the run's whole question batch in one step.
     *
     * @throws ResourceNotFoundException if the run does not exist for this caller
     * @throws ValidationException       if a question belongs to another run or ids repeat
     */
    public void storeQuestions(String runId, List<Question> questions) {
        requireRun(runId);
        List<Question> batch = questions == null ? List.of() : List.copyOf(questions);

        Set<String> ids = new HashSet<>();
        for (Question question : batch) {
            if (!runId.equals(question.runId())) {
                throw new ValidationException("Question " + question.id() + " does not belong to run " + runId);
            }
            if (!ids.add(question.id())) {
                throw new ValidationException("Duplicate question id " + question.id() + " in batch for run " + runId);
            }
        }

        backend.replaceQuestions(runId, batch);
        log.info("Stored {} questions for run {}", batch.size(), runId);
    }

    /**
     * @return the run's questions ordered by ordinal, empty when the caller cannot see the run
     */
    public List<Question> getQuestions(String runId) {
        if (getRun(runId).isEmpty()) {
            return List.of();
        }
        return backend.findQuestions(runId);
    }

    /**
     * Appends an answer. Repeated answers to the same question are kept.
     *
     * @throws ResourceNotFoundException if the run does not exist for this caller
     * @throws ValidationException       if the question is not part of the run
     */
    public Answer storeAnswer(String runId, NewAnswer data) {
        requireRun(runId);
        if (data == null || data.questionId() == null) {
            throw new ValidationException("Answer must reference a question");
        }

        Question question = backend.findQuestions(runId).stream()
                .filter(candidate -> candidate.id().equals(data.questionId()))
                .findFirst()
                .orElseThrow(() -> new ValidationException(
                        "Question " + data.questionId() + " does not belong to run " + runId));

        Answer answer = new Answer(
                UUID.randomUUID().toString(),
                runId,
                question.id(),
                question.text(),
                data.studentAnswer() != null ? data.studentAnswer() : "",
                data.score(),
                data.correctAnswer(),
                data.explanation(),
                data.error(),
                now()
        );
        Answer saved = backend.saveAnswer(answer);
        log.debug("Stored answer {} for question {} in run {} with score {}",
                saved.id(), question.id(), runId, saved.score().label());
        return saved;
    }

    /**
     * @return answers in submission order, empty when the caller cannot see the run
     */
    public List<Answer> getAnswers(String runId) {
        if (getRun(runId).isEmpty()) {
            return List.of();
        }
        return backend.findAnswers(runId);
    }

    /**
     * Runs with at least one answer, newest first. History needs a durable identity, so
     * anonymous callers always get an empty list.
     */
    public List<RunSummary> listCompletedRuns() {
        if (!scope.isAuthenticated()) {
            return List.of();
        }

        List<RunSummary> completed = new ArrayList<>();
        for (Run run : backend.findRuns(scope)) {
            List<Answer> answers = backend.findAnswers(run.id());
            if (answers.isEmpty()) {
                continue;
            }
            Optional<Revision> revision = backend.findRevisionById(run.revisionId());
            if (revision.isEmpty()) {
                continue;
            }
            completed.add(new RunSummary(
                    run.id(),
                    revision.get().id(),
                    revision.get().name(),
                    revision.get().subject(),
                    run.createdAt(),
                    calculator.accuracy(answers),
                    answers.size(),
                    revision.get().accuracyThreshold()
            ));
        }
        log.debug("Found {} completed runs for {}", completed.size(), scope);
        return completed;
    }

    private Run requireRun(String runId) {
        return getRun(runId)
                .orElseThrow(() -> new ResourceNotFoundException("Run " + runId + " not found"));
    }

    private void ensureUserExists(Instant createdAt) {
        caller.user().ifPresent(user -> backend.ensureUser(user, createdAt));
    }

    private void validate(NewRevision data) {
        if (data == null) {
            throw new ValidationException("Revision data is required");
        }
        if (data.name() == null || data.name().isBlank()) {
            throw new ValidationException("Revision name must not be blank");
        }
        if (data.subject() == null || data.subject().isBlank()) {
            throw new ValidationException("Subject must not be blank");
        }
        if (data.desiredQuestionCount() != null && data.desiredQuestionCount() < 1) {
            throw new ValidationException("Desired question count must be at least 1");
        }
        if (data.accuracyThreshold() != null
                && (data.accuracyThreshold() < 0 || data.accuracyThreshold() > 100)) {
            throw new ValidationException("Accuracy threshold must be between 0 and 100");
        }
    }

    private Instant now() {
        return clock.instant();
    }
}
