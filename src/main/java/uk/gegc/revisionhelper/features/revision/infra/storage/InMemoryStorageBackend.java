package uk.gegc.revisionhelper.features.revision.infra.storage;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.revisionhelper.features.revision.domain.model.Answer;
import uk.gegc.revisionhelper.features.revision.domain.model.Question;
import uk.gegc.revisionhelper.features.revision.domain.model.Revision;
import uk.gegc.revisionhelper.features.revision.domain.model.Run;
import uk.gegc.revisionhelper.features.revision.domain.model.UserAccount;
import uk.gegc.revisionhelper.shared.security.AccessScope;
import uk.gegc.revisionhelper.shared.security.AuthenticatedUser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process backend used when no datasource is configured. Applies the same owner
 * filtering and cascade delete as the relational backend. Question batches and answer
 * lists are immutable and swapped in a single map update.
 */
@Slf4j
public class InMemoryStorageBackend implements StorageBackend {

    private record Stored<T>(long sequence, T value) {
    }

    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, UserAccount> users = new ConcurrentHashMap<>();
    private final Map<String, Stored<Revision>> revisions = new ConcurrentHashMap<>();
    private final Map<String, Stored<Run>> runs = new ConcurrentHashMap<>();
    private final Map<String, List<Question>> questions = new ConcurrentHashMap<>();
    private final Map<String, List<Answer>> answers = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return "in-memory";
    }

    @Override
    public void ensureUser(AuthenticatedUser user, Instant createdAt) {
        users.computeIfAbsent(user.userId(), id -> {
            String email = user.email() != null ? user.email() : id + "@auth.local";
            log.info("Created user account {} with email {}", id, email);
            return new UserAccount(id, email, user.name(), createdAt);
        });
    }

    @Override
    public Revision saveRevision(Revision revision) {
        revisions.put(revision.id(), new Stored<>(sequence.incrementAndGet(), revision));
        return revision;
    }

    @Override
    public List<Revision> findRevisions(AccessScope scope) {
        return revisions.values().stream()
                .filter(stored -> owns(scope, stored.value()))
                .sorted(Comparator.comparing((Stored<Revision> stored) -> stored.value().createdAt())
                        .thenComparingLong(Stored::sequence))
                .map(Stored::value)
                .toList();
    }

    @Override
    public Optional<Revision> findRevision(String revisionId, AccessScope scope) {
        return findRevisionById(revisionId).filter(revision -> owns(scope, revision));
    }

    @Override
    public Optional<Revision> findRevisionById(String revisionId) {
        return Optional.ofNullable(revisions.get(revisionId)).map(Stored::value);
    }

    @Override
    public synchronized boolean deleteRevision(String revisionId, AccessScope scope) {
        if (findRevision(revisionId, scope).isEmpty()) {
            return false;
        }
        List<String> runIds = runs.values().stream()
                .map(Stored::value)
                .filter(run -> run.revisionId().equals(revisionId))
                .map(Run::id)
                .toList();
        for (String runId : runIds) {
            questions.remove(runId);
            answers.remove(runId);
            runs.remove(runId);
        }
        revisions.remove(revisionId);
        log.debug("Deleted revision {} with {} runs", revisionId, runIds.size());
        return true;
    }

    @Override
    public Run saveRun(Run run) {
        runs.put(run.id(), new Stored<>(sequence.incrementAndGet(), run));
        return run;
    }

    @Override
    public Optional<Run> findRun(String runId, AccessScope scope) {
        return Optional.ofNullable(runs.get(runId))
                .map(Stored::value)
                .filter(run -> scope.owns(run.userId(), run.sessionId()));
    }

    @Override
    public List<Run> findRuns(AccessScope scope) {
        return newestFirst(runs.values().stream()
                .filter(stored -> scope.owns(stored.value().userId(), stored.value().sessionId()))
                .toList());
    }

    @Override
    public List<Run> findRunsForRevision(String revisionId, AccessScope scope) {
        return newestFirst(runs.values().stream()
                .filter(stored -> stored.value().revisionId().equals(revisionId))
                .filter(stored -> scope.owns(stored.value().userId(), stored.value().sessionId()))
                .toList());
    }

    @Override
    public void replaceQuestions(String runId, List<Question> batch) {
        List<Question> ordered = batch.stream()
                .sorted(Comparator.comparingInt(Question::ordinal))
                .toList();
        questions.put(runId, ordered);
    }

    @Override
    public List<Question> findQuestions(String runId) {
        return questions.getOrDefault(runId, List.of());
    }

    @Override
    public Answer saveAnswer(Answer answer) {
        answers.compute(answer.runId(), (runId, existing) -> {
            List<Answer> updated = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            updated.add(answer);
            return List.copyOf(updated);
        });
        return answer;
    }

    @Override
    public List<Answer> findAnswers(String runId) {
        return answers.getOrDefault(runId, List.of());
    }

    Optional<UserAccount> findUser(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    private boolean owns(AccessScope scope, Revision revision) {
        return scope.owns(revision.userId(), revision.sessionId());
    }

    private List<Run> newestFirst(List<Stored<Run>> stored) {
        return stored.stream()
                .sorted(Comparator.comparing((Stored<Run> s) -> s.value().createdAt())
                        .thenComparingLong(Stored::sequence)
                        .reversed())
                .map(Stored::value)
                .toList();
    }
}
