package uk.gegc.revisionhelper.features.revision.infra.storage;

import uk.gegc.revisionhelper.features.revision.domain.model.Answer;
import uk.gegc.revisionhelper.features.revision.domain.model.Question;
import uk.gegc.revisionhelper.features.revision.domain.model.Revision;
import uk.gegc.revisionhelper.features.revision.domain.model.Run;
import uk.gegc.revisionhelper.shared.security.AccessScope;
import uk.gegc.revisionhelper.shared.security.AuthenticatedUser;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence seam behind {@code StorageAdapter}. Every scoped lookup must match rows on the
 * scope's user id for authenticated scopes and on its session id otherwise, and must treat
 * a row owned by someone else exactly like a missing row.
 */
public interface StorageBackend {

    String name();

    /**
     * Creates the account row for an authenticated user on first use, stamped with
     * {@code createdAt}. Later calls leave the existing row untouched.
     */
    void ensureUser(AuthenticatedUser user, Instant createdAt);

    Revision saveRevision(Revision revision);

    List<Revision> findRevisions(AccessScope scope);

    Optional<Revision> findRevision(String revisionId, AccessScope scope);

    /**
     * Unscoped lookup, used only to describe runs the caller already owns.
     */
    Optional<Revision> findRevisionById(String revisionId);

    /**
     * Deletes the revision together with all of its runs, their questions and answers.
     *
     * @return false when the revision does not exist for this scope
     */
    boolean deleteRevision(String revisionId, AccessScope scope);

    Run saveRun(Run run);

    Optional<Run> findRun(String runId, AccessScope scope);

    /**
     * @return the scope's runs, newest first
     */
    List<Run> findRuns(AccessScope scope);

    List<Run> findRunsForRevision(String revisionId, AccessScope scope);

    /**
     * Atomically replaces the run's question batch; readers see the old batch or the new one.
     */
    void replaceQuestions(String runId, List<Question> questions);

    List<Question> findQuestions(String runId);

    Answer saveAnswer(Answer answer);

    /**
     * @return answers in submission order
     */
    List<Answer> findAnswers(String runId);
}
