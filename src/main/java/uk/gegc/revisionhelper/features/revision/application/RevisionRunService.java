package uk.gegc.revisionhelper.features.revision.application;

import uk.gegc.revisionhelper.features.revision.domain.model.Answer;
import uk.gegc.revisionhelper.features.revision.domain.model.NewRevision;
import uk.gegc.revisionhelper.features.revision.domain.model.Question;
import uk.gegc.revisionhelper.features.revision.domain.model.Revision;
import uk.gegc.revisionhelper.features.revision.domain.model.RevisionSummary;
import uk.gegc.revisionhelper.features.revision.domain.model.Run;
import uk.gegc.revisionhelper.features.revision.domain.model.RunSummary;
import uk.gegc.revisionhelper.shared.security.CallerIdentity;

import java.util.List;
import java.util.Optional;

public interface RevisionRunService {

    Revision createRevision(CallerIdentity caller, NewRevision request);

    List<Revision> listRevisions(CallerIdentity caller);

    Revision getRevision(CallerIdentity caller, String revisionId);

    boolean deleteRevision(CallerIdentity caller, String revisionId);

    /**
     * Create a run on the revision and store the questions parsed from the generated text.
     * When nothing can be parsed the built-in fallback questions are stored instead, if enabled.
     */
    Run startRun(CallerIdentity caller, String revisionId, String generatedText);

    List<Question> getQuestions(CallerIdentity caller, String runId);

    Optional<Question> nextQuestion(CallerIdentity caller, String runId);

    Answer submitAnswer(CallerIdentity caller, String runId, String questionId, String answerText, String judgmentText);

    Answer markMultipleChoice(CallerIdentity caller, String runId, String questionId, int selectedIndex);

    RevisionSummary summary(CallerIdentity caller, String runId);

    List<Run> listRuns(CallerIdentity caller);

    List<Run> listRunsForRevision(CallerIdentity caller, String revisionId);

    List<RunSummary> listCompletedRuns(CallerIdentity caller);
}
