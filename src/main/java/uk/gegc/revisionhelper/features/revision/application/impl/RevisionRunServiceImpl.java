package uk.gegc.revisionhelper.features.revision.application.impl;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.revisionhelper.features.ai.domain.model.AnswerJudgment;
import uk.gegc.revisionhelper.features.ai.infra.parser.JudgmentParser;
import uk.gegc.revisionhelper.features.ai.infra.parser.QuestionParser;
import uk.gegc.revisionhelper.features.revision.application.RevisionRunService;
import uk.gegc.revisionhelper.features.revision.application.RunSummaryCalculator;
import uk.gegc.revisionhelper.features.revision.application.StorageAdapter;
import uk.gegc.revisionhelper.features.revision.application.StorageAdapterFactory;
import uk.gegc.revisionhelper.features.revision.domain.model.Answer;
import uk.gegc.revisionhelper.features.revision.domain.model.NewAnswer;
import uk.gegc.revisionhelper.features.revision.domain.model.NewRevision;
import uk.gegc.revisionhelper.features.revision.domain.model.Question;
import uk.gegc.revisionhelper.features.revision.domain.model.Revision;
import uk.gegc.revisionhelper.features.revision.domain.model.RevisionSummary;
import uk.gegc.revisionhelper.features.revision.domain.model.Run;
import uk.gegc.revisionhelper.features.revision.domain.model.RunSummary;
import uk.gegc.revisionhelper.features.revision.domain.model.Score;
import uk.gegc.revisionhelper.shared.config.RevisionProperties;
import uk.gegc.revisionhelper.shared.exception.ResourceNotFoundException;
import uk.gegc.revisionhelper.shared.exception.ValidationException;
import uk.gegc.revisionhelper.shared.security.CallerIdentity;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Service
@Slf4j
@RequiredArgsConstructor
public class RevisionRunServiceImpl implements RevisionRunService {

    static final List<String> FALLBACK_QUESTIONS = List.of("What is 2 + 2?", "What is 3 × 5?");

    private final StorageAdapterFactory storageAdapterFactory;
    private final QuestionParser questionParser;
    private final JudgmentParser judgmentParser;
    private final RunSummaryCalculator calculator;
    private final RevisionProperties properties;
    private final Validator validator;

    @Override
    public Revision createRevision(CallerIdentity caller, NewRevision request) {
        if (request == null) {
            throw new ValidationException("Revision data is required");
        }
        Set<ConstraintViolation<NewRevision>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ValidationException(message);
        }
        return storage(caller).createRevision(request);
    }

    @Override
    public List<Revision> listRevisions(CallerIdentity caller) {
        return storage(caller).listRevisions();
    }

    @Override
    public Revision getRevision(CallerIdentity caller, String revisionId) {
        return storage(caller).getRevision(revisionId)
                .orElseThrow(() -> new ResourceNotFoundException("Revision " + revisionId + " not found"));
    }

    @Override
    public boolean deleteRevision(CallerIdentity caller, String revisionId) {
        return storage(caller).deleteRevision(revisionId);
    }

    @Override
    public Run startRun(CallerIdentity caller, String revisionId, String generatedText) {
        StorageAdapter storage = storage(caller);
        Revision revision = storage.getRevision(revisionId)
                .orElseThrow(() -> new ResourceNotFoundException("Revision " + revisionId + " not found"));

        Run run = storage.createRun(revision.id());
        List<Question> questions = questionParser.parse(
                generatedText, run.id(), revision.desiredQuestionCount(), revision.questionStyle());

        if (questions.isEmpty()) {
            if (!properties.isFallbackQuestionsEnabled()) {
                log.warn("No questions parsed for run {} and fallback questions are disabled", run.id());
                return run;
            }
            log.warn("No questions parsed for run {}, storing fallback questions", run.id());
            questions = fallbackQuestions(run.id());
        }

        storage.storeQuestions(run.id(), questions);
        log.info("Started run {} on revision {} with {} questions", run.id(), revision.id(), questions.size());
        return run;
    }

    @Override
    public List<Question> getQuestions(CallerIdentity caller, String runId) {
        return storage(caller).getQuestions(runId);
    }

    @Override
    public Optional<Question> nextQuestion(CallerIdentity caller, String runId) {
        StorageAdapter storage = storage(caller);
        Set<String> answered = storage.getAnswers(runId).stream()
                .map(Answer::questionId)
                .collect(Collectors.toSet());
        return storage.getQuestions(runId).stream()
                .filter(question -> !answered.contains(question.id()))
                .findFirst();
    }

    @Override
    public Answer submitAnswer(CallerIdentity caller, String runId, String questionId,
                               String answerText, String judgmentText) {
        AnswerJudgment judgment = judgmentParser.parse(judgmentText);
        if (judgment.isFailed()) {
            log.warn("Storing answer to {} in run {} with marking error: {}", questionId, runId, judgment.error());
        }
        return storage(caller).storeAnswer(runId, NewAnswer.from(questionId, answerText, judgment));
    }

    @Override
    public Answer markMultipleChoice(CallerIdentity caller, String runId, String questionId, int selectedIndex) {
        StorageAdapter storage = storage(caller);
        Question question = storage.getQuestions(runId).stream()
                .filter(candidate -> candidate.id().equals(questionId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Question " + questionId + " not found in run " + runId));

        if (!question.isMultipleChoice() || question.correctAnswerIndex() == null) {
            throw new ValidationException("Question " + questionId + " is not a multiple-choice question");
        }
        if (selectedIndex < 0 || selectedIndex >= question.options().size()) {
            throw new ValidationException("Selected option " + selectedIndex + " is outside "
                    + question.options().size() + " options");
        }

        Score score = selectedIndex == question.correctAnswerIndex() ? Score.FULL_MARKS : Score.INCORRECT;
        NewAnswer answer = new NewAnswer(
                questionId,
                question.options().get(selectedIndex),
                score,
                question.correctOption(),
                question.rationale(),
                null
        );
        return storage.storeAnswer(runId, answer);
    }

    @Override
    public RevisionSummary summary(CallerIdentity caller, String runId) {
        StorageAdapter storage = storage(caller);
        Run run = storage.getRun(runId)
                .orElseThrow(() -> new ResourceNotFoundException("Run " + runId + " not found"));

        List<Question> questions = storage.getQuestions(runId);
        List<Answer> answers = storage.getAnswers(runId);
        int threshold = storage.getRevision(run.revisionId())
                .map(Revision::accuracyThreshold)
                .orElse(properties.getDefaultAccuracyThreshold());

        double accuracy = calculator.accuracy(answers);
        Map<Score, Integer> tiers = calculator.tierCounts(answers);

        return new RevisionSummary(
                run.id(),
                run.revisionId(),
                answers,
                accuracy,
                tiers.get(Score.FULL_MARKS),
                tiers.get(Score.PARTIAL_MARKS),
                tiers.get(Score.INCORRECT),
                questions.size(),
                calculator.isComplete(questions, answers),
                threshold,
                calculator.meetsThreshold(accuracy, threshold)
        );
    }

    @Override
    public List<Run> listRuns(CallerIdentity caller) {
        return storage(caller).listRuns();
    }

    @Override
    public List<Run> listRunsForRevision(CallerIdentity caller, String revisionId) {
        return storage(caller).listRunsForRevision(revisionId);
    }

    @Override
    public List<RunSummary> listCompletedRuns(CallerIdentity caller) {
        return storage(caller).listCompletedRuns();
    }

    private StorageAdapter storage(CallerIdentity caller) {
        return storageAdapterFactory.forCaller(caller);
    }

    private List<Question> fallbackQuestions(String runId) {
        return IntStream.range(0, FALLBACK_QUESTIONS.size())
                .mapToObj(i -> Question.freeText(runId, i + 1, FALLBACK_QUESTIONS.get(i)))
                .toList();
    }
}
