package uk.gegc.revisionhelper.features.revision.application;

import org.springframework.stereotype.Service;
import uk.gegc.revisionhelper.features.revision.domain.model.Answer;
import uk.gegc.revisionhelper.features.revision.domain.model.Question;
import uk.gegc.revisionhelper.features.revision.domain.model.Score;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pure aggregation over stored answers. Every stored answer counts, including repeated
 * answers to the same question.
 */
@Service
public class RunSummaryCalculator {

    /**
     * Full Marks = 100, Partial Marks = 50, Incorrect = 0, averaged over the answers given.
     *
     * @return accuracy in percent, 0.0 when nothing was answered
     */
    public double accuracy(Collection<Answer> answers) {
        if (answers == null || answers.isEmpty()) {
            return 0.0;
        }
        double total = answers.stream()
                .mapToDouble(answer -> answer.score().points())
                .sum();
        return total / answers.size();
    }

    public Map<Score, Integer> tierCounts(Collection<Answer> answers) {
        Map<Score, Integer> counts = new EnumMap<>(Score.class);
        for (Score score : Score.values()) {
            counts.put(score, 0);
        }
        if (answers != null) {
            answers.forEach(answer -> counts.merge(answer.score(), 1, Integer::sum));
        }
        return counts;
    }

    public boolean isComplete(Collection<Question> questions, Collection<Answer> answers) {
        if (questions == null || questions.isEmpty()) {
            return false;
        }
        Set<String> answered = answers.stream()
                .map(Answer::questionId)
                .collect(Collectors.toSet());
        return questions.stream().allMatch(question -> answered.contains(question.id()));
    }

    public boolean meetsThreshold(double accuracy, int threshold) {
        return accuracy >= threshold;
    }
}
