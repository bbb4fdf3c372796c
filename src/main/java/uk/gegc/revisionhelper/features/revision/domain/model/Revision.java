package uk.gegc.revisionhelper.features.revision.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A reusable quiz definition. Exactly one of {@code userId} and {@code sessionId} is set.
 */
public record Revision(
        String id,
        String name,
        String subject,
        List<String> topics,
        String description,
        int desiredQuestionCount,
        int accuracyThreshold,
        QuestionStyle questionStyle,
        Map<String, String> extractedTexts,
        List<String> uploadedFiles,
        String userId,
        String sessionId,
        Instant createdAt
) {
    public Revision {
        topics = topics == null ? List.of() : List.copyOf(topics);
        extractedTexts = extractedTexts == null ? Map.of() : Map.copyOf(extractedTexts);
        uploadedFiles = uploadedFiles == null ? List.of() : List.copyOf(uploadedFiles);
        if (questionStyle == null) {
            questionStyle = QuestionStyle.FREE_TEXT;
        }
    }
}
