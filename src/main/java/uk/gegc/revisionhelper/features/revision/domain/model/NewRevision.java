package uk.gegc.revisionhelper.features.revision.domain.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

/**
 * Creation payload for a revision. A null id is replaced by a generated one;
 * null counts take the configured defaults.
 */
public record NewRevision(
        String id,

        @NotBlank(message = "Revision name must not be blank")
        @Size(max = 255, message = "Revision name must not exceed 255 characters")
        String name,

        @NotBlank(message = "Subject must not be blank")
        @Size(max = 255, message = "Subject must not exceed 255 characters")
        String subject,

        List<String> topics,

        String description,

        @Min(value = 1, message = "Desired question count must be at least 1")
        Integer desiredQuestionCount,

        @Min(value = 0, message = "Accuracy threshold must be between 0 and 100")
        @Max(value = 100, message = "Accuracy threshold must be between 0 and 100")
        Integer accuracyThreshold,

        QuestionStyle questionStyle,

        Map<String, String> extractedTexts,

        List<String> uploadedFiles
) {
    public static NewRevision of(String name, String subject, String description,
                                 int desiredQuestionCount, int accuracyThreshold, QuestionStyle style) {
        return new NewRevision(null, name, subject, List.of(), description,
                desiredQuestionCount, accuracyThreshold, style, Map.of(), List.of());
    }
}
